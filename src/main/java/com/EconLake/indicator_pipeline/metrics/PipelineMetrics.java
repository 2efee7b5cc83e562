package com.EconLake.indicator_pipeline.metrics;

import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.model.ChangeKind;
import com.EconLake.indicator_pipeline.service.RunStatus;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Centralized metrics for pipeline runs.
 */
@Component
public class PipelineMetrics {

	private final MeterRegistry meterRegistry;
	private final Counter inFlightSharingCounter;
	private final Counter fetchFailureCounter;
	private final Counter parseFailureCounter;
	private final Counter persistenceFailureCounter;
	private final Counter checkpointConflictCounter;
	private final Counter rateLimitedCounter;
	private final Timer runTimer;

	public PipelineMetrics(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.inFlightSharingCounter = Counter.builder("indicator.pipeline.inflight.sharing")
				.description("Number of triggers that joined a run already in flight for the same indicator")
				.register(meterRegistry);

		this.fetchFailureCounter = Counter.builder("indicator.pipeline.errors.fetch")
				.description("Runs that failed because the upstream could not be reached")
				.tag("error_type", "fetch")
				.register(meterRegistry);

		this.parseFailureCounter = Counter.builder("indicator.pipeline.errors.parse")
				.description("Runs that failed on a malformed upstream payload")
				.tag("error_type", "parse")
				.register(meterRegistry);

		this.persistenceFailureCounter = Counter.builder("indicator.pipeline.errors.persistence")
				.description("Runs that failed to write artifacts after retries")
				.tag("error_type", "persistence")
				.register(meterRegistry);

		this.checkpointConflictCounter = Counter.builder("indicator.pipeline.checkpoint.conflicts")
				.description("Checkpoint compare-and-swap attempts lost to a concurrent run")
				.register(meterRegistry);

		this.rateLimitedCounter = Counter.builder("indicator.pipeline.triggers.rate_limited")
				.description("Manual triggers rejected by the rate limiter (429)")
				.register(meterRegistry);

		this.runTimer = Timer.builder("indicator.pipeline.run.duration")
				.description("Time taken by a pipeline run (fetch to checkpoint commit)")
				.register(meterRegistry);
	}

	public void recordRun(String indicator, RunStatus status, ChangeKind changeKind) {
		Counter.builder("indicator.pipeline.runs")
				.description("Completed pipeline runs")
				.tag("indicator", indicator)
				.tag("status", status.name())
				.tag("change_kind", changeKind.code())
				.register(meterRegistry)
				.increment();
	}

	public void recordQuarantined(String indicator, int count) {
		Counter.builder("indicator.pipeline.records.quarantined")
				.description("Records routed to quarantine")
				.tag("indicator", indicator)
				.register(meterRegistry)
				.increment(count);
	}

	public void recordInFlightSharing() {
		inFlightSharingCounter.increment();
	}

	public void recordFetchFailure() {
		fetchFailureCounter.increment();
	}

	public void recordParseFailure() {
		parseFailureCounter.increment();
	}

	public void recordPersistenceFailure() {
		persistenceFailureCounter.increment();
	}

	public void recordCheckpointConflict() {
		checkpointConflictCounter.increment();
	}

	public void recordRateLimited() {
		rateLimitedCounter.increment();
	}

	public Timer.Sample startTimer() {
		return Timer.start();
	}

	public void stopTimer(Timer.Sample sample) {
		sample.stop(runTimer);
	}
}
