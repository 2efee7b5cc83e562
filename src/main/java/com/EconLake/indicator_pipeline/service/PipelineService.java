package com.EconLake.indicator_pipeline.service;

import java.util.Optional;
import java.util.Set;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.github.benmanes.caffeine.cache.Cache;

import com.EconLake.indicator_pipeline.config.PipelineProperties.UnknownIndicatorException;
import com.EconLake.indicator_pipeline.exception.FetchException;
import com.EconLake.indicator_pipeline.exception.PersistenceException;
import com.EconLake.indicator_pipeline.exception.RateLimitExceededException;
import com.EconLake.indicator_pipeline.exception.UpstreamParseException;
import com.EconLake.indicator_pipeline.metrics.PipelineMetrics;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Mono;

/**
 * Decorator service that wraps CorePipelineService with metrics, rate limiting of manual triggers and
 * the latest-run cache.
 *
 * Implements Decorator Pattern (wraps the core run) and Observer Pattern (receives business events from
 * the core service for metrics recording).
 */
@Service
public class PipelineService implements PipelineEventObserver {

	private static final Logger logger = LoggerFactory.getLogger(PipelineService.class);

	private final CorePipelineService coreService;
	private final PipelineMetrics metrics;
	private final RateLimiter rateLimiter;
	private final Cache<String, RunReport> runReportCache;

	public PipelineService(
			CorePipelineService coreService,
			PipelineMetrics metrics,
			RateLimiter rateLimiter,
			Cache<String, RunReport> runReportCache) {
		this.coreService = coreService;
		this.metrics = metrics;
		this.rateLimiter = rateLimiter;
		this.runReportCache = runReportCache;
	}

	@PostConstruct
	public void wireObserver() {
		coreService.setObserver(this);
	}

	@Override
	public void onInFlightSharing(String indicator) {
		metrics.recordInFlightSharing();
	}

	@Override
	public void onRecordsQuarantined(String indicator, int count) {
		metrics.recordQuarantined(indicator, count);
	}

	@Override
	public void onCheckpointConflict(String indicator) {
		metrics.recordCheckpointConflict();
	}

	public Set<String> indicators() {
		return coreService.indicators();
	}

	/**
	 * Operator-initiated run. Subject to the manual trigger rate limit.
	 */
	public Mono<RunReport> trigger(String indicator) {
		Mono<RunReport> limited = Mono.defer(() -> coreService.run(indicator))
				.transformDeferred(RateLimiterOperator.of(rateLimiter))
				.onErrorMap(RequestNotPermitted.class, ex -> {
					metrics.recordRateLimited();
					return new RateLimitExceededException(
							"Manual trigger limit reached for " + indicator + "; try again later");
				});
		return instrumented(indicator, limited);
	}

	/**
	 * Fetch-tick run. Not rate limited.
	 */
	public Mono<RunReport> runScheduled(String indicator) {
		return instrumented(indicator, coreService.run(indicator));
	}

	public Optional<RunReport> latest(String indicator) {
		return Optional.ofNullable(runReportCache.getIfPresent(indicator));
	}

	private Mono<RunReport> instrumented(String indicator, Mono<RunReport> run) {
		Timer.Sample sample = metrics.startTimer();
		return run
				.doOnSuccess(report -> {
					if (report != null) {
						runReportCache.put(indicator, report);
						metrics.recordRun(indicator, report.status(), report.changeKind());
						logger.debug("Run {} for indicator: {} finished with status {}", report.runId(), indicator,
								report.status());
					}
				})
				.doOnError(FetchException.class, ex -> metrics.recordFetchFailure())
				.doOnError(UpstreamParseException.class, ex -> metrics.recordParseFailure())
				.doOnError(PersistenceException.class, ex -> metrics.recordPersistenceFailure())
				.doOnError(Exception.class, ex -> {
					if (!(ex instanceof FetchException) && !(ex instanceof UpstreamParseException)
							&& !(ex instanceof PersistenceException) && !(ex instanceof RateLimitExceededException)
							&& !(ex instanceof UnknownIndicatorException)) {
						logger.error("Unexpected error type for indicator: {}", indicator, ex);
					}
				})
				.doFinally(signalType -> {
					metrics.stopTimer(sample);
					logger.debug("Completed run for indicator: {} with signal: {}", indicator, signalType);
				});
	}
}
