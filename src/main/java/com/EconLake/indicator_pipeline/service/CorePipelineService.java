package com.EconLake.indicator_pipeline.service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.analytics.AnalyticsEngine;
import com.EconLake.indicator_pipeline.analytics.AnalyticsReport;
import com.EconLake.indicator_pipeline.analytics.QualityScorer;
import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.config.PipelineProperties.IndicatorDefinition;
import com.EconLake.indicator_pipeline.config.PipelineProperties.UnknownIndicatorException;
import com.EconLake.indicator_pipeline.connectors.SgsClient;
import com.EconLake.indicator_pipeline.detection.ChangeDetector;
import com.EconLake.indicator_pipeline.dto.artifact.MetadataDto;
import com.EconLake.indicator_pipeline.exception.PersistenceException;
import com.EconLake.indicator_pipeline.mapper.ArtifactMapper;
import com.EconLake.indicator_pipeline.mapper.RawObservationMapper;
import com.EconLake.indicator_pipeline.model.ChangeDecision;
import com.EconLake.indicator_pipeline.model.ChangeKind;
import com.EconLake.indicator_pipeline.model.Checkpoint;
import com.EconLake.indicator_pipeline.model.IndicatorSeries;
import com.EconLake.indicator_pipeline.model.RawObservation;
import com.EconLake.indicator_pipeline.model.ValidatedObservation;
import com.EconLake.indicator_pipeline.model.ValidationResult;
import com.EconLake.indicator_pipeline.storage.ArtifactBatch;
import com.EconLake.indicator_pipeline.storage.ArtifactLayout;
import com.EconLake.indicator_pipeline.storage.ArtifactStore;
import com.EconLake.indicator_pipeline.storage.StateStore;
import com.EconLake.indicator_pipeline.validation.ObservationValidator;
import com.EconLake.indicator_pipeline.validation.ValidationRules;
import com.fasterxml.jackson.core.type.TypeReference;

import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Core pipeline containing the run logic: fetch, detect, validate, analyze, persist, commit.
 * It has no knowledge of metrics or rate limiting.
 *
 * <p>The checkpoint is committed strictly after every artifact of the run has been published, so a run
 * that fails at any earlier point leaves the checkpoint where it was and the next trigger starts over
 * from it. A run that loses the checkpoint race to another run publishes no artifacts at all.
 */
@Component
public class CorePipelineService {

	private static final Logger logger = LoggerFactory.getLogger(CorePipelineService.class);

	private static final TypeReference<List<ValidatedObservation>> SERIES_TYPE = new TypeReference<>() {
	};

	private final PipelineProperties properties;
	private final SgsClient sgsClient;
	private final RawObservationMapper rawMapper;
	private final ArtifactMapper artifactMapper;
	private final ChangeDetector changeDetector;
	private final ObservationValidator validator;
	private final AnalyticsEngine analyticsEngine;
	private final QualityScorer qualityScorer;
	private final ArtifactStore artifactStore;
	private final StateStore stateStore;
	private final ArtifactLayout layout;
	private final Retry artifactWriteRetry;
	private final Clock clock;
	private PipelineEventObserver eventObserver;
	private final ConcurrentHashMap<String, Mono<RunReport>> inFlightRuns = new ConcurrentHashMap<>();

	public CorePipelineService(
			PipelineProperties properties,
			SgsClient sgsClient,
			RawObservationMapper rawMapper,
			ArtifactMapper artifactMapper,
			ChangeDetector changeDetector,
			ObservationValidator validator,
			AnalyticsEngine analyticsEngine,
			QualityScorer qualityScorer,
			ArtifactStore artifactStore,
			StateStore stateStore,
			ArtifactLayout layout,
			Retry artifactWriteRetry,
			Clock clock) {
		this.properties = properties;
		this.sgsClient = sgsClient;
		this.rawMapper = rawMapper;
		this.artifactMapper = artifactMapper;
		this.changeDetector = changeDetector;
		this.validator = validator;
		this.analyticsEngine = analyticsEngine;
		this.qualityScorer = qualityScorer;
		this.artifactStore = artifactStore;
		this.stateStore = stateStore;
		this.layout = layout;
		this.artifactWriteRetry = artifactWriteRetry;
		this.clock = clock;
	}

	public void setObserver(PipelineEventObserver observer) {
		this.eventObserver = observer;
	}

	public Set<String> indicators() {
		return properties.indicators().keySet();
	}

	/**
	 * Runs the pipeline once for an indicator. A trigger arriving while a run for the same indicator is in
	 * flight joins that run instead of starting a second one.
	 *
	 * @param indicator configured indicator name (e.g., "usdbrl")
	 * @return Mono with the run report; fails with FetchException, UpstreamParseException,
	 *         PersistenceException or UnknownIndicatorException
	 */
	public Mono<RunReport> run(String indicator) {
		IndicatorDefinition definition;
		try {
			definition = properties.indicator(indicator);
		} catch (UnknownIndicatorException ex) {
			return Mono.error(ex);
		}

		Mono<RunReport> inFlight = inFlightRuns.get(indicator);
		if (inFlight != null) {
			logger.debug("Run already in flight for indicator: {}, sharing it", indicator);
			if (eventObserver != null) {
				eventObserver.onInFlightSharing(indicator);
			}
			return inFlight;
		}

		Mono<RunReport> runOperation = Mono.defer(() -> execute(indicator, definition))
				.doOnError(ex -> logger.error("Pipeline run failed for indicator: {}", indicator, ex))
				.cache()
				.doFinally(signalType -> {
					inFlightRuns.remove(indicator);
					logger.debug("Removed in-flight run for indicator: {} (signal: {})", indicator, signalType);
				});

		Mono<RunReport> existing = inFlightRuns.putIfAbsent(indicator, runOperation);
		if (existing != null) {
			logger.debug("Another thread started a run for indicator: {}, using it", indicator);
			if (eventObserver != null) {
				eventObserver.onInFlightSharing(indicator);
			}
			return existing;
		}

		return runOperation;
	}

	private Mono<RunReport> execute(String indicator, IndicatorDefinition definition) {
		Instant startedAt = clock.instant();
		String runId = UUID.randomUUID().toString();
		logger.info("Starting run {} for indicator: {} (series {})", runId, indicator, definition.seriesId());

		return blocking(() -> stateStore.load(indicator), "Could not read checkpoint for " + indicator)
				.flatMap(checkpoint -> sgsClient.getSeries(definition.seriesId(), definition.startDate())
						.map(observations -> rawMapper.toRawObservations(observations, startedAt))
						.flatMap(snapshot -> {
							RunContext context = new RunContext(indicator, definition, runId, startedAt, snapshot,
									checkpoint.orElse(null),
									changeDetector.detect(snapshot, checkpoint.orElse(null)));
							if (!context.decision().changed()) {
								return blocking(() -> unchanged(context),
										"Could not read series for " + indicator);
							}
							return blocking(() -> prepare(context), "Could not read series for " + indicator)
									.flatMap(this::publishAndCommit);
						}));
	}

	private RunReport unchanged(RunContext context) throws IOException {
		int seriesLength = readSeries(context.indicator()).size();
		logger.info("No upstream change for indicator: {} ({} records fetched)", context.indicator(),
				context.snapshot().size());
		return new RunReport(context.indicator(), context.runId(), RunStatus.NO_CHANGE, ChangeKind.NONE,
				context.snapshot().size(), 0, 0, 0, seriesLength, null, context.startedAt(), clock.instant());
	}

	private PreparedRun prepare(RunContext context) throws IOException {
		String indicator = context.indicator();
		IndicatorDefinition definition = context.definition();
		ChangeDecision decision = context.decision();
		logger.info("Detected {} for indicator: {} ({} appended, {} revised)", decision.kind().code(), indicator,
				decision.appendedDates().size(), decision.revisedDates().size());

		IndicatorSeries persisted = readSeries(indicator);
		ValidationRules rules = new ValidationRules(definition.minValue(), definition.maxValue(),
				persisted.dates(), decision.revisedDates());
		ValidationResult result = validator.validateAll(decision.batch(), rules);
		if (!result.quarantined().isEmpty() && eventObserver != null) {
			eventObserver.onRecordsQuarantined(indicator, result.quarantined().size());
		}

		IndicatorSeries merged = persisted.merge(result.validated());
		AnalyticsReport analytics = analyticsEngine.analyze(merged);
		LocalDate runDate = LocalDate.ofInstant(context.startedAt(), ZoneOffset.UTC);

		String bronzeKey = layout.bronzeKey(indicator, context.startedAt(), context.runId());
		ArtifactBatch batch = new ArtifactBatch()
				.create(bronzeKey, artifactMapper.toBronze(definition.seriesId(), context.snapshot()));
		if (!result.quarantined().isEmpty()) {
			batch.create(layout.quarantineKey(indicator, context.startedAt(), context.runId()),
					artifactMapper.toQuarantine(definition.seriesId(), result.quarantined(), bronzeKey));
		}
		batch.put(layout.silverSeriesKey(indicator), merged.observations())
				.put(layout.technicalKey(indicator), analytics.technical().asMap())
				.put(layout.seasonalKey(indicator), analytics.seasonal())
				.put(layout.monthlyKey(indicator), analytics.monthly())
				.put(layout.yearlyKey(indicator), analytics.yearly())
				.put(layout.dailyKey(indicator), analytics.daily())
				.put(layout.summaryKey(indicator), analytics.summary())
				.put(layout.metadataKey(indicator), new MetadataDto(
						indicator,
						definition.displayName(),
						definition.seriesId(),
						merged.isEmpty() ? null : new MetadataDto.DataRange(
								merged.first().orElseThrow().refDate(),
								merged.last().orElseThrow().refDate(),
								merged.size()),
						qualityScorer.score(merged, result, runDate),
						context.startedAt()));

		return new PreparedRun(context, batch, result, merged, bronzeKey);
	}

	/**
	 * Publishes the run's artifacts and advances the checkpoint as one step under the indicator's state
	 * lock. A run whose checkpoint moved since it was loaded publishes nothing, so it cannot replace a
	 * newer series with its own stale merge.
	 */
	private Mono<RunReport> publishAndCommit(PreparedRun prepared) {
		RunContext context = prepared.context();
		String indicator = context.indicator();
		Checkpoint next = changeDetector.checkpointFor(indicator, context.snapshot(), clock.instant());
		String expectedHash = context.checkpoint() == null ? null : context.checkpoint().contentHash();

		return Mono.fromCallable(() -> stateStore.commitIfCurrent(indicator, expectedHash, next,
						() -> artifactStore.write(prepared.batch())))
				.subscribeOn(Schedulers.boundedElastic())
				.doOnError(ex -> logger.warn("Artifact publish failed for indicator: {} - {}", indicator,
						ex.getMessage()))
				.transformDeferred(RetryOperator.of(artifactWriteRetry))
				.onErrorMap(ex -> !(ex instanceof PersistenceException),
						ex -> new PersistenceException("Could not write artifacts for " + indicator, ex))
				.map(committed -> report(prepared, committed));
	}

	private RunReport report(PreparedRun prepared, boolean committed) {
		RunContext context = prepared.context();
		String indicator = context.indicator();
		RunStatus status;
		if (committed) {
			status = RunStatus.COMMITTED;
			logger.info("Committed {} run for indicator: {} - {} artifacts, {} validated, {} quarantined, "
					+ "series length {}", context.decision().kind().code(), indicator,
					prepared.batch().keys().size(), prepared.result().validated().size(),
					prepared.result().quarantined().size(), prepared.series().size());
		} else {
			status = RunStatus.CONFLICT;
			logger.warn("Checkpoint for indicator: {} moved during run {}; publishing nothing", indicator,
					context.runId());
			if (eventObserver != null) {
				eventObserver.onCheckpointConflict(indicator);
			}
		}

		return new RunReport(
				indicator,
				context.runId(),
				status,
				context.decision().kind(),
				context.snapshot().size(),
				prepared.result().examined(),
				prepared.result().validated().size(),
				prepared.result().quarantined().size(),
				prepared.series().size(),
				committed ? prepared.bronzeKey() : null,
				context.startedAt(),
				clock.instant());
	}

	private IndicatorSeries readSeries(String indicator) throws IOException {
		return artifactStore.read(layout.silverSeriesKey(indicator), SERIES_TYPE)
				.map(observations -> IndicatorSeries.of(indicator, observations))
				.orElseGet(() -> IndicatorSeries.empty(indicator));
	}

	private static <T> Mono<T> blocking(IoCallable<T> callable, String failureMessage) {
		return Mono.fromCallable(callable::call)
				.subscribeOn(Schedulers.boundedElastic())
				.onErrorMap(IOException.class, ex -> new PersistenceException(failureMessage, ex));
	}

	@FunctionalInterface
	private interface IoCallable<T> {
		T call() throws IOException;
	}

	private record RunContext(
			String indicator,
			IndicatorDefinition definition,
			String runId,
			Instant startedAt,
			List<RawObservation> snapshot,
			Checkpoint checkpoint,
			ChangeDecision decision) {
	}

	private record PreparedRun(
			RunContext context,
			ArtifactBatch batch,
			ValidationResult result,
			IndicatorSeries series,
			String bronzeKey) {
	}
}
