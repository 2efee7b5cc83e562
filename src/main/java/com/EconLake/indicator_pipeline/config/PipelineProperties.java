package com.EconLake.indicator_pipeline.config;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline settings (pipeline.*). Storage names and indicator bounds are injected here at start-up
 * so nothing below the service layer hard-codes them.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
		@NotEmpty @Valid Map<String, IndicatorDefinition> indicators,
		@Valid Detection detection,
		@Valid Validation validation,
		@Valid Analytics analytics,
		@Valid Quality quality,
		@Valid Storage storage,
		@Valid Persistence persistence,
		@Valid Schedule schedule,
		@Valid Trigger trigger) {

	public PipelineProperties {
		indicators = indicators == null ? Map.of() : new LinkedHashMap<>(indicators);
		detection = detection == null ? new Detection(null) : detection;
		validation = validation == null ? new Validation(null) : validation;
		analytics = analytics == null ? new Analytics(null) : analytics;
		quality = quality == null ? new Quality(null) : quality;
		storage = storage == null ? new Storage(null, null, null, null, null, null) : storage;
		persistence = persistence == null ? new Persistence(null, null, null) : persistence;
		schedule = schedule == null ? new Schedule(null) : schedule;
		trigger = trigger == null ? new Trigger(null) : trigger;
	}

	/**
	 * Looks up an indicator definition by name.
	 *
	 * @throws UnknownIndicatorException if the indicator is not configured
	 */
	public IndicatorDefinition indicator(String name) {
		IndicatorDefinition definition = indicators.get(name);
		if (definition == null) {
			throw new UnknownIndicatorException(name);
		}
		return definition;
	}

	public record IndicatorDefinition(
			@NotNull Integer seriesId,
			String displayName,
			@NotNull Double minValue,
			@NotNull Double maxValue,
			@DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate) {

		public IndicatorDefinition {
			startDate = startDate == null ? LocalDate.of(2020, 1, 1) : startDate;
		}

		@AssertTrue(message = "minValue must not exceed maxValue")
		public boolean isBoundsOrdered() {
			return minValue == null || maxValue == null || minValue <= maxValue;
		}
	}

	public record Detection(@Min(1) Integer windowSize) {
		public Detection {
			windowSize = windowSize == null ? 30 : windowSize;
		}
	}

	public record Validation(List<String> missingSentinels) {
		public Validation {
			missingSentinels = missingSentinels == null
					? List.of("N/A", "NA", "NaN", "null", "-", "nd", "Infinity", "-Infinity")
					: List.copyOf(missingSentinels);
		}
	}

	public record Analytics(Double trendThresholdRatio) {
		public Analytics {
			trendThresholdRatio = trendThresholdRatio == null ? 0.0001 : trendThresholdRatio;
		}
	}

	public record Quality(@Min(0) Integer maxLagDays) {
		public Quality {
			maxLagDays = maxLagDays == null ? 4 : maxLagDays;
		}
	}

	public record Storage(
			String root,
			String bronzePrefix,
			String silverPrefix,
			String quarantinePrefix,
			String goldPrefix,
			String checkpointPrefix) {

		public Storage {
			root = root == null ? "./data-lake" : root;
			bronzePrefix = bronzePrefix == null ? "bronze" : bronzePrefix;
			silverPrefix = silverPrefix == null ? "silver" : silverPrefix;
			quarantinePrefix = quarantinePrefix == null ? "quarantine" : quarantinePrefix;
			goldPrefix = goldPrefix == null ? "gold" : goldPrefix;
			checkpointPrefix = checkpointPrefix == null ? "state" : checkpointPrefix;
		}
	}

	public record Persistence(@Min(1) Integer maxAttempts, Duration initialBackoff, Double backoffMultiplier) {
		public Persistence {
			maxAttempts = maxAttempts == null ? 3 : maxAttempts;
			initialBackoff = initialBackoff == null ? Duration.ofMillis(200) : initialBackoff;
			backoffMultiplier = backoffMultiplier == null ? 2.0 : backoffMultiplier;
		}
	}

	public record Schedule(String cron) {
		public Schedule {
			cron = cron == null ? "0 0 9 * * *" : cron;
		}
	}

	public record Trigger(@Min(1) Integer limitPerMinute) {
		public Trigger {
			limitPerMinute = limitPerMinute == null ? 30 : limitPerMinute;
		}
	}

	/**
	 * Thrown when a run is requested for an indicator that has no configuration.
	 */
	public static class UnknownIndicatorException extends RuntimeException {
		public UnknownIndicatorException(String indicator) {
			super("Unknown indicator: " + indicator);
		}
	}
}
