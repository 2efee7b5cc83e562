package com.EconLake.indicator_pipeline.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.EconLake.indicator_pipeline.dto.artifact.MetadataDto;
import com.EconLake.indicator_pipeline.model.DqReason;
import com.EconLake.indicator_pipeline.model.IndicatorSeries;
import com.EconLake.indicator_pipeline.model.QuarantineRecord;
import com.EconLake.indicator_pipeline.model.RawObservation;
import com.EconLake.indicator_pipeline.model.ValidatedObservation;
import com.EconLake.indicator_pipeline.model.ValidationResult;

class QualityScorerTest {

	private static final Instant INGEST_TS = Instant.parse("2024-01-12T09:00:00Z");

	private final QualityScorer scorer = new QualityScorer(4);

	@Test
	void weekdaysBetween_CountsMondayToFridayInclusive() {
		// Monday 1 Jan to Friday 12 Jan 2024
		assertThat(QualityScorer.weekdaysBetween(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 12))).isEqualTo(10);
		// Saturday to Sunday
		assertThat(QualityScorer.weekdaysBetween(LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 7))).isZero();
		assertThat(QualityScorer.weekdaysBetween(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 3))).isEqualTo(1);
	}

	@Test
	void score_CompleteFreshSeriesWithCleanRun() {
		IndicatorSeries series = weekdays(LocalDate.of(2024, 1, 1), 10);
		ValidationResult run = new ValidationResult(series.observations(), List.of());

		MetadataDto.QualityMetrics metrics = scorer.score(series, run, LocalDate.of(2024, 1, 12));

		assertThat(metrics.completeness()).isEqualTo(1.0);
		assertThat(metrics.consistency()).isEqualTo(1.0);
		assertThat(metrics.timeliness()).isEqualTo(1.0);
		assertThat(metrics.lagDays()).isZero();
		assertThat(metrics.quarantinedRecords()).isZero();
	}

	@Test
	void score_GapsQuarantineAndStalenessLowerTheScores() {
		IndicatorSeries series = IndicatorSeries.of("usdbrl", List.of(
				new ValidatedObservation(LocalDate.of(2024, 1, 1), 5.0, INGEST_TS),
				new ValidatedObservation(LocalDate.of(2024, 1, 12), 5.1, INGEST_TS)));
		RawObservation bad = new RawObservation("2024-01-05", "N/A", null, INGEST_TS);
		ValidationResult run = new ValidationResult(
				List.of(series.observations().get(1)),
				List.of(QuarantineRecord.of(bad, DqReason.MISSING_VALUE)));

		MetadataDto.QualityMetrics metrics = scorer.score(series, run, LocalDate.of(2024, 1, 20));

		assertThat(metrics.completeness()).isCloseTo(0.2, within(1e-12));
		assertThat(metrics.consistency()).isCloseTo(0.5, within(1e-12));
		assertThat(metrics.lagDays()).isEqualTo(8L);
		assertThat(metrics.timeliness()).isCloseTo(0.5, within(1e-12));
		assertThat(metrics.quarantinedRecords()).isEqualTo(1);
	}

	@Test
	void score_EmptySeriesHasNoRangeBasedMetrics() {
		MetadataDto.QualityMetrics metrics = scorer.score(IndicatorSeries.empty("usdbrl"),
				new ValidationResult(List.of(), List.of()), LocalDate.of(2024, 1, 12));

		assertThat(metrics.completeness()).isNull();
		assertThat(metrics.timeliness()).isNull();
		assertThat(metrics.consistency()).isEqualTo(1.0);
	}

	private static IndicatorSeries weekdays(LocalDate from, int count) {
		List<ValidatedObservation> observations = new ArrayList<>();
		LocalDate date = from;
		while (observations.size() < count) {
			if (date.getDayOfWeek().getValue() <= 5) {
				observations.add(new ValidatedObservation(date, 5.0 + observations.size() * 0.01, INGEST_TS));
			}
			date = date.plusDays(1);
		}
		return IndicatorSeries.of("usdbrl", observations);
	}
}
