package com.EconLake.indicator_pipeline.analytics;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.dto.artifact.MetadataDto;
import com.EconLake.indicator_pipeline.model.IndicatorSeries;
import com.EconLake.indicator_pipeline.model.ValidationResult;

/**
 * Scores completeness, consistency and timeliness of a series for the metadata artifact.
 */
@Component
public class QualityScorer {

	private final int maxLagDays;

	@Autowired
	public QualityScorer(PipelineProperties properties) {
		this(properties.quality().maxLagDays());
	}

	public QualityScorer(int maxLagDays) {
		this.maxLagDays = maxLagDays;
	}

	/**
	 * @param series  the merged series after this run
	 * @param run     validation outcome of this run's batch
	 * @param runDate the date the run happened
	 */
	public MetadataDto.QualityMetrics score(IndicatorSeries series, ValidationResult run, LocalDate runDate) {
		Double completeness = null;
		Long lagDays = null;
		Double timeliness = null;
		if (!series.isEmpty()) {
			LocalDate start = series.first().orElseThrow().refDate();
			LocalDate end = series.last().orElseThrow().refDate();
			long expected = weekdaysBetween(start, end);
			completeness = expected == 0 ? 1.0 : Math.min(1.0, (double) series.size() / expected);
			lagDays = Math.max(0, ChronoUnit.DAYS.between(end, runDate));
			timeliness = lagDays <= maxLagDays ? 1.0 : (double) maxLagDays / lagDays;
		}
		double consistency = run.examined() == 0 ? 1.0 : (double) run.validated().size() / run.examined();
		return new MetadataDto.QualityMetrics(completeness, consistency, timeliness, lagDays,
				run.quarantined().size());
	}

	/**
	 * Monday to Friday dates in {@code [start, end]}.
	 */
	static long weekdaysBetween(LocalDate start, LocalDate end) {
		if (end.isBefore(start)) {
			return 0;
		}
		long days = ChronoUnit.DAYS.between(start, end) + 1;
		long weeks = days / 7;
		long count = weeks * 5;
		LocalDate cursor = start.plusDays(weeks * 7);
		while (!cursor.isAfter(end)) {
			DayOfWeek day = cursor.getDayOfWeek();
			if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
				count++;
			}
			cursor = cursor.plusDays(1);
		}
		return count;
	}
}
