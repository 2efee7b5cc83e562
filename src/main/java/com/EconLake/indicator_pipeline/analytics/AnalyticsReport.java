package com.EconLake.indicator_pipeline.analytics;

import java.util.List;

/**
 * Everything derived from one series. Fully recomputed on each run.
 */
public record AnalyticsReport(
		TechnicalSnapshot technical,
		SeasonalProfile seasonal,
		List<PeriodAggregation> monthly,
		List<YearlyAggregation> yearly,
		List<DailyMetric> daily,
		IndicatorSummary summary) {

	public AnalyticsReport {
		monthly = List.copyOf(monthly);
		yearly = List.copyOf(yearly);
		daily = List.copyOf(daily);
	}
}
