package com.EconLake.indicator_pipeline.analytics;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DailyMetric(
		@JsonProperty("ref_date") LocalDate refDate,
		@JsonProperty("value") double value,
		@JsonProperty("daily_return_pct") Double dailyReturnPct,
		@JsonProperty("mtd_change_pct") Double mtdChangePct,
		@JsonProperty("sma_7") Double sma7,
		@JsonProperty("sma_30") Double sma30,
		@JsonProperty("sma_90") Double sma90,
		@JsonProperty("volatility_7d") Double volatility7d,
		@JsonProperty("rolling_volatility_30d") Double rollingVolatility30d,
		@JsonProperty("month_high") double monthHigh,
		@JsonProperty("month_low") double monthLow) {
}
