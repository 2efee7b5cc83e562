package com.EconLake.indicator_pipeline.analytics;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headline figures for the latest observation: trend, momentum, volatility and risk.
 */
public record IndicatorSummary(
		@JsonProperty("indicator") String indicator,
		@JsonProperty("latest_date") LocalDate latestDate,
		@JsonProperty("latest_value") Double latestValue,
		@JsonProperty("daily_change_pct") Double dailyChangePct,
		@JsonProperty("trend_direction") String trendDirection,
		@JsonProperty("trend_slope") Double trendSlope,
		@JsonProperty("momentum_7") Double momentum7,
		@JsonProperty("momentum_30") Double momentum30,
		@JsonProperty("daily_volatility") Double dailyVolatility,
		@JsonProperty("annualized_volatility") Double annualizedVolatility,
		@JsonProperty("rsi_14") Double rsi14,
		@JsonProperty("max_drawdown_pct") Double maxDrawdownPct,
		@JsonProperty("max_daily_loss") Double maxDailyLoss,
		@JsonProperty("support_level") Double supportLevel,
		@JsonProperty("resistance_level") Double resistanceLevel) {
}
