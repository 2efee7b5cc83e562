package com.EconLake.indicator_pipeline.analytics;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time technical indicators for the latest observation. A metric that needs more history than
 * the series has is {@code null}.
 */
public record TechnicalSnapshot(
		@JsonProperty("latest_value") Double latestValue,
		@JsonProperty("sma_7") Double sma7,
		@JsonProperty("sma_30") Double sma30,
		@JsonProperty("sma_90") Double sma90,
		@JsonProperty("avg_daily_return") Double avgDailyReturn,
		@JsonProperty("daily_volatility") Double dailyVolatility,
		@JsonProperty("annualized_volatility") Double annualizedVolatility,
		@JsonProperty("rolling_volatility_30d") Double rollingVolatility30d,
		@JsonProperty("momentum_7") Double momentum7,
		@JsonProperty("momentum_30") Double momentum30,
		@JsonProperty("max_daily_gain") Double maxDailyGain,
		@JsonProperty("max_daily_loss") Double maxDailyLoss,
		@JsonProperty("max_drawdown_pct") Double maxDrawdownPct,
		@JsonProperty("support_level") Double supportLevel,
		@JsonProperty("resistance_level") Double resistanceLevel,
		@JsonProperty("trend_slope") Double trendSlope,
		@JsonProperty("trend_direction") String trendDirection,
		@JsonProperty("rsi_14") Double rsi14) {

	public static final String BULLISH = "bullish";
	public static final String BEARISH = "bearish";
	public static final String SIDEWAYS = "sideways";

	/**
	 * Metric name to value, in declaration order.
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> metrics = new LinkedHashMap<>();
		metrics.put("latest_value", latestValue);
		metrics.put("sma_7", sma7);
		metrics.put("sma_30", sma30);
		metrics.put("sma_90", sma90);
		metrics.put("avg_daily_return", avgDailyReturn);
		metrics.put("daily_volatility", dailyVolatility);
		metrics.put("annualized_volatility", annualizedVolatility);
		metrics.put("rolling_volatility_30d", rollingVolatility30d);
		metrics.put("momentum_7", momentum7);
		metrics.put("momentum_30", momentum30);
		metrics.put("max_daily_gain", maxDailyGain);
		metrics.put("max_daily_loss", maxDailyLoss);
		metrics.put("max_drawdown_pct", maxDrawdownPct);
		metrics.put("support_level", supportLevel);
		metrics.put("resistance_level", resistanceLevel);
		metrics.put("trend_slope", trendSlope);
		metrics.put("trend_direction", trendDirection);
		metrics.put("rsi_14", rsi14);
		return metrics;
	}
}
