package com.EconLake.indicator_pipeline.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One calendar month ({@code yyyy-MM}). {@code volatility} is the sample standard deviation of the daily
 * returns whose both observations fall inside the period.
 */
public record PeriodAggregation(
		@JsonProperty("period") String period,
		@JsonProperty("open") double open,
		@JsonProperty("high") double high,
		@JsonProperty("low") double low,
		@JsonProperty("close") double close,
		@JsonProperty("count") int count,
		@JsonProperty("average") Double average,
		@JsonProperty("volatility") Double volatility) {
}
