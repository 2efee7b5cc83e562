package com.EconLake.indicator_pipeline.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One calendar year ({@code yyyy}); the month fields plus the open-to-close return in percent.
 */
public record YearlyAggregation(
		@JsonProperty("period") String period,
		@JsonProperty("open") double open,
		@JsonProperty("high") double high,
		@JsonProperty("low") double low,
		@JsonProperty("close") double close,
		@JsonProperty("count") int count,
		@JsonProperty("average") Double average,
		@JsonProperty("volatility") Double volatility,
		@JsonProperty("yearly_return") Double yearlyReturn) {
}
