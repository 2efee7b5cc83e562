package com.EconLake.indicator_pipeline.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SeasonalBucket(
		@JsonProperty("average") Double average,
		@JsonProperty("count") int count,
		@JsonProperty("volatility") Double volatility) {
}
