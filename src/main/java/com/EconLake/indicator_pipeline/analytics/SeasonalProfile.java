package com.EconLake.indicator_pipeline.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Values grouped by weekday and, independently, by calendar month. Buckets are keyed by English names
 * ("Monday", "January") in calendar order; empty buckets are left out.
 */
public record SeasonalProfile(
		@JsonProperty("weekday_patterns") Map<String, SeasonalBucket> weekdayPatterns,
		@JsonProperty("monthly_patterns") Map<String, SeasonalBucket> monthlyPatterns) {

	public SeasonalProfile {
		weekdayPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(weekdayPatterns));
		monthlyPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(monthlyPatterns));
	}
}
