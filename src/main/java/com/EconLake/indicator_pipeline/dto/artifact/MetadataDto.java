package com.EconLake.indicator_pipeline.dto.artifact;

import java.time.Instant;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MetadataDto(
		@JsonProperty("indicator") String indicator,
		@JsonProperty("display_name") String displayName,
		@JsonProperty("series_id") int seriesId,
		@JsonProperty("data_range") DataRange dataRange,
		@JsonProperty("quality_metrics") QualityMetrics qualityMetrics,
		@JsonProperty("generated_at") Instant generatedAt) {

	public record DataRange(
			@JsonProperty("start") LocalDate start,
			@JsonProperty("end") LocalDate end,
			@JsonProperty("total_records") int totalRecords) {
	}

	public record QualityMetrics(
			@JsonProperty("completeness") Double completeness,
			@JsonProperty("consistency") Double consistency,
			@JsonProperty("timeliness") Double timeliness,
			@JsonProperty("lag_days") Long lagDays,
			@JsonProperty("quarantined_records") int quarantinedRecords) {
	}
}
