package com.EconLake.indicator_pipeline.dto.artifact;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QuarantineRecordDto(
		@JsonProperty("series_id") int seriesId,
		@JsonProperty("ref_date") String refDate,
		@JsonProperty("value") String value,
		@JsonProperty("raw_payload") Map<String, String> rawPayload,
		@JsonProperty("dq_status") String dqStatus,
		@JsonProperty("dq_reason") String dqReason,
		@JsonProperty("ingest_ts") Instant ingestTs,
		@JsonProperty("source_file") String sourceFile) {
}
