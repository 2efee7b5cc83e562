package com.EconLake.indicator_pipeline.dto.artifact;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw snapshot entry, persisted verbatim with its ingestion timestamp.
 */
public record BronzeRecordDto(
		@JsonProperty("series_id") int seriesId,
		@JsonProperty("ref_date") String refDate,
		@JsonProperty("value") String value,
		@JsonProperty("raw_payload") Map<String, String> rawPayload,
		@JsonProperty("ingest_ts") Instant ingestTs) {
}
