package com.EconLake.indicator_pipeline.model;

import java.time.Instant;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidatedObservation(
		@JsonProperty("refDate") LocalDate refDate,
		@JsonProperty("value") double value,
		@JsonProperty("ingestTs") Instant ingestTs) {
}
