package com.EconLake.indicator_pipeline.dto.sgs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element of the SGS series response: {@code {"data":"02/01/2020","valor":"4.0207"}}.
 * Both fields are kept as text; the validator decides what they mean.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SgsObservationDto(
		@JsonProperty("data") String date,
		@JsonProperty("valor") String value) {
}
