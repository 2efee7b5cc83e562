package com.EconLake.indicator_pipeline.model;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last committed processing marker for one indicator.
 *
 * <p>{@code recordedWindow} holds the trailing raw points up to {@code lastRefDate} as they were when the
 * checkpoint was committed; {@code contentHash} is the SHA-256 of that window and is the key used for
 * compare-and-swap updates.
 */
public record Checkpoint(
		@JsonProperty("indicator") String indicator,
		@JsonProperty("lastRefDate") String lastRefDate,
		@JsonProperty("lastValue") String lastValue,
		@JsonProperty("contentHash") String contentHash,
		@JsonProperty("updatedAt") Instant updatedAt,
		@JsonProperty("recordedWindow") List<WindowPoint> recordedWindow) {

	public Checkpoint {
		recordedWindow = recordedWindow == null ? List.of() : List.copyOf(recordedWindow);
	}

	public record WindowPoint(
			@JsonProperty("refDate") String refDate,
			@JsonProperty("rawValue") String rawValue) {
	}
}
