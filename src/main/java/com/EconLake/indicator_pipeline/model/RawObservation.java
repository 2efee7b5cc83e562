package com.EconLake.indicator_pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One upstream observation exactly as received, before any validation.
 * The reference date is kept as text because the upstream may send a malformed date.
 */
public record RawObservation(
		String refDate,
		String rawValue,
		Map<String, String> rawPayload,
		Instant ingestTs) {

	public RawObservation {
		rawPayload = rawPayload == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(rawPayload));
	}
}
