package com.EconLake.indicator_pipeline.model;

import java.time.Instant;
import java.util.Map;

/**
 * A rejected observation. Quarantine records are append-only and never merge into the series.
 */
public record QuarantineRecord(
		String refDate,
		String rawValue,
		Map<String, String> rawPayload,
		DqReason dqReason,
		Instant ingestTs) {

	public static final String DQ_STATUS_INVALID = "invalid";

	public static QuarantineRecord of(RawObservation raw, DqReason reason) {
		return new QuarantineRecord(raw.refDate(), raw.rawValue(), raw.rawPayload(), reason, raw.ingestTs());
	}

	public String dqStatus() {
		return DQ_STATUS_INVALID;
	}
}
