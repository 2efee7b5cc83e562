package com.EconLake.indicator_pipeline.model;

import java.util.List;

/**
 * Aggregate outcome of a validation batch. {@code validated} is ordered by reference date,
 * {@code quarantined} keeps the order records arrived in.
 */
public record ValidationResult(
		List<ValidatedObservation> validated,
		List<QuarantineRecord> quarantined) {

	public ValidationResult {
		validated = List.copyOf(validated);
		quarantined = List.copyOf(quarantined);
	}

	public int examined() {
		return validated.size() + quarantined.size();
	}
}
