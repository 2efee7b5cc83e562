package com.EconLake.indicator_pipeline.validation;

import java.time.LocalDate;
import java.util.Set;

/**
 * Per-run inputs of the validator besides the record itself.
 *
 * @param minValue            inclusive lower plausible bound
 * @param maxValue            inclusive upper plausible bound
 * @param existingDates       dates already present in the persisted series
 * @param authorizedRevisions dates flagged as revised by change detection; these may overwrite
 */
public record ValidationRules(
		double minValue,
		double maxValue,
		Set<LocalDate> existingDates,
		Set<LocalDate> authorizedRevisions) {

	public ValidationRules {
		existingDates = Set.copyOf(existingDates);
		authorizedRevisions = Set.copyOf(authorizedRevisions);
	}
}
