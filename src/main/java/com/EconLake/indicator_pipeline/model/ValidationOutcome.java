package com.EconLake.indicator_pipeline.model;

/**
 * Result of validating a single raw observation: either a typed observation or a quarantine entry.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Validated, ValidationOutcome.Quarantined {

	record Validated(ValidatedObservation observation) implements ValidationOutcome {
	}

	record Quarantined(QuarantineRecord record) implements ValidationOutcome {
	}
}
