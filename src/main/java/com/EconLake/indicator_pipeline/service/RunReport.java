package com.EconLake.indicator_pipeline.service;

import java.time.Instant;

import com.EconLake.indicator_pipeline.model.ChangeKind;

/**
 * Outcome of one pipeline run for one indicator.
 *
 * @param fetched      raw records in the upstream snapshot
 * @param examined     records handed to validation
 * @param seriesLength length of the validated series after the run, or of the persisted one when nothing changed
 * @param bronzeKey    key of the raw snapshot written by this run, {@code null} when nothing was written
 */
public record RunReport(
		String indicator,
		String runId,
		RunStatus status,
		ChangeKind changeKind,
		int fetched,
		int examined,
		int validated,
		int quarantined,
		int seriesLength,
		String bronzeKey,
		Instant startedAt,
		Instant finishedAt) {
}
