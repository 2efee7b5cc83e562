package com.EconLake.indicator_pipeline.model;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of comparing a fresh raw snapshot with the last committed checkpoint.
 *
 * @param kind          what kind of change was found
 * @param appendedDates dates newer than the checkpoint
 * @param revisedDates  already-recorded dates whose upstream value changed
 * @param batch         the raw records that must go through validation for this change
 */
public record ChangeDecision(
		ChangeKind kind,
		SortedSet<LocalDate> appendedDates,
		SortedSet<LocalDate> revisedDates,
		List<RawObservation> batch) {

	public ChangeDecision {
		appendedDates = new TreeSet<>(appendedDates);
		revisedDates = new TreeSet<>(revisedDates);
		batch = List.copyOf(batch);
	}

	public static ChangeDecision none() {
		return new ChangeDecision(ChangeKind.NONE, new TreeSet<>(), new TreeSet<>(), List.of());
	}

	public boolean changed() {
		return kind != ChangeKind.NONE;
	}
}
