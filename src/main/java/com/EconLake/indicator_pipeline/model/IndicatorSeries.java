package com.EconLake.indicator_pipeline.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The full validated series of one indicator: at most one observation per date, ascending by date,
 * all values finite. Instances are immutable; {@link #merge(Collection)} returns a new series.
 */
public final class IndicatorSeries {

	private final String indicator;
	private final List<ValidatedObservation> observations;

	private IndicatorSeries(String indicator, List<ValidatedObservation> observations) {
		this.indicator = indicator;
		this.observations = Collections.unmodifiableList(observations);
	}

	public static IndicatorSeries empty(String indicator) {
		return new IndicatorSeries(indicator, List.of());
	}

	/**
	 * Builds a series from observations in any order.
	 *
	 * @throws IllegalArgumentException if two observations share a date or a value is not finite
	 */
	public static IndicatorSeries of(String indicator, Collection<ValidatedObservation> observations) {
		TreeMap<LocalDate, ValidatedObservation> byDate = new TreeMap<>();
		for (ValidatedObservation observation : observations) {
			requireFinite(observation);
			if (byDate.putIfAbsent(observation.refDate(), observation) != null) {
				throw new IllegalArgumentException(
						"Duplicate observation for " + observation.refDate() + " in series " + indicator);
			}
		}
		return new IndicatorSeries(indicator, new ArrayList<>(byDate.values()));
	}

	/**
	 * Returns a new series where each accepted observation either overwrites the observation with the same
	 * date in place or is inserted at its date position.
	 */
	public IndicatorSeries merge(Collection<ValidatedObservation> accepted) {
		TreeMap<LocalDate, ValidatedObservation> byDate = new TreeMap<>();
		observations.forEach(o -> byDate.put(o.refDate(), o));
		for (ValidatedObservation observation : accepted) {
			requireFinite(observation);
			byDate.put(observation.refDate(), observation);
		}
		return new IndicatorSeries(indicator, new ArrayList<>(byDate.values()));
	}

	public String indicator() {
		return indicator;
	}

	public List<ValidatedObservation> observations() {
		return observations;
	}

	public int size() {
		return observations.size();
	}

	public boolean isEmpty() {
		return observations.isEmpty();
	}

	public double[] values() {
		return observations.stream().mapToDouble(ValidatedObservation::value).toArray();
	}

	public Set<LocalDate> dates() {
		return observations.stream()
				.map(ValidatedObservation::refDate)
				.collect(Collectors.toCollection(TreeSet::new));
	}

	public Optional<ValidatedObservation> first() {
		return observations.isEmpty() ? Optional.empty() : Optional.of(observations.get(0));
	}

	public Optional<ValidatedObservation> last() {
		return observations.isEmpty() ? Optional.empty() : Optional.of(observations.get(observations.size() - 1));
	}

	public Optional<ValidatedObservation> at(LocalDate date) {
		return observations.stream().filter(o -> o.refDate().equals(date)).findFirst();
	}

	private static void requireFinite(ValidatedObservation observation) {
		if (!Double.isFinite(observation.value())) {
			throw new IllegalArgumentException("Non-finite value for " + observation.refDate());
		}
	}
}
