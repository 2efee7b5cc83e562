package com.EconLake.indicator_pipeline.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Numeric helpers over plain value arrays. Undefined results are {@code null}, never zero or NaN.
 */
final class SeriesMath {

	static final double TRADING_DAYS_PER_YEAR = 252.0;

	private SeriesMath() {
	}

	/**
	 * Simple daily returns; element {@code t} is {@code (v[t] - v[t-1]) / v[t-1]}. Element 0 is always null,
	 * as is any return whose base value is zero.
	 */
	static Double[] dailyReturns(double[] values) {
		Double[] returns = new Double[values.length];
		for (int t = 1; t < values.length; t++) {
			returns[t] = values[t - 1] == 0.0 ? null : finiteOrNull((values[t] - values[t - 1]) / values[t - 1]);
		}
		return returns;
	}

	/**
	 * Trailing simple moving average at every index; null while fewer than {@code period} values exist.
	 */
	static Double[] movingAverage(double[] values, int period) {
		Double[] result = new Double[values.length];
		for (int i = period - 1; i < values.length; i++) {
			result[i] = finiteOrNull(mean(values, i - period + 1, i + 1));
		}
		return result;
	}

	static Double mean(List<Double> values) {
		if (values.isEmpty()) {
			return null;
		}
		double sum = 0.0;
		for (double v : values) {
			sum += v;
		}
		return finiteOrNull(sum / values.size());
	}

	static double mean(double[] values, int fromInclusive, int toExclusive) {
		double sum = 0.0;
		for (int i = fromInclusive; i < toExclusive; i++) {
			sum += values[i];
		}
		return sum / (toExclusive - fromInclusive);
	}

	/**
	 * Sample standard deviation ({@code n - 1} denominator); null below two values.
	 */
	static Double sampleStdDev(List<Double> values) {
		if (values.size() < 2) {
			return null;
		}
		double mean = 0.0;
		for (double v : values) {
			mean += v;
		}
		mean /= values.size();
		double sumSq = 0.0;
		for (double v : values) {
			double d = v - mean;
			sumSq += d * d;
		}
		return finiteOrNull(Math.sqrt(sumSq / (values.size() - 1)));
	}

	static Double sampleStdDev(double[] values, int fromInclusive, int toExclusive) {
		List<Double> window = new ArrayList<>(toExclusive - fromInclusive);
		for (int i = fromInclusive; i < toExclusive; i++) {
			window.add(values[i]);
		}
		return sampleStdDev(window);
	}

	/**
	 * The defined returns in {@code [fromInclusive, toExclusive)}.
	 */
	static List<Double> defined(Double[] returns, int fromInclusive, int toExclusive) {
		List<Double> result = new ArrayList<>();
		for (int i = Math.max(fromInclusive, 0); i < toExclusive; i++) {
			if (returns[i] != null) {
				result.add(returns[i]);
			}
		}
		return result;
	}

	/**
	 * Percentage change from {@code base} to {@code value}; null when the base is zero.
	 */
	static Double percentChange(double base, double value) {
		return base == 0.0 ? null : finiteOrNull((value - base) / base * 100.0);
	}

	static Double times(Double value, double factor) {
		return value == null ? null : finiteOrNull(value * factor);
	}

	static Double finiteOrNull(double value) {
		return Double.isFinite(value) ? value : null;
	}
}
