package com.EconLake.indicator_pipeline.analytics;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.model.IndicatorSeries;
import com.EconLake.indicator_pipeline.model.ValidatedObservation;

/**
 * Derives technical indicators, seasonal patterns and period aggregations from a validated series.
 *
 * <p>Every output is a pure function of the series: the same observations always give the same numbers, so
 * reruns overwrite derived artifacts with identical content. Metrics that need more history than exists
 * are {@code null}. Volatilities are sample standard deviations.
 */
@Component
public class AnalyticsEngine {

	static final int RSI_PERIOD = 14;
	static final int TREND_WINDOW = 90;
	static final int ROLLING_VOLATILITY_WINDOW = 30;
	static final int SHORT_VOLATILITY_WINDOW = 7;

	private final double trendThresholdRatio;

	@Autowired
	public AnalyticsEngine(PipelineProperties properties) {
		this(properties.analytics().trendThresholdRatio());
	}

	/**
	 * @param trendThresholdRatio trend is sideways while |slope| stays within this fraction of the mean value
	 *                            of the trend window
	 */
	public AnalyticsEngine(double trendThresholdRatio) {
		this.trendThresholdRatio = trendThresholdRatio;
	}

	public AnalyticsReport analyze(IndicatorSeries series) {
		TechnicalSnapshot technical = technical(series);
		return new AnalyticsReport(
				technical,
				seasonal(series),
				monthly(series),
				yearly(series),
				daily(series),
				summary(series, technical));
	}

	public TechnicalSnapshot technical(IndicatorSeries series) {
		double[] values = series.values();
		int n = values.length;
		Double[] returns = SeriesMath.dailyReturns(values);
		List<Double> allReturns = SeriesMath.defined(returns, 1, n);

		Double dailyVolatility = SeriesMath.sampleStdDev(allReturns);
		Double latest = n == 0 ? null : values[n - 1];
		Double trendSlope = trendSlope(values);

		return new TechnicalSnapshot(
				latest,
				lastOf(SeriesMath.movingAverage(values, 7)),
				lastOf(SeriesMath.movingAverage(values, 30)),
				lastOf(SeriesMath.movingAverage(values, 90)),
				SeriesMath.mean(allReturns),
				dailyVolatility,
				SeriesMath.times(dailyVolatility, Math.sqrt(SeriesMath.TRADING_DAYS_PER_YEAR)),
				lastOf(rollingVolatility(returns)),
				momentum(values, 7),
				momentum(values, 30),
				allReturns.isEmpty() ? null : SeriesMath.times(max(allReturns), 100.0),
				allReturns.isEmpty() ? null : SeriesMath.times(min(allReturns), 100.0),
				maxDrawdownPct(values),
				n == 0 ? null : min(values, Math.max(0, n - TREND_WINDOW), n),
				n == 0 ? null : max(values, Math.max(0, n - TREND_WINDOW), n),
				trendSlope,
				trendDirection(values, trendSlope),
				rsi(values, RSI_PERIOD));
	}

	public SeasonalProfile seasonal(IndicatorSeries series) {
		TreeMap<DayOfWeek, List<Double>> byWeekday = new TreeMap<>();
		TreeMap<Month, List<Double>> byMonth = new TreeMap<>();
		for (ValidatedObservation observation : series.observations()) {
			byWeekday.computeIfAbsent(observation.refDate().getDayOfWeek(), k -> new ArrayList<>())
					.add(observation.value());
			byMonth.computeIfAbsent(observation.refDate().getMonth(), k -> new ArrayList<>())
					.add(observation.value());
		}

		Map<String, SeasonalBucket> weekdays = new LinkedHashMap<>();
		byWeekday.forEach((day, values) -> weekdays.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
				bucket(values)));
		Map<String, SeasonalBucket> months = new LinkedHashMap<>();
		byMonth.forEach((month, values) -> months.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
				bucket(values)));
		return new SeasonalProfile(weekdays, months);
	}

	public List<PeriodAggregation> monthly(IndicatorSeries series) {
		double[] values = series.values();
		Double[] returns = SeriesMath.dailyReturns(values);
		List<PeriodAggregation> result = new ArrayList<>();
		for (Span span : spans(series, date -> YearMonth.from(date).toString())) {
			result.add(new PeriodAggregation(
					span.period(),
					values[span.from()],
					max(values, span.from(), span.to()),
					min(values, span.from(), span.to()),
					values[span.to() - 1],
					span.size(),
					SeriesMath.finiteOrNull(SeriesMath.mean(values, span.from(), span.to())),
					inPeriodVolatility(returns, span)));
		}
		return result;
	}

	public List<YearlyAggregation> yearly(IndicatorSeries series) {
		double[] values = series.values();
		Double[] returns = SeriesMath.dailyReturns(values);
		List<YearlyAggregation> result = new ArrayList<>();
		for (Span span : spans(series, date -> String.format(Locale.ROOT, "%04d", date.getYear()))) {
			double open = values[span.from()];
			double close = values[span.to() - 1];
			result.add(new YearlyAggregation(
					span.period(),
					open,
					max(values, span.from(), span.to()),
					min(values, span.from(), span.to()),
					close,
					span.size(),
					SeriesMath.finiteOrNull(SeriesMath.mean(values, span.from(), span.to())),
					inPeriodVolatility(returns, span),
					SeriesMath.percentChange(open, close)));
		}
		return result;
	}

	public List<DailyMetric> daily(IndicatorSeries series) {
		List<ValidatedObservation> observations = series.observations();
		double[] values = series.values();
		Double[] returns = SeriesMath.dailyReturns(values);
		Double[] sma7 = SeriesMath.movingAverage(values, 7);
		Double[] sma30 = SeriesMath.movingAverage(values, 30);
		Double[] sma90 = SeriesMath.movingAverage(values, 90);
		Double[] rollingVolatility = rollingVolatility(returns);

		List<DailyMetric> result = new ArrayList<>(values.length);
		for (Span month : spans(series, date -> YearMonth.from(date).toString())) {
			double monthFirst = values[month.from()];
			double monthHigh = max(values, month.from(), month.to());
			double monthLow = min(values, month.from(), month.to());
			for (int i = month.from(); i < month.to(); i++) {
				result.add(new DailyMetric(
						observations.get(i).refDate(),
						values[i],
						SeriesMath.times(returns[i], 100.0),
						SeriesMath.percentChange(monthFirst, values[i]),
						sma7[i],
						sma30[i],
						sma90[i],
						i + 1 >= SHORT_VOLATILITY_WINDOW
								? SeriesMath.sampleStdDev(values, i - SHORT_VOLATILITY_WINDOW + 1, i + 1)
								: null,
						rollingVolatility[i],
						monthHigh,
						monthLow));
			}
		}
		return result;
	}

	IndicatorSummary summary(IndicatorSeries series, TechnicalSnapshot technical) {
		double[] values = series.values();
		int n = values.length;
		return new IndicatorSummary(
				series.indicator(),
				series.last().map(ValidatedObservation::refDate).orElse(null),
				technical.latestValue(),
				n >= 2 ? SeriesMath.percentChange(values[n - 2], values[n - 1]) : null,
				technical.trendDirection(),
				technical.trendSlope(),
				technical.momentum7(),
				technical.momentum30(),
				technical.dailyVolatility(),
				technical.annualizedVolatility(),
				technical.rsi14(),
				technical.maxDrawdownPct(),
				technical.maxDailyLoss(),
				technical.supportLevel(),
				technical.resistanceLevel());
	}

	/**
	 * Sample standard deviation of the trailing 30 returns at each index; null until 30 returns exist.
	 */
	static Double[] rollingVolatility(Double[] returns) {
		Double[] result = new Double[returns.length];
		for (int i = ROLLING_VOLATILITY_WINDOW; i < returns.length; i++) {
			result[i] = SeriesMath.sampleStdDev(
					SeriesMath.defined(returns, i - ROLLING_VOLATILITY_WINDOW + 1, i + 1));
		}
		return result;
	}

	static Double momentum(double[] values, int lookback) {
		int n = values.length;
		if (n < lookback + 1) {
			return null;
		}
		return SeriesMath.percentChange(values[n - 1 - lookback], values[n - 1]);
	}

	/**
	 * Largest decline from a running peak, in percent. Points before the first positive peak are skipped.
	 */
	static Double maxDrawdownPct(double[] values) {
		if (values.length == 0) {
			return null;
		}
		double peak = values[0];
		double maxDrawdown = 0.0;
		for (double value : values) {
			peak = Math.max(peak, value);
			if (peak > 0) {
				maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak * 100.0);
			}
		}
		return Math.min(100.0, maxDrawdown);
	}

	/**
	 * Ordinary least squares slope of value against index 0..n-1 over the trailing trend window.
	 */
	static Double trendSlope(double[] values) {
		int n = Math.min(TREND_WINDOW, values.length);
		if (n < 2) {
			return null;
		}
		int start = values.length - n;
		double meanX = (n - 1) / 2.0;
		double meanY = SeriesMath.mean(values, start, values.length);
		double covariance = 0.0;
		double varianceX = 0.0;
		for (int x = 0; x < n; x++) {
			double dx = x - meanX;
			covariance += dx * (values[start + x] - meanY);
			varianceX += dx * dx;
		}
		return SeriesMath.finiteOrNull(covariance / varianceX);
	}

	String trendDirection(double[] values, Double slope) {
		if (slope == null) {
			return null;
		}
		int n = Math.min(TREND_WINDOW, values.length);
		double epsilon = trendThresholdRatio * Math.abs(SeriesMath.mean(values, values.length - n, values.length));
		if (slope > epsilon) {
			return TechnicalSnapshot.BULLISH;
		}
		if (slope < -epsilon) {
			return TechnicalSnapshot.BEARISH;
		}
		return TechnicalSnapshot.SIDEWAYS;
	}

	/**
	 * Wilder's RSI: simple average of the first {@code period} gains and losses, then exponential smoothing
	 * with factor 1/period. Needs {@code period + 1} values.
	 */
	static Double rsi(double[] values, int period) {
		if (values.length <= period) {
			return null;
		}
		double gain = 0.0;
		double loss = 0.0;
		for (int i = 1; i <= period; i++) {
			double diff = values[i] - values[i - 1];
			if (diff >= 0) {
				gain += diff;
			} else {
				loss -= diff;
			}
		}
		double avgGain = gain / period;
		double avgLoss = loss / period;

		for (int i = period + 1; i < values.length; i++) {
			double diff = values[i] - values[i - 1];
			double currentGain = diff > 0 ? diff : 0.0;
			double currentLoss = diff < 0 ? -diff : 0.0;
			avgGain = (avgGain * (period - 1) + currentGain) / period;
			avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
		}
		if (avgLoss == 0.0) {
			return 100.0;
		}
		double rs = avgGain / avgLoss;
		return SeriesMath.finiteOrNull(100.0 - (100.0 / (1.0 + rs)));
	}

	private static SeasonalBucket bucket(List<Double> values) {
		return new SeasonalBucket(SeriesMath.mean(values), values.size(), SeriesMath.sampleStdDev(values));
	}

	private static Double inPeriodVolatility(Double[] returns, Span span) {
		// the first return of a period starts in the previous one
		return SeriesMath.sampleStdDev(SeriesMath.defined(returns, span.from() + 1, span.to()));
	}

	/**
	 * Contiguous index ranges of observations sharing a period key. The series is date ordered, so each
	 * period occupies exactly one range.
	 */
	private static List<Span> spans(IndicatorSeries series, Function<LocalDate, String> periodOf) {
		List<ValidatedObservation> observations = series.observations();
		List<Span> spans = new ArrayList<>();
		int from = 0;
		for (int i = 1; i <= observations.size(); i++) {
			String current = periodOf.apply(observations.get(from).refDate());
			if (i == observations.size() || !current.equals(periodOf.apply(observations.get(i).refDate()))) {
				spans.add(new Span(current, from, i));
				from = i;
			}
		}
		return spans;
	}

	private static Double lastOf(Double[] values) {
		return values.length == 0 ? null : values[values.length - 1];
	}

	private static double max(List<Double> values) {
		return values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
	}

	private static double min(List<Double> values) {
		return values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
	}

	private static double max(double[] values, int fromInclusive, int toExclusive) {
		double result = values[fromInclusive];
		for (int i = fromInclusive + 1; i < toExclusive; i++) {
			result = Math.max(result, values[i]);
		}
		return result;
	}

	private static double min(double[] values, int fromInclusive, int toExclusive) {
		double result = values[fromInclusive];
		for (int i = fromInclusive + 1; i < toExclusive; i++) {
			result = Math.min(result, values[i]);
		}
		return result;
	}

	private record Span(String period, int from, int to) {
		int size() {
			return to - from;
		}
	}
}
