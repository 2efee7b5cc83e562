package com.EconLake.indicator_pipeline.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.EconLake.indicator_pipeline.model.IndicatorSeries;
import com.EconLake.indicator_pipeline.model.ValidatedObservation;
import com.EconLake.indicator_pipeline.storage.ArtifactJson;
import com.fasterxml.jackson.databind.ObjectMapper;

class AnalyticsEngineTest {

	private static final Instant INGEST_TS = Instant.parse("2024-03-10T09:00:00Z");
	private static final LocalDate MONDAY = LocalDate.of(2024, 1, 1);

	private final AnalyticsEngine engine = new AnalyticsEngine(0.0001);

	@Test
	void threePointScenario_ReturnsAndMovingAverage() {
		double[] values = { 5.00, 5.10, 5.05 };

		Double[] returns = SeriesMath.dailyReturns(values);
		Double[] sma3 = SeriesMath.movingAverage(values, 3);

		assertThat(returns[0]).isNull();
		assertThat(returns[1]).isCloseTo(0.02, within(1e-12));
		assertThat(returns[2]).isCloseTo(-0.0098, within(1e-4));
		assertThat(sma3[0]).isNull();
		assertThat(sma3[1]).isNull();
		assertThat(sma3[2]).isCloseTo(5.05, within(1e-12));
	}

	@Test
	void movingAverages_AreNullExactlyWhileHistoryIsShort() {
		List<DailyMetric> daily = engine.daily(series(ramp(100, 1.0, 0.01)));

		for (int i = 0; i < daily.size(); i++) {
			assertThat(daily.get(i).sma7() == null).as("sma_7 at %d", i).isEqualTo(i + 1 < 7);
			assertThat(daily.get(i).sma30() == null).as("sma_30 at %d", i).isEqualTo(i + 1 < 30);
			assertThat(daily.get(i).sma90() == null).as("sma_90 at %d", i).isEqualTo(i + 1 < 90);
			assertThat(daily.get(i).rollingVolatility30d() == null).as("rolling vol at %d", i).isEqualTo(i < 30);
		}
	}

	@Test
	void rollingVolatility_IsSampleStandardDeviationOfLastThirtyReturns() {
		// returns alternate +1% and -1%: mean 0, each deviation 0.01, 29 degrees of freedom
		double[] values = new double[31];
		values[0] = 100.0;
		for (int i = 1; i < values.length; i++) {
			values[i] = values[i - 1] * (i % 2 == 1 ? 1.01 : 0.99);
		}
		double expected = Math.sqrt(30 * 0.01 * 0.01 / 29);

		TechnicalSnapshot technical = engine.technical(series(values));
		List<DailyMetric> daily = engine.daily(series(values));

		assertThat(technical.rollingVolatility30d()).isCloseTo(expected, within(1e-9));
		assertThat(technical.rollingVolatility30d()).isCloseTo(0.0101709525, within(1e-9));
		assertThat(daily.get(30).rollingVolatility30d()).isCloseTo(expected, within(1e-9));
		assertThat(daily.get(29).rollingVolatility30d()).isNull();
	}

	@Test
	void shortSeries_ReportsNullsNotErrors() {
		TechnicalSnapshot technical = engine.technical(series(5.00));

		assertThat(technical.latestValue()).isEqualTo(5.00);
		assertThat(technical.sma7()).isNull();
		assertThat(technical.avgDailyReturn()).isNull();
		assertThat(technical.dailyVolatility()).isNull();
		assertThat(technical.annualizedVolatility()).isNull();
		assertThat(technical.momentum7()).isNull();
		assertThat(technical.maxDailyGain()).isNull();
		assertThat(technical.trendSlope()).isNull();
		assertThat(technical.trendDirection()).isNull();
		assertThat(technical.rsi14()).isNull();
		assertThat(technical.maxDrawdownPct()).isEqualTo(0.0);
		assertThat(technical.supportLevel()).isEqualTo(5.00);
		assertThat(technical.resistanceLevel()).isEqualTo(5.00);
	}

	@Test
	void emptySeries_IsAllNull() {
		AnalyticsReport report = engine.analyze(IndicatorSeries.empty("usdbrl"));

		assertThat(report.technical().asMap()).allSatisfy((name, value) -> assertThat(value).isNull());
		assertThat(report.monthly()).isEmpty();
		assertThat(report.daily()).isEmpty();
		assertThat(report.seasonal().weekdayPatterns()).isEmpty();
		assertThat(report.summary().latestDate()).isNull();
	}

	@Test
	void volatility_IsSampleStandardDeviationOfReturns() {
		TechnicalSnapshot technical = engine.technical(series(100, 110, 99, 108.9));

		// returns: +0.10, -0.10, +0.10
		assertThat(technical.avgDailyReturn()).isCloseTo(0.1 / 3, within(1e-12));
		double expected = Math.sqrt((2 * Math.pow(0.1 - 0.1 / 3, 2) + Math.pow(-0.1 - 0.1 / 3, 2)) / 2);
		assertThat(technical.dailyVolatility()).isCloseTo(expected, within(1e-12));
		assertThat(technical.annualizedVolatility()).isCloseTo(expected * Math.sqrt(252), within(1e-12));
		assertThat(technical.maxDailyGain()).isCloseTo(10.0, within(1e-9));
		assertThat(technical.maxDailyLoss()).isCloseTo(-10.0, within(1e-9));
	}

	@Test
	void maxDrawdown_IsZeroForNonDecreasingSeries() {
		assertThat(engine.technical(series(1, 1, 2, 3, 3, 4)).maxDrawdownPct()).isEqualTo(0.0);
	}

	@Test
	void maxDrawdown_MeasuresLargestFallFromRunningPeak() {
		TechnicalSnapshot technical = engine.technical(series(10, 12, 6, 15, 9));

		assertThat(technical.maxDrawdownPct()).isCloseTo(50.0, within(1e-9));
		assertThat(technical.maxDrawdownPct()).isBetween(0.0, 100.0);
	}

	@Test
	void momentum_NeedsLookbackPlusOnePoints() {
		assertThat(AnalyticsEngine.momentum(new double[] { 1, 2, 3, 4, 5, 6, 7 }, 7)).isNull();
		assertThat(AnalyticsEngine.momentum(new double[] { 1, 2, 3, 4, 5, 6, 7, 8 }, 7))
				.isCloseTo(700.0, within(1e-9));
	}

	@Test
	void rsi_AllGainsIs100AndNeedsFifteenPoints() {
		assertThat(AnalyticsEngine.rsi(ramp(14, 1.0, 0.1), 14)).isNull();
		assertThat(AnalyticsEngine.rsi(ramp(15, 1.0, 0.1), 14)).isEqualTo(100.0);
	}

	@Test
	void rsi_BalancedMovesIsFifty() {
		double[] values = new double[15];
		for (int i = 0; i < values.length; i++) {
			values[i] = i % 2 == 0 ? 10.0 : 11.0;
		}
		// seven gains and seven losses of the same size
		assertThat(AnalyticsEngine.rsi(values, 14)).isCloseTo(50.0, within(1e-9));
	}

	@Test
	void trend_LinearRiseIsBullishFlatIsSideways() {
		TechnicalSnapshot rising = engine.technical(series(ramp(120, 5.0, 0.01)));
		TechnicalSnapshot flat = engine.technical(series(ramp(120, 5.0, 0.0)));
		TechnicalSnapshot falling = engine.technical(series(ramp(120, 5.0, -0.01)));

		assertThat(rising.trendSlope()).isCloseTo(0.01, within(1e-9));
		assertThat(rising.trendDirection()).isEqualTo(TechnicalSnapshot.BULLISH);
		assertThat(flat.trendSlope()).isCloseTo(0.0, within(1e-12));
		assertThat(flat.trendDirection()).isEqualTo(TechnicalSnapshot.SIDEWAYS);
		assertThat(falling.trendDirection()).isEqualTo(TechnicalSnapshot.BEARISH);
	}

	@Test
	void supportAndResistance_UseTrailingNinetyValues() {
		double[] values = ramp(100, 1.0, 1.0);
		TechnicalSnapshot technical = engine.technical(series(values));

		assertThat(technical.supportLevel()).isEqualTo(values[10]);
		assertThat(technical.resistanceLevel()).isEqualTo(values[99]);
	}

	@Test
	void seasonal_GroupsByWeekdayAndMonthInCalendarOrder() {
		IndicatorSeries series = IndicatorSeries.of("usdbrl", List.of(
				observation(LocalDate.of(2024, 2, 6), 6.0),   // Tuesday
				observation(LocalDate.of(2024, 1, 1), 2.0),   // Monday
				observation(LocalDate.of(2024, 1, 2), 4.0),   // Tuesday
				observation(LocalDate.of(2024, 1, 8), 4.0))); // Monday

		SeasonalProfile profile = engine.seasonal(series);

		assertThat(profile.weekdayPatterns()).containsOnlyKeys("Monday", "Tuesday");
		assertThat(profile.weekdayPatterns().keySet()).containsExactly("Monday", "Tuesday");
		assertThat(profile.weekdayPatterns().get("Monday").average()).isEqualTo(3.0);
		assertThat(profile.weekdayPatterns().get("Monday").count()).isEqualTo(2);
		assertThat(profile.weekdayPatterns().get("Monday").volatility()).isCloseTo(Math.sqrt(2), within(1e-12));
		assertThat(profile.monthlyPatterns().keySet()).containsExactly("January", "February");
		assertThat(profile.monthlyPatterns().get("February").count()).isEqualTo(1);
		assertThat(profile.monthlyPatterns().get("February").volatility()).isNull();
	}

	@Test
	void monthly_ReportsOhlcAndInPeriodVolatility() {
		IndicatorSeries series = IndicatorSeries.of("usdbrl", List.of(
				observation(LocalDate.of(2024, 1, 30), 10.0),
				observation(LocalDate.of(2024, 1, 31), 11.0),
				observation(LocalDate.of(2024, 2, 1), 22.0),
				observation(LocalDate.of(2024, 2, 2), 11.0),
				observation(LocalDate.of(2024, 2, 5), 16.5)));

		List<PeriodAggregation> monthly = engine.monthly(series);

		assertThat(monthly).extracting(PeriodAggregation::period).containsExactly("2024-01", "2024-02");
		PeriodAggregation january = monthly.get(0);
		assertThat(january.open()).isEqualTo(10.0);
		assertThat(january.close()).isEqualTo(11.0);
		assertThat(january.count()).isEqualTo(2);
		// only one in-month return
		assertThat(january.volatility()).isNull();

		PeriodAggregation february = monthly.get(1);
		assertThat(february.open()).isEqualTo(22.0);
		assertThat(february.high()).isEqualTo(22.0);
		assertThat(february.low()).isEqualTo(11.0);
		assertThat(february.close()).isEqualTo(16.5);
		assertThat(february.average()).isCloseTo(49.5 / 3, within(1e-12));
		// in-month returns -0.5 and +0.5; the January to February jump is excluded
		assertThat(february.volatility()).isCloseTo(Math.sqrt(0.5), within(1e-12));
	}

	@Test
	void yearly_AddsOpenToCloseReturn() {
		IndicatorSeries series = IndicatorSeries.of("usdbrl", List.of(
				observation(LocalDate.of(2023, 1, 2), 5.0),
				observation(LocalDate.of(2023, 12, 29), 4.5),
				observation(LocalDate.of(2024, 1, 2), 4.0),
				observation(LocalDate.of(2024, 3, 8), 5.0)));

		List<YearlyAggregation> yearly = engine.yearly(series);

		assertThat(yearly).extracting(YearlyAggregation::period).containsExactly("2023", "2024");
		assertThat(yearly.get(0).yearlyReturn()).isCloseTo(-10.0, within(1e-9));
		assertThat(yearly.get(1).yearlyReturn()).isCloseTo(25.0, within(1e-9));
	}

	@Test
	void daily_TracksMonthToDateChangeAndMonthRange() {
		IndicatorSeries series = IndicatorSeries.of("usdbrl", List.of(
				observation(LocalDate.of(2024, 1, 2), 4.0),
				observation(LocalDate.of(2024, 1, 3), 5.0),
				observation(LocalDate.of(2024, 1, 4), 4.5),
				observation(LocalDate.of(2024, 2, 1), 6.0)));

		List<DailyMetric> daily = engine.daily(series);

		assertThat(daily).hasSize(4);
		assertThat(daily.get(0).mtdChangePct()).isEqualTo(0.0);
		assertThat(daily.get(0).dailyReturnPct()).isNull();
		assertThat(daily.get(1).mtdChangePct()).isCloseTo(25.0, within(1e-9));
		assertThat(daily.get(1).dailyReturnPct()).isCloseTo(25.0, within(1e-9));
		assertThat(daily.get(2).monthHigh()).isEqualTo(5.0);
		assertThat(daily.get(2).monthLow()).isEqualTo(4.0);
		assertThat(daily.get(3).mtdChangePct()).isEqualTo(0.0);
		assertThat(daily.get(3).monthHigh()).isEqualTo(6.0);
	}

	@Test
	void zeroBase_GivesNullReturnInsteadOfInfinity() {
		TechnicalSnapshot technical = new AnalyticsEngine(0.0001).technical(series(0.0, 1.0, 2.0));

		assertThat(technical.maxDailyGain()).isCloseTo(100.0, within(1e-9));
		assertThat(technical.avgDailyReturn()).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void summary_MirrorsTechnicalSnapshot() {
		AnalyticsReport report = engine.analyze(series(ramp(40, 5.0, 0.02)));

		assertThat(report.summary().indicator()).isEqualTo("usdbrl");
		assertThat(report.summary().latestDate()).isEqualTo(MONDAY.plusDays(39));
		assertThat(report.summary().latestValue()).isEqualTo(report.technical().latestValue());
		assertThat(report.summary().momentum30()).isEqualTo(report.technical().momentum30());
		assertThat(report.summary().rsi14()).isEqualTo(100.0);
		assertThat(report.summary().dailyChangePct()).isNotNull();
	}

	@Test
	void rerunOnSameSeries_IsByteIdentical() throws Exception {
		ObjectMapper mapper = ArtifactJson.newMapper();
		IndicatorSeries series = series(ramp(200, 5.0, 0.013));

		AnalyticsReport first = engine.analyze(series);
		AnalyticsReport second = new AnalyticsEngine(0.0001).analyze(IndicatorSeries.of("usdbrl", series.observations()));

		assertThat(mapper.writeValueAsBytes(first.technical().asMap()))
				.isEqualTo(mapper.writeValueAsBytes(second.technical().asMap()));
		assertThat(mapper.writeValueAsBytes(first)).isEqualTo(mapper.writeValueAsBytes(second));
	}

	@Test
	void technicalMap_WritesUndefinedMetricsAsExplicitNulls() throws Exception {
		String json = ArtifactJson.newMapper().writeValueAsString(engine.technical(series(5.0, 5.1)).asMap());

		assertThat(json).contains("\"sma_90\" : null");
		assertThat(json).doesNotContain("NaN").doesNotContain("Infinity");
	}

	private static double[] ramp(int size, double start, double step) {
		double[] values = new double[size];
		for (int i = 0; i < size; i++) {
			values[i] = start + step * i;
		}
		return values;
	}

	private static IndicatorSeries series(double... values) {
		List<ValidatedObservation> observations = new ArrayList<>();
		for (int i = 0; i < values.length; i++) {
			observations.add(observation(MONDAY.plusDays(i), values[i]));
		}
		return IndicatorSeries.of("usdbrl", observations);
	}

	private static ValidatedObservation observation(LocalDate date, double value) {
		return new ValidatedObservation(date, value, INGEST_TS);
	}
}
