package com.mistrycapital.forecasteval.forecasts;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinearRegressionForecasterTest {
	private static final double EPSILON = 0.00000001;

	private final LinearRegressionForecaster forecaster = new LinearRegressionForecaster();

	@Test
	void shouldExtendPerfectLine() throws Exception {
		List<Observation> historical = SeriesFixtures.observations(10, 20, 30);

		List<Observation> forecast = forecaster.forecast(historical, 2, SeriesFixtures.ONE_SECOND);

		assertEquals(2, forecast.size());
		assertEquals(Instant.ofEpochSecond(3), forecast.get(0).timestamp);
		assertEquals(40.0, forecast.get(0).value, EPSILON);
		assertEquals(Instant.ofEpochSecond(4), forecast.get(1).timestamp);
		assertEquals(50.0, forecast.get(1).value, EPSILON);
	}

	@Test
	void shouldRecoverSlopeAndIntercept() throws Exception {
		List<Observation> historical = SeriesFixtures.observations(-3.5, -1.25, 1.0, 3.25, 5.5, 7.75);

		LinearRegressionForecaster.LinearFit fit = forecaster.fit(historical);

		assertEquals(2.25, fit.slope, EPSILON);
		assertEquals(-3.5, fit.intercept, EPSILON);
	}

	@Test
	void shouldProjectDailyPricesOnTheirInterval() throws Exception {
		// 0.5 per day from 100 starting 2018-03-01
		Instant start = ZonedDateTime.of(2018, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant();
		Duration day = Duration.ofDays(1);
		List<Observation> historical = new ArrayList<>();
		for(int i = 0; i < 60; i++)
			historical.add(new Observation(start.plus(day.multipliedBy(i)), 100.0 + 0.5 * i));

		List<Observation> forecast = forecaster.forecast(historical, 5, day);

		assertEquals(5, forecast.size());
		for(int k = 1; k <= 5; k++) {
			Observation point = forecast.get(k - 1);
			assertEquals(start.plus(day.multipliedBy(59 + k)), point.timestamp);
			assertEquals(100.0 + 0.5 * (59 + k), point.value, 0.000001);
		}
	}

	@Test
	void shouldRejectDegenerateHistory() {
		assertThrows(DegenerateFitException.class,
			() -> forecaster.forecast(SeriesFixtures.observations(42), 1, SeriesFixtures.ONE_SECOND));

		Instant time = Instant.ofEpochSecond(1000);
		List<Observation> sameTime = ImmutableList.of(
			new Observation(time, 1.0), new Observation(time, 2.0), new Observation(time, 3.0));
		assertThrows(DegenerateFitException.class,
			() -> forecaster.forecast(sameTime, 3, SeriesFixtures.ONE_SECOND));
	}

	@Test
	void shouldRejectMissingHistory() {
		assertThrows(InsufficientHistoryException.class,
			() -> forecaster.forecast(ImmutableList.of(), 2, SeriesFixtures.ONE_SECOND));
		assertThrows(IllegalArgumentException.class,
			() -> forecaster.forecast(SeriesFixtures.observations(1, 2), 0, SeriesFixtures.ONE_SECOND));
	}

	@Test
	void shouldNotModifyHistory() throws Exception {
		List<Observation> historical = new ArrayList<>(SeriesFixtures.observations(3, 1, 4, 1, 5));
		List<Observation> copy = new ArrayList<>(historical);

		forecaster.forecast(historical, 3, SeriesFixtures.ONE_SECOND);

		assertEquals(copy, historical);
	}
}
