package com.mistrycapital.forecasteval.forecasts;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.SeriesFixtures;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MovingAverageForecasterTest {
	private static final double EPSILON = 0.00000001;

	@Test
	void shouldRollForecastsIntoWindow() throws Exception {
		MovingAverageForecaster forecaster = new MovingAverageForecaster(3);
		List<Observation> historical = SeriesFixtures.observations(1, 2, 3, 4, 5, 6);

		List<Observation> forecast = forecaster.forecast(historical, 3, Duration.ofSeconds(10));

		assertEquals(3, forecast.size());
		assertEquals(Instant.ofEpochSecond(15), forecast.get(0).timestamp);
		assertEquals(Instant.ofEpochSecond(35), forecast.get(2).timestamp);
		assertEquals(5.0, forecast.get(0).value, EPSILON);
		assertEquals(16.0 / 3.0, forecast.get(1).value, EPSILON);
		assertEquals((6.0 + 5.0 + 16.0 / 3.0) / 3.0, forecast.get(2).value, EPSILON);
	}

	@Test
	void shouldUseWholeHistoryWhenShorterThanWindow() throws Exception {
		MovingAverageForecaster forecaster = new MovingAverageForecaster(10);

		List<Observation> forecast = forecaster.forecast(SeriesFixtures.observations(2, 4), 4,
			SeriesFixtures.ONE_SECOND);

		for(Observation point : forecast)
			assertEquals(3.0, point.value, EPSILON);
	}

	@Test
	void shouldGrowWindowWithForecastsBeforeEvicting() throws Exception {
		MovingAverageForecaster forecaster = new MovingAverageForecaster(3);

		List<Observation> forecast = forecaster.forecast(SeriesFixtures.observations(3, 6), 3,
			SeriesFixtures.ONE_SECOND);

		// window holds [3, 6], then [3, 6, 4.5], then [6, 4.5, 4.5]
		assertEquals(4.5, forecast.get(0).value, EPSILON);
		assertEquals(4.5, forecast.get(1).value, EPSILON);
		assertEquals(5.0, forecast.get(2).value, EPSILON);
	}

	@Test
	void shouldReadWindowFromProperties() {
		MCProperties properties = new MCProperties();
		properties.setProperty("forecast.movingAverage.window", "12");
		assertEquals(12, new MovingAverageForecaster(properties).getWindow());

		properties.remove("forecast.movingAverage.window");
		assertEquals(MovingAverageForecaster.DEFAULT_WINDOW, new MovingAverageForecaster(properties).getWindow());
		assertThrows(IllegalArgumentException.class, () -> new MovingAverageForecaster(0));
	}

	@Test
	void shouldRejectMissingHistory() {
		assertThrows(InsufficientHistoryException.class,
			() -> new MovingAverageForecaster(3).forecast(ImmutableList.of(), 1, SeriesFixtures.ONE_SECOND));
	}
}
