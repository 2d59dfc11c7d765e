package com.mistrycapital.forecasteval.forecasts;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.util.MCProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Forecasts each point as the mean of the preceding window of values. Forecast points feed the window for
 * later points. A history shorter than the window is used whole, and the window fills up with forecast
 * points before any value is dropped.
 */
public class MovingAverageForecaster implements Forecaster {
	static final int DEFAULT_WINDOW = 5;

	private final int window;

	public MovingAverageForecaster(int window) {
		checkArgument(window > 0, "window must be positive but was %s", window);
		this.window = window;
	}

	public MovingAverageForecaster(MCProperties properties) {
		this(properties.getIntProperty("forecast.movingAverage.window", DEFAULT_WINDOW));
	}

	public int getWindow() {
		return window;
	}

	@Override
	public List<Observation> forecast(final List<Observation> historical, final int horizon,
		final Duration interval)
		throws ForecastException
	{
		Forecasters.checkForecastArguments("Moving average", historical, horizon, interval);

		// ring buffer of capacity window, seeded with up to window values of history. It grows with forecast
		// points until full and only then evicts the oldest value
		final double[] values = new double[window];
		int count = Math.min(window, historical.size());
		double sum = 0.0;
		for(int i = 0; i < count; i++) {
			values[i] = historical.get(historical.size() - count + i).value;
			sum += values[i];
		}

		final Instant last = historical.get(historical.size() - 1).timestamp;
		final ImmutableList.Builder<Observation> builder = ImmutableList.builderWithExpectedSize(horizon);
		int oldest = 0;
		for(int k = 1; k <= horizon; k++) {
			final double average = sum / count;
			builder.add(new Observation(Forecasters.projectTimestamp(last, interval, k), average));
			if(count < window) {
				values[count++] = average;
				sum += average;
			} else {
				sum += average - values[oldest];
				values[oldest] = average;
				oldest = (oldest + 1) % window;
			}
		}
		return builder.build();
	}
}
