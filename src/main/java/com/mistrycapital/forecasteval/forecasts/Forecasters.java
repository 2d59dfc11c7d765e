package com.mistrycapital.forecasteval.forecasts;

import com.mistrycapital.forecasteval.model.Observation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Helpers shared by forecaster implementations
 */
public final class Forecasters {
	private static final double NANOS_PER_SECOND = 1_000_000_000.0;

	private Forecasters() {
	}

	/**
	 * Checks the preconditions common to every forecaster
	 *
	 * @throws InsufficientHistoryException if there is no history to forecast from
	 */
	static void checkForecastArguments(String algorithm, List<Observation> historical, int horizon,
		Duration interval)
		throws InsufficientHistoryException
	{
		checkArgument(horizon > 0, "horizon must be positive but was %s", horizon);
		checkArgument(interval != null && !interval.isNegative() && !interval.isZero(),
			"interval must be positive but was %s", interval);
		if(historical.isEmpty())
			throw new InsufficientHistoryException(algorithm + " needs at least one historical observation");
	}

	/**
	 * @return Timestamp of the k-th forecast point after the given last historical timestamp
	 */
	static Instant projectTimestamp(Instant last, Duration interval, int k) {
		return last.plus(interval.multipliedBy(k));
	}

	/**
	 * @return Instant as fractional seconds since epoch
	 */
	public static double toEpochSeconds(Instant instant) {
		return instant.getEpochSecond() + instant.getNano() / NANOS_PER_SECOND;
	}

	/**
	 * @return Duration as fractional seconds
	 */
	public static double toSeconds(Duration duration) {
		return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
	}
}
