package com.mistrycapital.forecasteval.forecasts;

/**
 * Base class for failures producing or scoring a single forecast. These are isolated per series and
 * algorithm and never abort a whole analysis run
 */
public class ForecastException extends Exception {
	public ForecastException(String message) {
		super(message);
	}
}
