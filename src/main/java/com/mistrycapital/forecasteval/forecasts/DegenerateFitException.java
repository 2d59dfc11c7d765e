package com.mistrycapital.forecasteval.forecasts;

/**
 * Thrown when a regression has no variance along the time axis
 */
public class DegenerateFitException extends ForecastException {
	public DegenerateFitException(String message) {
		super(message);
	}
}
