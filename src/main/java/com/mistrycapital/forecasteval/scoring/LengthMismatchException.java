package com.mistrycapital.forecasteval.scoring;

import com.mistrycapital.forecasteval.forecasts.ForecastException;

/**
 * Thrown when actual and forecast sequences cannot be paired because their lengths differ
 */
public class LengthMismatchException extends ForecastException {
	public LengthMismatchException(int actualLength, int forecastLength) {
		super("Cannot score " + forecastLength + " forecast values against " + actualLength + " actual values");
	}
}
