package com.mistrycapital.forecasteval.forecasts;

/**
 * Thrown when the historical segment is empty or too short for an algorithm
 */
public class InsufficientHistoryException extends ForecastException {
	public InsufficientHistoryException(String message) {
		super(message);
	}
}
