package com.mistrycapital.forecasteval.analysis;

/**
 * Thrown when a batch does not finish within its configured deadline
 */
public class AnalysisTimeoutException extends RuntimeException {
	public AnalysisTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
