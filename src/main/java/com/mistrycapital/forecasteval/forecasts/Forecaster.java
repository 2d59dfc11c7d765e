package com.mistrycapital.forecasteval.forecasts;

import com.mistrycapital.forecasteval.model.Observation;

import java.time.Duration;
import java.util.List;

public interface Forecaster {
	/**
	 * Extrapolates future values from historical observations. Implementations must not modify the input.
	 *
	 * @param historical Observations in ascending timestamp order
	 * @param horizon    Number of points to forecast, must be positive
	 * @param interval   Spacing between forecast points
	 * @return Exactly horizon observations, the k-th timestamped at last historical timestamp + k * interval
	 * @throws InsufficientHistoryException if historical is empty or too short for this algorithm
	 */
	List<Observation> forecast(List<Observation> historical, int horizon, Duration interval)
		throws ForecastException;
}
