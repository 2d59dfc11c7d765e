package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.Series;

import static com.google.common.base.Preconditions.checkArgument;

public class SeriesSplitter {
	/**
	 * Holds out the most recent horizon observations as actual values. If the series has no more than horizon
	 * observations, historical is empty and actual holds the whole series; forecasters reject that case.
	 *
	 * @throws IllegalArgumentException if the series is empty or horizon is not positive
	 */
	public static SeriesSplit split(Series series, int horizon) {
		checkArgument(horizon > 0, "horizon must be positive but was %s", horizon);
		final ImmutableList<Observation> observations = series.getObservations();
		checkArgument(!observations.isEmpty(), "Series %s has no observations", series.getName());

		final int splitIndex = Math.max(0, observations.size() - horizon);
		return new SeriesSplit(observations.subList(0, splitIndex),
			observations.subList(splitIndex, observations.size()));
	}
}
