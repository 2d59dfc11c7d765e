package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;

/**
 * Historical segment used for training and the held out actual segment used for scoring
 */
public final class SeriesSplit {
	public final ImmutableList<Observation> historical;
	public final ImmutableList<Observation> actual;

	SeriesSplit(ImmutableList<Observation> historical, ImmutableList<Observation> actual) {
		this.historical = historical;
		this.actual = actual;
	}
}
