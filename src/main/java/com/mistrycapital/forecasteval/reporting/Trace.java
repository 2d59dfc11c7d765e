package com.mistrycapital.forecasteval.reporting;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;

import java.time.Instant;
import java.util.List;

/**
 * Named line of points for a chart, as parallel timestamp and value lists
 */
public final class Trace {
	public final String name;
	public final ImmutableList<Instant> timestamps;
	public final ImmutableList<Double> values;

	public Trace(String name, List<Instant> timestamps, List<Double> values) {
		if(timestamps.size() != values.size())
			throw new IllegalArgumentException(
				"Trace " + name + " has " + timestamps.size() + " timestamps but " + values.size() + " values");
		this.name = name;
		this.timestamps = ImmutableList.copyOf(timestamps);
		this.values = ImmutableList.copyOf(values);
	}

	public static Trace of(String name, List<Observation> observations) {
		final ImmutableList.Builder<Instant> timestamps = ImmutableList.builderWithExpectedSize(observations.size());
		final ImmutableList.Builder<Double> values = ImmutableList.builderWithExpectedSize(observations.size());
		for(Observation observation : observations) {
			timestamps.add(observation.timestamp);
			values.add(observation.value);
		}
		return new Trace(name, timestamps.build(), values.build());
	}

	public int size() {
		return values.size();
	}
}
