package com.mistrycapital.forecasteval.model;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Named, grouped sequence of observations spaced by a fixed interval. The group is a coarse label
 * ("Stock", "Database Wait Times") used only when aggregating results
 */
public final class Series {
	private final String name;
	private final String group;
	private final Duration interval;
	private final ImmutableList<Observation> observations;

	public Series(String name, String group, Duration interval, List<Observation> observations) {
		this.name = Objects.requireNonNull(name, "name");
		this.group = Objects.requireNonNull(group, "group");
		this.interval = Objects.requireNonNull(interval, "interval");
		this.observations = ImmutableList.copyOf(observations);
	}

	public String getName() {
		return name;
	}

	public String getGroup() {
		return group;
	}

	/**
	 * @return Expected spacing between consecutive observations, used to project forecast timestamps
	 */
	public Duration getInterval() {
		return interval;
	}

	/**
	 * @return Observations in ascending timestamp order, as ingested
	 */
	public ImmutableList<Observation> getObservations() {
		return observations;
	}

	public int size() {
		return observations.size();
	}

	@Override
	public String toString() {
		return group + "/" + name + " (" + observations.size() + " observations every " + interval + ")";
	}
}
