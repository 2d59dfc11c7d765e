package com.mistrycapital.forecasteval.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single timestamped reading. Observations order by timestamp only
 */
public final class Observation implements Comparable<Observation> {
	public final Instant timestamp;
	public final double value;

	public Observation(Instant timestamp, double value) {
		this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
		this.value = value;
	}

	@Override
	public int compareTo(final Observation b) {
		return timestamp.compareTo(b.timestamp);
	}

	@Override
	public boolean equals(final Object o) {
		if(this == o) return true;
		if(!(o instanceof Observation)) return false;
		Observation that = (Observation) o;
		return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
	}

	@Override
	public int hashCode() {
		return Objects.hash(timestamp, value);
	}

	@Override
	public String toString() {
		return timestamp + "=" + value;
	}
}
