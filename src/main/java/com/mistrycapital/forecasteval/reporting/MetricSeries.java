package com.mistrycapital.forecasteval.reporting;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Named bucket of metric values, one histogram trace
 */
public final class MetricSeries {
	public final String name;
	public final ImmutableList<Double> values;

	public MetricSeries(String name, List<Double> values) {
		this.name = name;
		this.values = ImmutableList.copyOf(values);
	}
}
