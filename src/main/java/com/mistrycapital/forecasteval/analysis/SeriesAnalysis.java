package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.Series;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything produced for one series: the split and one result per configured algorithm, in
 * configuration order
 */
public final class SeriesAnalysis {
	private final Series series;
	private final ImmutableList<Observation> historical;
	private final ImmutableList<Observation> actual;
	private final ImmutableList<ForecastResult> forecasts;

	public SeriesAnalysis(Series series, SeriesSplit split, List<ForecastResult> forecasts) {
		if(split.historical.size() + split.actual.size() != series.size())
			throw new IllegalArgumentException("Split of " + series.getName() + " does not cover the series");
		this.series = series;
		this.historical = split.historical;
		this.actual = split.actual;
		this.forecasts = ImmutableList.copyOf(forecasts);
	}

	public Series getSeries() {
		return series;
	}

	public ImmutableList<Observation> getHistorical() {
		return historical;
	}

	public ImmutableList<Observation> getActual() {
		return actual;
	}

	public ImmutableList<ForecastResult> getForecasts() {
		return forecasts;
	}

	/** @return true if every algorithm produced a scored forecast */
	public boolean isFullySuccessful() {
		return forecasts.stream().allMatch(ForecastResult::isSuccess);
	}

	public List<ForecastResult> getFailures() {
		return forecasts.stream()
			.filter(result -> !result.isSuccess())
			.collect(Collectors.toList());
	}
}
