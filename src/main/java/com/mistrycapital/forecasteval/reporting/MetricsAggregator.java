package com.mistrycapital.forecasteval.reporting;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.mistrycapital.forecasteval.analysis.ForecastResult;
import com.mistrycapital.forecasteval.analysis.SeriesAnalysis;
import com.mistrycapital.forecasteval.scoring.RegressionMetrics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Turns analyses into chart inputs. Never modifies the analyses
 */
public class MetricsAggregator {
	static final String HISTORICAL = "Historical";
	static final String ACTUAL = "Actual";

	/**
	 * Groups metrics of successful forecasts by series group, then by algorithm. Groups and algorithms
	 * appear in the order first seen.
	 *
	 * @return group name to algorithm name to metrics, one entry per series
	 */
	public ImmutableMap<String,ImmutableMap<String,ImmutableList<RegressionMetrics>>> groupMetrics(
		List<SeriesAnalysis> analyses)
	{
		final Map<String,Map<String,List<RegressionMetrics>>> grouped = new LinkedHashMap<>();
		for(SeriesAnalysis analysis : analyses) {
			final var byAlgorithm =
				grouped.computeIfAbsent(analysis.getSeries().getGroup(), k -> new LinkedHashMap<>());
			for(ForecastResult result : analysis.getForecasts())
				if(result.isSuccess())
					byAlgorithm.computeIfAbsent(result.getAlgorithmName(), k -> new ArrayList<>())
						.add(result.getMetrics());
		}

		final ImmutableMap.Builder<String,ImmutableMap<String,ImmutableList<RegressionMetrics>>> builder =
			ImmutableMap.builder();
		for(var groupEntry : grouped.entrySet()) {
			final ImmutableMap.Builder<String,ImmutableList<RegressionMetrics>> algorithms = ImmutableMap.builder();
			for(var algorithmEntry : groupEntry.getValue().entrySet())
				algorithms.put(algorithmEntry.getKey(), ImmutableList.copyOf(algorithmEntry.getValue()));
			builder.put(groupEntry.getKey(), algorithms.build());
		}
		return builder.build();
	}

	/**
	 * @return Per group, one series of RMSE values per algorithm, ready for histograms
	 */
	public ImmutableMap<String,ImmutableList<MetricSeries>> rmseHistograms(List<SeriesAnalysis> analyses) {
		return metricHistograms(analyses, metrics -> metrics.rmse);
	}

	/**
	 * @return Per group, one series per algorithm holding the selected metric. NaN values are left out
	 */
	public ImmutableMap<String,ImmutableList<MetricSeries>> metricHistograms(List<SeriesAnalysis> analyses,
		ToDoubleFunction<RegressionMetrics> metric)
	{
		final ImmutableMap.Builder<String,ImmutableList<MetricSeries>> builder = ImmutableMap.builder();
		for(var groupEntry : groupMetrics(analyses).entrySet()) {
			final ImmutableList.Builder<MetricSeries> histograms = ImmutableList.builder();
			for(var algorithmEntry : groupEntry.getValue().entrySet()) {
				final List<Double> values = new ArrayList<>(algorithmEntry.getValue().size());
				for(RegressionMetrics metrics : algorithmEntry.getValue()) {
					final double value = metric.applyAsDouble(metrics);
					if(!Double.isNaN(value))
						values.add(value);
				}
				histograms.add(new MetricSeries(algorithmEntry.getKey(), values));
			}
			builder.put(groupEntry.getKey(), histograms.build());
		}
		return builder.build();
	}

	/**
	 * @return Historical trace, actual trace, then one trace per successful forecast in algorithm order
	 */
	public ImmutableList<Trace> traces(SeriesAnalysis analysis) {
		final ImmutableList.Builder<Trace> builder = ImmutableList.builder();
		builder.add(Trace.of(HISTORICAL, analysis.getHistorical()));
		builder.add(Trace.of(ACTUAL, analysis.getActual()));
		for(ForecastResult result : analysis.getForecasts())
			if(result.isSuccess())
				builder.add(Trace.of(result.getAlgorithmName(), result.getForecast()));
		return builder.build();
	}
}
