package com.mistrycapital.forecasteval;

import ch.qos.logback.classic.Level;
import com.google.common.base.Joiner;
import com.mistrycapital.forecasteval.analysis.AnalysisRunner;
import com.mistrycapital.forecasteval.analysis.ForecastResult;
import com.mistrycapital.forecasteval.analysis.SeriesAnalysis;
import com.mistrycapital.forecasteval.forecasts.ForecastFactory;
import com.mistrycapital.forecasteval.forecasts.Forecaster;
import com.mistrycapital.forecasteval.loader.SeriesLoader;
import com.mistrycapital.forecasteval.model.Series;
import com.mistrycapital.forecasteval.reporting.ChartRenderer;
import com.mistrycapital.forecasteval.reporting.JsonChartWriter;
import com.mistrycapital.forecasteval.reporting.MetricsAggregator;
import com.mistrycapital.forecasteval.util.MCLoggerFactory;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads every configured source, forecasts the held out tail of each series with every configured algorithm
 * and writes line charts per series and RMSE histograms per group
 */
public class AnalyzeSeries {
	private static final Logger log = MCLoggerFactory.getLogger();

	public static void main(String[] args)
		throws Exception
	{
		MCProperties properties = new MCProperties();
		// a data directory on the command line overrides dataDir
		Path dataDir = Paths.get(args.length > 0 ? args[0] : properties.getProperty("dataDir", "data"));
		Path chartDir = dataDir.resolve(properties.getProperty("chart.outputDir", "charts"));
		log.debug("Read data from " + dataDir + ", writing charts to " + chartDir);

		List<Series> seriesList = loadSeries(properties, dataDir);
		if(!properties.getBooleanProperty("log.verbose", false))
			MCLoggerFactory.resetLogLevel(Level.INFO); // per-series fit logging is noisy on big batches
		MCLoggerFactory.applyLogLevels(properties);
		Map<String,Forecaster> forecasters = ForecastFactory.getForecasters(properties);
		int horizon = properties.getIntProperty("horizon");
		log.info("Forecasting " + horizon + " points of " + seriesList.size() + " series with "
			+ Joiner.on(", ").join(forecasters.keySet()));

		List<SeriesAnalysis> analyses;
		try(AnalysisRunner runner = AnalysisRunner.fromProperties(properties)) {
			analyses = runner.analyze(seriesList, horizon, forecasters);
		}
		logSummary(analyses);
		render(analyses, new JsonChartWriter(chartDir));
	}

	static List<Series> loadSeries(MCProperties properties, Path dataDir)
		throws IOException
	{
		List<String> sources = properties.getListProperty("sources");
		if(sources.isEmpty())
			throw new IllegalArgumentException("No sources configured");

		List<Series> seriesList = new ArrayList<>();
		for(String source : sources) {
			SeriesLoader loader = source.equals("stocks") ? SeriesLoader.stocks()
				: SeriesLoader.fromProperties(properties, source);
			Path file = dataDir.resolve(properties.getRequiredProperty("source." + source + ".file"));
			seriesList.addAll(loader.load(file));
		}
		return seriesList;
	}

	static void logSummary(List<SeriesAnalysis> analyses) {
		int failures = 0;
		for(SeriesAnalysis analysis : analyses) {
			for(ForecastResult result : analysis.getForecasts()) {
				if(result.isSuccess()) {
					log.info(analysis.getSeries().getName() + "\t" + result.getAlgorithmName() + "\t"
						+ result.getMetrics());
				} else {
					failures++;
					log.warn(analysis.getSeries().getName() + "\t" + result.getAlgorithmName() + "\tFAILED "
						+ result.getFailureReason());
				}
			}
		}
		if(failures > 0)
			log.warn(failures + " forecasts failed");
	}

	static void render(List<SeriesAnalysis> analyses, ChartRenderer renderer)
		throws IOException
	{
		MetricsAggregator aggregator = new MetricsAggregator();
		for(SeriesAnalysis analysis : analyses)
			renderer.renderLineChart(analysis.getSeries().getName(), aggregator.traces(analysis));
		for(var entry : aggregator.rmseHistograms(analyses).entrySet())
			renderer.renderHistogram(entry.getKey() + " RMSE", entry.getValue());
	}
}
