package com.mistrycapital.forecasteval;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.analysis.SeriesAnalysis;
import com.mistrycapital.forecasteval.analysis.SeriesSplitter;
import com.mistrycapital.forecasteval.analysis.ForecastResult;
import com.mistrycapital.forecasteval.model.Series;
import com.mistrycapital.forecasteval.model.SeriesFixtures;
import com.mistrycapital.forecasteval.reporting.ChartRenderer;
import com.mistrycapital.forecasteval.scoring.RegressionMetrics;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AnalyzeSeriesTest {

	@TempDir
	Path tempDir;

	@Test
	void shouldLoadAllConfiguredSources() throws Exception {
		try(BufferedWriter writer = Files.newBufferedWriter(tempDir.resolve("stocks.csv"))) {
			writer.write("Date,Name,Open,Close,High,Low,Volume\n");
			writer.write("2018-03-01,AAPL,1,2,3,4,5\n");
			writer.write("2018-03-01,MSFT,1,2,3,4,5\n");
		}
		try(BufferedWriter writer = Files.newBufferedWriter(tempDir.resolve("waits.csv"))) {
			writer.write("Timestamp,Query,WaitMs\n");
			writer.write("1520640000,orders,12.5\n");
		}

		MCProperties properties = new MCProperties();
		properties.setProperty("sources", "stocks,dbwait");
		properties.setProperty("source.stocks.file", "stocks.csv");
		properties.setProperty("source.dbwait.file", "waits.csv");

		List<Series> seriesList = AnalyzeSeries.loadSeries(properties, tempDir);

		assertEquals(3, seriesList.size());
		assertEquals("Stock", seriesList.get(0).getGroup());
		assertEquals("Database Wait Times", seriesList.get(2).getGroup());
	}

	@Test
	void shouldRenderChartsPerSeriesAndGroup() throws Exception {
		Series aapl = SeriesFixtures.series("AAPL", "Stock", 1, 2, 3, 4);
		Series orders = SeriesFixtures.series("orders", "Database Wait Times", 4, 3, 2, 1);
		RegressionMetrics metrics = new RegressionMetrics(1, 1, 1, 0);
		List<SeriesAnalysis> analyses = ImmutableList.of(
			new SeriesAnalysis(aapl, SeriesSplitter.split(aapl, 1),
				ImmutableList.of(ForecastResult.success("LinearRegression", SeriesFixtures.observations(5), metrics))),
			new SeriesAnalysis(orders, SeriesSplitter.split(orders, 1),
				ImmutableList.of(ForecastResult.success("LinearRegression", SeriesFixtures.observations(0), metrics))));
		ChartRenderer renderer = mock(ChartRenderer.class);

		AnalyzeSeries.render(analyses, renderer);

		verify(renderer).renderLineChart(eq("AAPL"), anyList());
		verify(renderer).renderLineChart(eq("orders"), anyList());
		verify(renderer).renderHistogram(eq("Stock RMSE"), anyList());
		verify(renderer).renderHistogram(eq("Database Wait Times RMSE"), anyList());
		verify(renderer, times(2)).renderLineChart(anyString(), anyList());
	}
}
