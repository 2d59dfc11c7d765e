package com.mistrycapital.forecasteval.reporting;

import java.io.IOException;
import java.util.List;

public interface ChartRenderer {
	/**
	 * Renders a line chart with one line per trace
	 */
	void renderLineChart(String title, List<Trace> traces) throws IOException;

	/**
	 * Renders overlaid histograms, one per metric series. Binning is up to the renderer
	 */
	void renderHistogram(String title, List<MetricSeries> series) throws IOException;
}
