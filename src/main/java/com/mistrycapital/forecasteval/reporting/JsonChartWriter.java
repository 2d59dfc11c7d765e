package com.mistrycapital.forecasteval.reporting;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.mistrycapital.forecasteval.util.MCLoggerFactory;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Writes each chart as a Plotly figure (data + layout) JSON file in the output directory. Line charts go to
 * line-&lt;title&gt;.json and histograms to histogram-&lt;title&gt;.json. Titles that reduce to a file name already
 * written by this writer get a numeric suffix (line-&lt;title&gt;-2.json) instead of replacing the earlier chart.
 * Not thread safe.
 */
public class JsonChartWriter implements ChartRenderer {
	private static final Logger log = MCLoggerFactory.getLogger();

	private final Path outputDir;
	private final Gson gson;
	/** Base names of files written so far */
	private final Set<String> usedNames;

	public JsonChartWriter(Path outputDir) {
		this.outputDir = outputDir;
		gson = new GsonBuilder().setPrettyPrinting().create();
		usedNames = new HashSet<>();
	}

	@Override
	public void renderLineChart(final String title, final List<Trace> traces)
		throws IOException
	{
		final JsonArray data = new JsonArray();
		for(Trace trace : traces) {
			final JsonArray x = new JsonArray();
			for(Instant timestamp : trace.timestamps)
				x.add(timestamp.toString());
			final JsonObject plotlyTrace = new JsonObject();
			plotlyTrace.addProperty("type", "scatter");
			plotlyTrace.addProperty("mode", "lines");
			plotlyTrace.addProperty("name", trace.name);
			plotlyTrace.add("x", x);
			plotlyTrace.add("y", toJsonArray(trace.values));
			data.add(plotlyTrace);
		}
		final JsonObject layout = layout(title);
		layout.add("xaxis", axis("Date"));
		layout.add("yaxis", axis("Value"));
		write("line-" + slug(title), data, layout);
	}

	@Override
	public void renderHistogram(final String title, final List<MetricSeries> series)
		throws IOException
	{
		final JsonArray data = new JsonArray();
		for(MetricSeries metricSeries : series) {
			final JsonObject plotlyTrace = new JsonObject();
			plotlyTrace.addProperty("type", "histogram");
			plotlyTrace.addProperty("name", metricSeries.name);
			plotlyTrace.addProperty("opacity", 0.6);
			plotlyTrace.add("x", toJsonArray(metricSeries.values));
			data.add(plotlyTrace);
		}
		final JsonObject layout = layout(title);
		layout.addProperty("barmode", "overlay");
		layout.add("xaxis", axis("RMSE"));
		layout.add("yaxis", axis("Series"));
		write("histogram-" + slug(title), data, layout);
	}

	private void write(final String baseName, final JsonArray data, final JsonObject layout)
		throws IOException
	{
		final JsonObject figure = new JsonObject();
		figure.add("data", data);
		figure.add("layout", layout);

		Files.createDirectories(outputDir);
		final Path file = outputDir.resolve(uniqueName(baseName) + ".json");
		try(BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			gson.toJson(figure, writer);
		}
		log.debug("Wrote chart " + file);
	}

	/**
	 * @return baseName, or baseName with the first free numeric suffix if it was already used
	 */
	String uniqueName(String baseName) {
		String name = baseName;
		for(int suffix = 2; !usedNames.add(name); suffix++)
			name = baseName + "-" + suffix;
		return name;
	}

	private static JsonObject layout(String title) {
		final JsonObject titleObject = new JsonObject();
		titleObject.addProperty("text", title);
		final JsonObject layout = new JsonObject();
		layout.add("title", titleObject);
		return layout;
	}

	private static JsonObject axis(String title) {
		final JsonObject axis = new JsonObject();
		axis.addProperty("title", title);
		return axis;
	}

	/** JSON has no NaN or infinity, so non-finite values become null gaps */
	private static JsonArray toJsonArray(List<Double> values) {
		final JsonArray array = new JsonArray();
		for(Double value : values) {
			if(Double.isFinite(value))
				array.add(value);
			else
				array.add(JsonNull.INSTANCE);
		}
		return array;
	}

	static String slug(String title) {
		final String slug = title.toLowerCase(Locale.US).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
		return slug.isEmpty() ? "chart" : slug;
	}
}
