package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mistrycapital.forecasteval.forecasts.ForecastException;
import com.mistrycapital.forecasteval.forecasts.Forecaster;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.Series;
import com.mistrycapital.forecasteval.scoring.ForecastScorer;
import com.mistrycapital.forecasteval.scoring.RegressionMetrics;
import com.mistrycapital.forecasteval.util.MCLoggerFactory;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.slf4j.Logger;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Splits, forecasts and scores a batch of series. Each series is an independent task on the executor.
 * A failing algorithm is recorded against its series and does not stop the rest of the batch.
 */
public class AnalysisRunner implements AutoCloseable {
	private static final Logger log = MCLoggerFactory.getLogger();

	private final ExecutorService executorService;
	private final ForecastScorer scorer;
	/** Deadline for a whole batch, null for none */
	@Nullable private final Duration timeout;

	public AnalysisRunner(ExecutorService executorService, ForecastScorer scorer, @Nullable Duration timeout) {
		this.executorService = executorService;
		this.scorer = scorer;
		this.timeout = timeout;
	}

	/**
	 * Creates a runner with its own worker pool sized by analysis.threads (default: available processors) and
	 * a deadline of analysis.timeoutSeconds (0 or missing for none)
	 */
	public static AnalysisRunner fromProperties(MCProperties properties) {
		final int threads =
			properties.getIntProperty("analysis.threads", Runtime.getRuntime().availableProcessors());
		final Duration timeout = properties.getSecondsProperty("analysis.timeoutSeconds", 0);
		final ExecutorService executorService = Executors.newFixedThreadPool(threads,
			new ThreadFactoryBuilder().setNameFormat("analysis-%d").setDaemon(true).build());
		log.debug("Analysis pool of " + threads + " threads, timeout " + timeout);
		return new AnalysisRunner(executorService, new ForecastScorer(), timeout.isZero() ? null : timeout);
	}

	/**
	 * Analyzes every series with every forecaster
	 *
	 * @param forecasters Algorithm name to forecaster, iterated in order
	 * @return One analysis per series, in the same order as seriesList
	 * @throws IllegalArgumentException if horizon is not positive, no forecasters are given or a series is empty
	 * @throws AnalysisTimeoutException if the batch exceeds the configured timeout
	 */
	public List<SeriesAnalysis> analyze(List<Series> seriesList, int horizon, Map<String,Forecaster> forecasters) {
		checkArgument(horizon > 0, "horizon must be positive but was %s", horizon);
		checkArgument(!forecasters.isEmpty(), "No forecasters given");
		for(Series series : seriesList)
			checkArgument(series.size() > 0, "Series %s has no observations", series.getName());

		final long startNanos = System.nanoTime();
		final SeriesAnalysis[] results = new SeriesAnalysis[seriesList.size()];
		final List<CompletableFuture<Void>> futures = new ArrayList<>(seriesList.size());
		for(int i = 0; i < seriesList.size(); i++) {
			final int index = i;
			final Series series = seriesList.get(i);
			futures.add(CompletableFuture.runAsync(
				() -> results[index] = analyzeSeries(series, horizon, forecasters), executorService));
		}
		awaitAll(futures);

		log.info("Analyzed " + results.length + " series with " + forecasters.size() + " algorithms in "
			+ ((System.nanoTime() - startNanos) / 1000000.0) + "ms");
		return ImmutableList.copyOf(results);
	}

	/**
	 * Analyzes a single series on the calling thread
	 */
	public SeriesAnalysis analyzeSeries(Series series, int horizon, Map<String,Forecaster> forecasters) {
		final SeriesSplit split = SeriesSplitter.split(series, horizon);
		final List<ForecastResult> results = new ArrayList<>(forecasters.size());
		for(var entry : forecasters.entrySet()) {
			final String algorithm = entry.getKey();
			try {
				final List<Observation> forecast =
					entry.getValue().forecast(split.historical, horizon, series.getInterval());
				final RegressionMetrics metrics = scorer.evaluate(split.actual, forecast);
				log.debug(series.getName() + " " + algorithm + " " + metrics);
				results.add(ForecastResult.success(algorithm, forecast, metrics));
			} catch(ForecastException e) {
				log.warn("Skipping " + algorithm + " for " + series.getName() + ": " + e.getMessage());
				results.add(ForecastResult.failure(algorithm, e));
			} catch(RuntimeException e) {
				log.error("Forecaster " + algorithm + " failed unexpectedly on " + series.getName(), e);
				results.add(ForecastResult.failure(algorithm, e));
			}
		}
		return new SeriesAnalysis(series, split, results);
	}

	private void awaitAll(List<CompletableFuture<Void>> futures) {
		final CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
		try {
			if(timeout == null)
				all.get();
			else
				all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch(TimeoutException e) {
			futures.forEach(future -> future.cancel(true));
			throw new AnalysisTimeoutException("Analysis did not finish within " + timeout, e);
		} catch(InterruptedException e) {
			futures.forEach(future -> future.cancel(true));
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted waiting for analysis", e);
		} catch(ExecutionException e) {
			throw new RuntimeException("Analysis task failed", e.getCause());
		}
	}

	@Override
	public void close() {
		executorService.shutdownNow();
	}
}
