package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.scoring.RegressionMetrics;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one algorithm on one series: either a scored forecast or the failure that prevented it.
 * Failed results carry no forecast points.
 */
public final class ForecastResult {
	private final String algorithmName;
	private final ImmutableList<Observation> forecast;
	@Nullable private final RegressionMetrics metrics;
	@Nullable private final Exception failure;

	private ForecastResult(String algorithmName, ImmutableList<Observation> forecast,
		@Nullable RegressionMetrics metrics, @Nullable Exception failure)
	{
		this.algorithmName = Objects.requireNonNull(algorithmName, "algorithmName");
		this.forecast = forecast;
		this.metrics = metrics;
		this.failure = failure;
	}

	public static ForecastResult success(String algorithmName, List<Observation> forecast,
		RegressionMetrics metrics)
	{
		return new ForecastResult(algorithmName, ImmutableList.copyOf(forecast),
			Objects.requireNonNull(metrics, "metrics"), null);
	}

	public static ForecastResult failure(String algorithmName, Exception failure) {
		return new ForecastResult(algorithmName, ImmutableList.of(), null,
			Objects.requireNonNull(failure, "failure"));
	}

	public String getAlgorithmName() {
		return algorithmName;
	}

	public boolean isSuccess() {
		return failure == null;
	}

	/** @return Forecast points, empty if this result is a failure */
	public ImmutableList<Observation> getForecast() {
		return forecast;
	}

	/** @return Metrics, or null if this result is a failure */
	@Nullable
	public RegressionMetrics getMetrics() {
		return metrics;
	}

	/** @return Cause of failure, or null on success */
	@Nullable
	public Exception getFailure() {
		return failure;
	}

	/** @return Short description of the failure, or null on success */
	@Nullable
	public String getFailureReason() {
		return failure == null ? null : failure.getClass().getSimpleName() + ": " + failure.getMessage();
	}

	@Override
	public String toString() {
		return algorithmName + (isSuccess() ? " " + metrics : " failed " + getFailureReason());
	}
}
