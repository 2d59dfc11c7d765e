package com.mistrycapital.forecasteval.forecasts;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.util.MCLoggerFactory;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Baseline forecast: ordinary least squares line through the whole history, extrapolated forward.
 * <p>
 * Time is encoded as seconds since epoch. Because the fit covers the entire historical range, it follows
 * the global trend and can look flat or badly scaled next to recent local movement. That is expected of a
 * baseline and is left as is.
 */
public class LinearRegressionForecaster implements Forecaster {
	private static final Logger log = MCLoggerFactory.getLogger();

	public LinearRegressionForecaster() {
	}

	/** Reflective constructor used by ForecastFactory. No settings are read */
	public LinearRegressionForecaster(MCProperties properties) {
		this();
	}

	@Override
	public List<Observation> forecast(final List<Observation> historical, final int horizon,
		final Duration interval)
		throws ForecastException
	{
		Forecasters.checkForecastArguments("Linear regression", historical, horizon, interval);
		final LinearFit fit = fit(historical);

		final Instant last = historical.get(historical.size() - 1).timestamp;
		final double lastX = Forecasters.toEpochSeconds(last);
		final double intervalSeconds = Forecasters.toSeconds(interval);
		final ImmutableList.Builder<Observation> builder = ImmutableList.builderWithExpectedSize(horizon);
		for(int k = 1; k <= horizon; k++) {
			final double x = lastX + k * intervalSeconds;
			builder.add(new Observation(Forecasters.projectTimestamp(last, interval, k), fit.valueAt(x)));
		}
		return builder.build();
	}

	/**
	 * Fits y = slope * x + intercept over the historical observations
	 *
	 * @throws DegenerateFitException if every observation has the same timestamp
	 */
	LinearFit fit(final List<Observation> historical)
		throws ForecastException
	{
		if(historical.isEmpty())
			throw new InsufficientHistoryException("Cannot fit a line to no observations");

		double minX = Double.POSITIVE_INFINITY;
		double maxX = Double.NEGATIVE_INFINITY;
		final SimpleRegression regression = new SimpleRegression(true);
		for(Observation observation : historical) {
			final double x = Forecasters.toEpochSeconds(observation.timestamp);
			minX = Math.min(minX, x);
			maxX = Math.max(maxX, x);
			regression.addData(x, observation.value);
		}
		if(minX == maxX)
			throw new DegenerateFitException(
				"No variance in time across " + historical.size() + " historical observations");

		final LinearFit fit = new LinearFit(regression.getSlope(), regression.getIntercept());
		log.debug("Fit " + fit + " over " + historical.size() + " observations");
		return fit;
	}

	/** Fitted line, x in seconds since epoch */
	static final class LinearFit {
		final double slope;
		final double intercept;

		LinearFit(double slope, double intercept) {
			this.slope = slope;
			this.intercept = intercept;
		}

		double valueAt(double x) {
			return slope * x + intercept;
		}

		@Override
		public String toString() {
			return "y = " + slope + " * x + " + intercept;
		}
	}
}
