package com.mistrycapital.forecasteval.scoring;

import com.mistrycapital.forecasteval.model.Observation;

import java.util.List;

/**
 * Scores a forecast against the actual values it predicts.
 * <p>
 * Values are paired by position, not by timestamp: actual[i] is compared to forecast[i]. Forecasters emit
 * points on the series interval, so for regularly spaced series the two line up. Gaps in the actual data are
 * not realigned.
 */
public class ForecastScorer {
	/**
	 * @return MAE, MSE, RMSE and R² over positionally paired values
	 * @throws LengthMismatchException if the sequences differ in length
	 */
	public RegressionMetrics evaluate(final List<Observation> actual, final List<Observation> forecast)
		throws LengthMismatchException
	{
		if(actual.size() != forecast.size())
			throw new LengthMismatchException(actual.size(), forecast.size());
		if(actual.isEmpty())
			return new RegressionMetrics(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

		final int n = actual.size();
		double actualSum = 0.0;
		for(final Observation observation : actual)
			actualSum += observation.value;
		final double actualMean = actualSum / n;

		double absSum = 0.0;
		double squaredResidualSum = 0.0;
		double squaredTotalSum = 0.0;
		for(int i = 0; i < n; i++) {
			final double a = actual.get(i).value;
			final double error = a - forecast.get(i).value;
			absSum += Math.abs(error);
			squaredResidualSum += error * error;
			final double deviation = a - actualMean;
			squaredTotalSum += deviation * deviation;
		}

		final double mse = squaredResidualSum / n;
		return new RegressionMetrics(absSum / n, mse, Math.sqrt(mse), rSquared(squaredResidualSum, squaredTotalSum));
	}

	/**
	 * R² is undefined against constant actual values. A perfect forecast of a constant still counts as 1
	 */
	private static double rSquared(double squaredResidualSum, double squaredTotalSum) {
		if(squaredTotalSum == 0.0)
			return squaredResidualSum == 0.0 ? 1.0 : Double.NaN;
		return 1.0 - squaredResidualSum / squaredTotalSum;
	}
}
