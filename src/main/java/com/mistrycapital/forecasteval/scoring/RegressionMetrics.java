package com.mistrycapital.forecasteval.scoring;

/**
 * Quality of a forecast against actual values. rSquared is NaN when it is undefined
 */
public final class RegressionMetrics {
	public final double mae;
	public final double mse;
	public final double rmse;
	public final double rSquared;

	public RegressionMetrics(double mae, double mse, double rmse, double rSquared) {
		this.mae = mae;
		this.mse = mse;
		this.rmse = rmse;
		this.rSquared = rSquared;
	}

	public boolean hasRSquared() {
		return !Double.isNaN(rSquared);
	}

	@Override
	public boolean equals(final Object o) {
		if(this == o) return true;
		if(!(o instanceof RegressionMetrics)) return false;
		RegressionMetrics that = (RegressionMetrics) o;
		return Double.compare(mae, that.mae) == 0
			&& Double.compare(mse, that.mse) == 0
			&& Double.compare(rmse, that.rmse) == 0
			&& Double.compare(rSquared, that.rSquared) == 0;
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(mae);
		result = 31 * result + Double.hashCode(mse);
		result = 31 * result + Double.hashCode(rmse);
		result = 31 * result + Double.hashCode(rSquared);
		return result;
	}

	@Override
	public String toString() {
		return String.format("MAE=%.6f MSE=%.6f RMSE=%.6f R2=%.6f", mae, mse, rmse, rSquared);
	}
}
