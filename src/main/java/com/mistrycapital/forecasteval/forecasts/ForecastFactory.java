package com.mistrycapital.forecasteval.forecasts;

import com.google.common.collect.ImmutableMap;
import com.mistrycapital.forecasteval.util.MCProperties;

import java.lang.reflect.InvocationTargetException;

public class ForecastFactory {
	private static final String PACKAGE_PREFIX = "com.mistrycapital.forecasteval.forecasts.";
	private static final String CLASS_SUFFIX = "Forecaster";

	/**
	 * Builds the forecasters named in the forecast.algorithms property, e.g. "LinearRegression,MovingAverage".
	 * Each name resolves to the class of the same name plus "Forecaster" in this package, constructed with
	 * the given properties. Full class names such as "LinearRegressionForecaster" are accepted too and are
	 * reported under their short name.
	 *
	 * @return Algorithm name to forecaster, in configured order
	 */
	public static ImmutableMap<String,Forecaster> getForecasters(MCProperties properties) {
		final var names = properties.getListProperty("forecast.algorithms");
		if(names.isEmpty())
			throw new IllegalArgumentException("No forecast algorithms configured in forecast.algorithms");

		// builder rejects duplicate names
		final ImmutableMap.Builder<String,Forecaster> builder = ImmutableMap.builder();
		for(String name : names) {
			final String algorithm = algorithmName(name);
			builder.put(algorithm, getForecasterInstance(algorithm, properties));
		}
		return builder.buildOrThrow();
	}

	/** @return Configured name without any trailing "Forecaster" */
	static String algorithmName(String configuredName) {
		if(configuredName.endsWith(CLASS_SUFFIX) && configuredName.length() > CLASS_SUFFIX.length())
			return configuredName.substring(0, configuredName.length() - CLASS_SUFFIX.length());
		return configuredName;
	}

	/** @return Forecaster for a single algorithm name, with or without the Forecaster suffix */
	public static Forecaster getForecasterInstance(String name, MCProperties properties) {
		final Class<?> clazz;
		try {
			clazz = Class.forName(PACKAGE_PREFIX + algorithmName(name) + CLASS_SUFFIX);
		} catch(ClassNotFoundException e) {
			throw new IllegalArgumentException("Unknown forecast algorithm " + name, e);
		}
		if(!Forecaster.class.isAssignableFrom(clazz))
			throw new IllegalArgumentException(clazz.getName() + " is not a Forecaster");

		try {
			return (Forecaster) clazz.getConstructor(MCProperties.class).newInstance(properties);
		} catch(NoSuchMethodException | IllegalAccessException | InstantiationException
			| InvocationTargetException e) {
			throw new RuntimeException("Could not construct forecaster " + name, e);
		}
	}
}
