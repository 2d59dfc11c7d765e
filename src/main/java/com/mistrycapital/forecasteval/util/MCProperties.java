package com.mistrycapital.forecasteval.util;

import com.google.common.base.Splitter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

public class MCProperties extends Properties {
	private static final String DEFAULT_RESOURCE = "default.properties";
	private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	/**
	 * Loads default.properties from the classpath
	 */
	public MCProperties() {
		this(DEFAULT_RESOURCE);
	}

	/**
	 * Loads the given classpath resource
	 */
	public MCProperties(String resourceName) {
		try(InputStream in = getClass().getClassLoader().getResourceAsStream(resourceName)) {
			if(in == null)
				throw new IllegalStateException("Could not find properties resource " + resourceName);
			load(in);
		} catch(IOException e) {
			throw new UncheckedIOException("Could not load properties from " + resourceName, e);
		}
	}

	/**
	 * @return Value of a property that must be present
	 * @throws IllegalArgumentException if the property is missing
	 */
	public String getRequiredProperty(String key) {
		String value = getProperty(key);
		if(value == null)
			throw new IllegalArgumentException("Missing required property " + key);
		return value.trim();
	}

	public int getIntProperty(String key) {
		return Integer.parseInt(getRequiredProperty(key));
	}

	public int getIntProperty(String key, int defaultValue) {
		return Integer.parseInt(getProperty(key, Integer.toString(defaultValue)).trim());
	}

	public boolean getBooleanProperty(String key) {
		return Boolean.parseBoolean(getRequiredProperty(key));
	}

	public boolean getBooleanProperty(String key, boolean defaultValue) {
		return Boolean.parseBoolean(getProperty(key, Boolean.toString(defaultValue)).trim());
	}

	public double getDoubleProperty(String key) {
		return Double.parseDouble(getRequiredProperty(key));
	}

	public double getDoubleProperty(String key, double defaultValue) {
		return Double.parseDouble(getProperty(key, Double.toString(defaultValue)).trim());
	}

	/**
	 * @return Property given in whole seconds, as a Duration
	 */
	public Duration getSecondsProperty(String key, long defaultSeconds) {
		return Duration.ofSeconds(Long.parseLong(getProperty(key, Long.toString(defaultSeconds)).trim()));
	}

	/**
	 * @return Comma separated property split into trimmed, non-empty entries. Empty list if missing
	 */
	public List<String> getListProperty(String key) {
		return LIST_SPLITTER.splitToList(getProperty(key, ""));
	}
}
