package com.mistrycapital.forecasteval.util;

import java.lang.StackWalker.Option;
import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MCLoggerFactory {
	/** Root of all loggers created for this project */
	public static final String BASE_LOGGER = "com.mistrycapital.forecasteval";
	/** Prefix of properties naming a level per project package, e.g. log.level.forecasts=WARN */
	public static final String LEVEL_PROPERTY_PREFIX = "log.level.";

	/**
	 * @return Logger for the calling class
	 */
	public static Logger getLogger() {
		return LoggerFactory.getLogger(StackWalker.getInstance(Option.RETAIN_CLASS_REFERENCE).getCallerClass());
	}

	/**
	 * Reset log level for all project loggers, e.g. to quiet per-series debug output on large batches
	 */
	public static void resetLogLevel(Level level) {
		setLogLevel("", level);
	}

	/**
	 * Set the level of one project package, given relative to the base package ("analysis", "forecasts").
	 * An empty name means the whole project
	 */
	public static void setLogLevel(String relativePackage, Level level) {
		LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
		context.getLogger(loggerName(relativePackage)).setLevel(level);
	}

	/**
	 * Apply every log.level.&lt;package&gt; property. Unknown level names fall back to DEBUG, as logback does
	 *
	 * @return Number of package levels applied
	 */
	public static int applyLogLevels(MCProperties properties) {
		int applied = 0;
		for(Map.Entry<Object,Object> entry : properties.entrySet()) {
			final String key = entry.getKey().toString();
			if(!key.startsWith(LEVEL_PROPERTY_PREFIX))
				continue;

			setLogLevel(key.substring(LEVEL_PROPERTY_PREFIX.length()), Level.toLevel(entry.getValue().toString().trim()));
			applied++;
		}
		return applied;
	}

	static String loggerName(String relativePackage) {
		return relativePackage.isEmpty() ? BASE_LOGGER : BASE_LOGGER + "." + relativePackage;
	}
}
