package com.mistrycapital.forecasteval.util;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MCPropertiesTest {

	@Test
	void shouldLoadDefaults() {
		MCProperties properties = new MCProperties();
		assertTrue(properties.getIntProperty("horizon") > 0);
		assertFalse(properties.getListProperty("forecast.algorithms").isEmpty());
	}

	@Test
	void shouldGetTypedProperties() {
		MCProperties properties = new MCProperties();
		properties.setProperty("test.int", " 7 ");
		properties.setProperty("test.double", "0.25");
		properties.setProperty("test.bool", "true");
		properties.setProperty("test.seconds", "3600");
		properties.setProperty("test.list", "a, b,,c ");

		assertEquals(7, properties.getIntProperty("test.int"));
		assertEquals(3, properties.getIntProperty("test.missing", 3));
		assertEquals(0.25, properties.getDoubleProperty("test.double"));
		assertTrue(properties.getBooleanProperty("test.bool"));
		assertFalse(properties.getBooleanProperty("test.missing", false));
		assertEquals(Duration.ofHours(1), properties.getSecondsProperty("test.seconds", 0));
		assertEquals(Duration.ZERO, properties.getSecondsProperty("test.missing", 0));
		assertEquals(ImmutableList.of("a", "b", "c"), properties.getListProperty("test.list"));
		assertTrue(properties.getListProperty("test.missing").isEmpty());
		assertThrows(IllegalArgumentException.class, () -> properties.getRequiredProperty("test.missing"));
	}

	@Test
	void shouldFailOnMissingResource() {
		assertThrows(IllegalStateException.class, () -> new MCProperties("no-such.properties"));
	}
}
