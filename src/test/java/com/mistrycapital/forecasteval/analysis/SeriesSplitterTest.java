package com.mistrycapital.forecasteval.analysis;

import com.google.common.collect.ImmutableList;
import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.Series;
import com.mistrycapital.forecasteval.model.SeriesFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesSplitterTest {

	@Test
	void shouldHoldOutMostRecentObservations() {
		Series series = SeriesFixtures.series("s", "g", 1, 2, 3, 4, 5, 6, 7);
		for(int horizon = 1; horizon < series.size(); horizon++) {
			SeriesSplit split = SeriesSplitter.split(series, horizon);
			assertEquals(horizon, split.actual.size());
			assertEquals(series.size() - horizon, split.historical.size());

			List<Observation> joined = new ArrayList<>(split.historical);
			joined.addAll(split.actual);
			assertEquals(series.getObservations(), joined);
		}

		SeriesSplit split = SeriesSplitter.split(series, 2);
		assertEquals(6.0, split.actual.get(0).value);
		assertEquals(7.0, split.actual.get(1).value);
	}

	@Test
	void shouldLeaveNoHistoryForShortSeries() {
		Series series = SeriesFixtures.series("s", "g", 1, 2, 3);
		SeriesSplit split = SeriesSplitter.split(series, 3);
		assertTrue(split.historical.isEmpty());
		assertEquals(series.getObservations(), split.actual);

		split = SeriesSplitter.split(series, 10);
		assertTrue(split.historical.isEmpty());
		assertEquals(3, split.actual.size());
	}

	@Test
	void shouldRejectBadInput() {
		Series empty = new Series("empty", "g", SeriesFixtures.ONE_SECOND, ImmutableList.of());
		assertThrows(IllegalArgumentException.class, () -> SeriesSplitter.split(empty, 1));
		assertThrows(IllegalArgumentException.class,
			() -> SeriesSplitter.split(SeriesFixtures.series("s", "g", 1, 2), 0));
	}
}
