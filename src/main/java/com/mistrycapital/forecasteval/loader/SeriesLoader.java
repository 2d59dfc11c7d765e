package com.mistrycapital.forecasteval.loader;

import com.mistrycapital.forecasteval.model.Observation;
import com.mistrycapital.forecasteval.model.Series;
import com.mistrycapital.forecasteval.util.MCLoggerFactory;
import com.mistrycapital.forecasteval.util.MCProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads CSV files with a header row into series. Rows are grouped by the name column, in the order names
 * first appear, and each series is sorted by timestamp. Rows with a blank value are skipped.
 * <p>
 * Timestamps may be ISO dates (2018-03-10), ISO date-times with or without offset, or epoch seconds. Times
 * without an offset are taken as UTC.
 */
public class SeriesLoader {
	private static final Logger log = MCLoggerFactory.getLogger();

	private final String group;
	private final Duration interval;
	private final String timeColumn;
	private final String nameColumn;
	private final String valueColumn;

	public SeriesLoader(String group, Duration interval, String timeColumn, String nameColumn,
		String valueColumn)
	{
		this.group = group;
		this.interval = interval;
		this.timeColumn = timeColumn;
		this.nameColumn = nameColumn;
		this.valueColumn = valueColumn;
	}

	/**
	 * Daily stock prices with columns Date,Name,Open,Close,High,Low,Volume. Each stock becomes a series of
	 * closing prices
	 */
	public static SeriesLoader stocks() {
		return new SeriesLoader("Stock", Duration.ofDays(1), "Date", "Name", "Close");
	}

	/**
	 * Loader for source.&lt;id&gt;.* properties. Missing columns default to the stock layout, the group to the id
	 * and the interval to one day
	 */
	public static SeriesLoader fromProperties(MCProperties properties, String id) {
		final String prefix = "source." + id + ".";
		return new SeriesLoader(
			properties.getProperty(prefix + "group", id),
			properties.getSecondsProperty(prefix + "intervalSeconds", Duration.ofDays(1).getSeconds()),
			properties.getProperty(prefix + "timeColumn", "Date"),
			properties.getProperty(prefix + "nameColumn", "Name"),
			properties.getProperty(prefix + "valueColumn", "Close")
		);
	}

	public String getGroup() {
		return group;
	}

	public Duration getInterval() {
		return interval;
	}

	/**
	 * @return One series per distinct name in the file
	 */
	public List<Series> load(Path csvFile)
		throws IOException
	{
		log.info("Loading " + group + " series from " + csvFile);
		try(Reader in = Files.newBufferedReader(csvFile)) {
			return load(in, csvFile.toString());
		}
	}

	/**
	 * @param sourceName Used in error messages
	 * @throws IllegalArgumentException if a column is missing or a row cannot be parsed
	 */
	public List<Series> load(Reader in, String sourceName)
		throws IOException
	{
		final Map<String,List<Observation>> observationsByName = new LinkedHashMap<>();
		try(CSVParser parser = CSVFormat.EXCEL.withFirstRecordAsHeader().parse(in)) {
			final Map<String,Integer> headerMap = parser.getHeaderMap();
			for(String column : new String[] {timeColumn, nameColumn, valueColumn})
				if(!headerMap.containsKey(column))
					throw new IllegalArgumentException(sourceName + " has no column " + column);

			for(CSVRecord record : parser) {
				try {
					final String value = record.get(valueColumn).trim();
					if(value.isEmpty())
						continue;
					final Observation observation =
						new Observation(parseTimestamp(record.get(timeColumn)), Double.parseDouble(value));
					observationsByName.computeIfAbsent(record.get(nameColumn).trim(), k -> new ArrayList<>())
						.add(observation);
				} catch(IllegalArgumentException | DateTimeException e) {
					// short records, unparseable numbers and timestamps outside the Instant range
					throw new IllegalArgumentException(
						"Could not parse record " + record.getRecordNumber() + " of " + sourceName, e);
				}
			}
		}

		final List<Series> seriesList = new ArrayList<>(observationsByName.size());
		for(var entry : observationsByName.entrySet()) {
			final List<Observation> observations = entry.getValue();
			observations.sort(Comparator.naturalOrder());
			seriesList.add(new Series(entry.getKey(), group, interval, observations));
		}
		log.debug("Read " + seriesList.size() + " series from " + sourceName);
		return seriesList;
	}

	static Instant parseTimestamp(String text) {
		final String trimmed = text.trim();
		if(trimmed.matches("-?\\d+"))
			return Instant.ofEpochSecond(Long.parseLong(trimmed));
		if(trimmed.length() == 10)
			return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
		if(trimmed.endsWith("Z"))
			return Instant.parse(trimmed);
		try {
			return OffsetDateTime.parse(trimmed).toInstant();
		} catch(DateTimeParseException e) {
			return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
		}
	}
}
