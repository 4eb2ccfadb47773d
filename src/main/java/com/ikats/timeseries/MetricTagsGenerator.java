package com.ikats.timeseries;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.ikats.model.MetricTags;

/**
 * Default OpenTSDB naming of a new timeseries, derived from the import time.
 * <p>
 * OpenTSDB handles 16M metrics, tag keys and tag values. The metric is the count of hundreds of
 * nanoseconds of the current second on 7 digits (domain [0, 9999999]), so two timeseries created
 * at the same time almost never share a name. The tags carry the import date:
 * <ul>
 * <li>{@code import_year}: 4 digits, e.g. {@code 2016}</li>
 * <li>{@code import_month_day}: {@code MM_dd}, e.g. {@code 11_05}</li>
 * <li>{@code import_time}: {@code HH_mm_ss}, e.g. {@code 14_05_35}</li>
 * </ul>
 */
public class MetricTagsGenerator {

	public static final String IMPORT_YEAR = "import_year";
	public static final String IMPORT_MONTH_DAY = "import_month_day";
	public static final String IMPORT_TIME = "import_time";

	private static final DateTimeFormatter YEAR = DateTimeFormatter.ofPattern("yyyy");
	private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM_dd");
	private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH_mm_ss");

	private final Clock clock;

	public MetricTagsGenerator() {
		this(Clock.systemDefaultZone());
	}

	public MetricTagsGenerator(Clock clock) {
		this.clock = clock;
	}

	public MetricTags generate() {
		return generate(null, null);
	}

	/**
	 * Supplied values are used verbatim; a null or empty value is replaced by the default.
	 */
	public MetricTags generate(String metric, Map<String, String> tags) {
		Instant now = clock.instant();
		ZonedDateTime date = now.atZone(clock.getZone());

		String localMetric = metric;
		if (localMetric == null || localMetric.isEmpty()) {
			localMetric = String.format("%07d", now.getNano() / 100);
		}
		Map<String, String> localTags = tags;
		if (localTags == null || localTags.isEmpty()) {
			localTags = new LinkedHashMap<>();
			localTags.put(IMPORT_YEAR, YEAR.format(date));
			localTags.put(IMPORT_MONTH_DAY, MONTH_DAY.format(date));
			localTags.put(IMPORT_TIME, TIME.format(date));
		}
		return new MetricTags(localMetric, localTags);
	}
}
