package com.ikats.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * OpenTSDB naming of a timeseries: a metric and its tag key/value pairs.
 */
public class MetricTags {

	private final String metric;
	private final SortedMap<String, String> tags;

	public MetricTags(String metric, Map<String, String> tags) {
		this.metric = Objects.requireNonNull(metric, "metric");
		this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(tags));
	}

	public String getMetric() {
		return metric;
	}

	public SortedMap<String, String> getTags() {
		return tags;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MetricTags)) {
			return false;
		}
		MetricTags other = (MetricTags) o;
		return metric.equals(other.metric) && tags.equals(other.tags);
	}

	@Override
	public int hashCode() {
		return Objects.hash(metric, tags);
	}

	@Override
	public String toString() {
		return metric + tags;
	}
}
