package com.ikats.opentsdb.model;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * One point of an {@code api/put} request body.
 */
public class PutPoint {

	private static final int TIMESTAMP_DIGITS = 13;

	private String metric;
	private String timestamp;
	private double value;
	private Map<String, String> tags;

	public PutPoint(String metric, long timestamp, double value, Map<String, String> tags) {
		this.metric = metric;
		this.timestamp = StringUtils.leftPad(String.valueOf(timestamp), TIMESTAMP_DIGITS, '0');
		this.value = value;
		this.tags = tags;
	}

	public String getMetric() {
		return metric;
	}

	public String getTimestamp() {
		return timestamp;
	}

	public double getValue() {
		return value;
	}

	public Map<String, String> getTags() {
		return tags;
	}
}
