package com.ikats.model;

import java.util.Objects;

/**
 * One timeseries point: timestamp in milliseconds since epoch, numeric value.
 */
public class DataPoint {

	private final long timestamp;
	private final double value;

	public DataPoint(long timestamp, double value) {
		this.timestamp = timestamp;
		this.value = value;
	}

	public long getTimestamp() {
		return timestamp;
	}

	public double getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof DataPoint)) {
			return false;
		}
		DataPoint other = (DataPoint) o;
		return timestamp == other.timestamp && Double.compare(value, other.value) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(timestamp, value);
	}

	@Override
	public String toString() {
		return "[" + timestamp + ", " + value + "]";
	}
}
