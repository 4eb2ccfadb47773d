package com.ikats.model;

import java.util.Objects;

public class MetadataEntry {

	public static final String START_DATE = "ikats_start_date";
	public static final String END_DATE = "ikats_end_date";
	public static final String NB_POINTS = "qual_nb_points";
	public static final String FUNC_ID = "funcId";

	private final String name;
	private final String value;
	private final MetadataType type;

	public MetadataEntry(String name, String value, MetadataType type) {
		this.name = name;
		this.value = value;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public String getValue() {
		return value;
	}

	public MetadataType getType() {
		return type;
	}

	/**
	 * Dates and point counts are stored as strings, possibly with a decimal part.
	 */
	public long getValueAsLong() {
		return (long) Double.parseDouble(value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MetadataEntry)) {
			return false;
		}
		MetadataEntry other = (MetadataEntry) o;
		return name.equals(other.name) && Objects.equals(value, other.value) && type == other.type;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value, type);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("MetadataEntry [name=");
		builder.append(name);
		builder.append(", value=");
		builder.append(value);
		builder.append(", type=");
		builder.append(type);
		builder.append("]");
		return builder.toString();
	}
}
