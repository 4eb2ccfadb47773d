package com.ikats.model;

public enum MetadataType {

	STRING("string"),
	DATE("date"),
	NUMBER("number"),
	COMPLEX("complex");

	private final String value;

	MetadataType(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	public static MetadataType fromValue(String value) {
		for (MetadataType type : values()) {
			if (type.value.equalsIgnoreCase(value)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown metadata type: " + value);
	}
}
