package com.ikats.opentsdb.model;

public enum UidType {

	METRIC("metric"),
	TAGK("tagk"),
	TAGV("tagv");

	private final String value;

	UidType(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/**
	 * Name of the bucket listing the names that were already assigned.
	 */
	public String getErrorsBucket() {
		return value + "_errors";
	}
}
