package com.ikats.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Local argument checks, run before any call to the backend.
 */
public final class IkatsChecks {

	private static final int MIN_NAME_LENGTH = 3;

	private IkatsChecks() {
	}

	public static String checkFid(String fid) {
		checkName("FID", fid);
		return fid;
	}

	public static String checkDatasetName(String name) {
		checkName("Dataset name", name);
		return name;
	}

	public static String checkTsuid(String tsuid) {
		if (StringUtils.isBlank(tsuid)) {
			throw new IllegalArgumentException("TSUID shall be set");
		}
		return tsuid;
	}

	public static long checkEpoch(Long value, String what) {
		if (value == null) {
			throw new IllegalArgumentException(what + " shall be set");
		}
		if (value < 0) {
			throw new IllegalArgumentException(String.format("%s shall be a positive epoch (got: %d)", what, value));
		}
		return value;
	}

	private static void checkName(String what, String value) {
		if (value == null) {
			throw new IllegalArgumentException(what + " shall be set");
		}
		if (value.length() < MIN_NAME_LENGTH) {
			throw new IllegalArgumentException(
					String.format("%s '%s' shall have at least %d characters", what, value, MIN_NAME_LENGTH));
		}
		if (StringUtils.containsWhitespace(value)) {
			throw new IllegalArgumentException(String.format("%s '%s' shall not contain spaces", what, value));
		}
	}
}
