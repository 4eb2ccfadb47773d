package com.ikats.http;

import com.ikats.exception.IkatsClientException;
import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsInputException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.exception.IkatsServerException;

/**
 * Translation of HTTP status codes into the IKATS exception taxonomy.
 */
public final class StatusChecks {

	private StatusChecks() {
	}

	/**
	 * Accepts any 2xx, raises the matching exception otherwise.
	 */
	public static void check(RestResponse response) {
		if (response.isSuccessful()) {
			return;
		}
		is400(response, "Invalid parameters sent");
		is404(response, "No results");
		is409(response, "Conflict");
		is4xx(response, "Unexpected client error: {code}");
		is5xx(response, "Unexpected server error: {code}");
		throw new IkatsServerException("Unexpected status " + response);
	}

	public static void is400(RestResponse response, String message) {
		if (response.getStatusCode() == 400) {
			throw new IkatsInputException(message);
		}
	}

	public static void is404(RestResponse response, String message) {
		if (response.getStatusCode() == 404) {
			throw new IkatsNotFoundException(message);
		}
	}

	public static void is409(RestResponse response, String message) {
		if (response.getStatusCode() == 409) {
			throw new IkatsConflictException(message);
		}
	}

	/**
	 * {@code {code}} in the message is replaced by the status code.
	 */
	public static void is4xx(RestResponse response, String message) {
		int code = response.getStatusCode();
		if (code >= 400 && code < 500) {
			throw new IkatsClientException(withCode(message, code));
		}
	}

	public static void is5xx(RestResponse response, String message) {
		int code = response.getStatusCode();
		if (code >= 500 && code < 600) {
			throw new IkatsServerException(withCode(message, code));
		}
	}

	private static String withCode(String message, int code) {
		return message.replace("{code}", String.valueOf(code));
	}
}
