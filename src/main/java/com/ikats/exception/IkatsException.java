package com.ikats.exception;

/**
 * Root of the errors reported by the IKATS backends.
 */
public class IkatsException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public IkatsException(String message) {
		super(message);
	}

	public IkatsException(String message, Throwable cause) {
		super(message, cause);
	}
}
