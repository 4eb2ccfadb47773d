package com.ikats.exception;

/**
 * HTTP 5xx, or any answer the client cannot make sense of.
 */
public class IkatsServerException extends IkatsException {

	private static final long serialVersionUID = 1L;

	public IkatsServerException(String message) {
		super(message);
	}

	public IkatsServerException(String message, Throwable cause) {
		super(message, cause);
	}
}
