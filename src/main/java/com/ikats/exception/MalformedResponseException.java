package com.ikats.exception;

public class MalformedResponseException extends IkatsServerException {

	private static final long serialVersionUID = 1L;

	public MalformedResponseException(String message) {
		super(message);
	}

	public MalformedResponseException(String message, Throwable cause) {
		super(message, cause);
	}
}
