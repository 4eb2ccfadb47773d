package com.ikats.exception;

/**
 * HTTP 400: the backend rejected the parameters it was sent.
 */
public class IkatsInputException extends IkatsClientException {

	private static final long serialVersionUID = 1L;

	public IkatsInputException(String message) {
		super(message);
	}
}
