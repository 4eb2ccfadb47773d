package com.ikats.exception;

/**
 * The backend answered with a 4xx status.
 */
public class IkatsClientException extends IkatsException {

	private static final long serialVersionUID = 1L;

	public IkatsClientException(String message) {
		super(message);
	}
}
