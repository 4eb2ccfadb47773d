package com.ikats.exception;

/**
 * HTTP 404: FID, TSUID, metadata, dataset or table absent.
 */
public class IkatsNotFoundException extends IkatsClientException {

	private static final long serialVersionUID = 1L;

	public IkatsNotFoundException(String message) {
		super(message);
	}
}
