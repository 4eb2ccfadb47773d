package com.ikats.exception;

/**
 * HTTP 409: duplicate creation (FID already bound, dataset or table name taken,
 * timeseries still referenced by a dataset).
 */
public class IkatsConflictException extends IkatsClientException {

	private static final long serialVersionUID = 1L;

	public IkatsConflictException(String message) {
		super(message);
	}
}
