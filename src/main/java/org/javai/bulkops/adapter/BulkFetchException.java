package org.javai.bulkops.adapter;

import org.javai.bulkops.BulkOperationException;

/**
 * Transport failure while fetching a batch. Retryable; the state is left unchanged.
 */
public class BulkFetchException extends BulkOperationException {

	public BulkFetchException(String message) {
		super(message, true);
	}

	public BulkFetchException(String message, Throwable cause) {
		super(message, cause, true);
	}
}
