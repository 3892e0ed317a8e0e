package org.javai.bulkops.adapter;

import org.javai.bulkops.BulkOperationException;

/**
 * Transport failure while counting items. Retryable.
 */
public class BulkCountException extends BulkOperationException {

	public BulkCountException(String message) {
		super(message, true);
	}

	public BulkCountException(String message, Throwable cause) {
		super(message, cause, true);
	}
}
