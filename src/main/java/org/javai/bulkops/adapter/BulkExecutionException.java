package org.javai.bulkops.adapter;

import org.javai.bulkops.BulkOperationException;

/**
 * A fault that affected a whole batch during {@link BulkToolAdapter#executeBatch}.
 * The caller must assume no item in the batch was processed.
 */
public class BulkExecutionException extends BulkOperationException {

	public BulkExecutionException(String message) {
		super(message, true);
	}

	public BulkExecutionException(String message, Throwable cause) {
		super(message, cause, true);
	}

	public BulkExecutionException(String message, Throwable cause, boolean retryable) {
		super(message, cause, retryable);
	}
}
