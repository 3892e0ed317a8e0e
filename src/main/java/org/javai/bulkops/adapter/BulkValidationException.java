package org.javai.bulkops.adapter;

import org.javai.bulkops.BulkOperationException;

/**
 * Thrown by {@link BulkToolAdapter#prepare} when parameters are missing or invalid,
 * or a named reference cannot be resolved. No state is created.
 */
public class BulkValidationException extends BulkOperationException {

	public BulkValidationException(String message) {
		super(message, false);
	}

	public BulkValidationException(String message, Throwable cause) {
		super(message, cause, false);
	}
}
