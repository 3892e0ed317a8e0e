package org.javai.bulkops.controller;

import org.javai.bulkops.BulkOperationException;

/**
 * A transition was requested on a state that does not allow it, such as continuing a
 * completed operation. This indicates an integration bug rather than a user error.
 */
public class InvalidBulkStateException extends BulkOperationException {

	public InvalidBulkStateException(String message) {
		super(message, false);
	}
}
