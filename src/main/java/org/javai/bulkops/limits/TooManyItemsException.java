package org.javai.bulkops.limits;

import org.javai.bulkops.BulkOperationException;

/**
 * Thrown when an operation would cover more items than the configured maximum.
 * The caller is expected to narrow the query and start again.
 */
public class TooManyItemsException extends BulkOperationException {

	private final int requested;
	private final int limit;

	public TooManyItemsException(int requested, int limit) {
		super("This operation would affect " + requested + " items, which exceeds the maximum of "
				+ limit + ". Narrow the query and try again.", false);
		this.requested = requested;
		this.limit = limit;
	}

	public int requested() {
		return requested;
	}

	public int limit() {
		return limit;
	}
}
