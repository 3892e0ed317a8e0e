package org.javai.bulkops.gate;

/**
 * What a user's message means while a bulk operation is waiting for confirmation.
 */
public enum BulkIntent {
	/** Process the next batch. */
	CONTINUE,
	/** Stop the operation. */
	CANCEL,
	/** Neither; the operation stays paused. */
	UNRELATED
}
