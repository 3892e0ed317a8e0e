package org.javai.bulkops.state;

/**
 * Lifecycle of a bulk operation. Only {@link #ACTIVE} may transition; both other
 * values are terminal.
 */
public enum BulkStatus {
	ACTIVE,
	COMPLETED,
	CANCELLED;

	public boolean isTerminal() {
		return this != ACTIVE;
	}
}
