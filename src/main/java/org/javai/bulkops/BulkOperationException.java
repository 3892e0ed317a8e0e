package org.javai.bulkops;

/**
 * Base type for every failure raised by the bulk operations engine.
 *
 * <p>Item-level failures are never thrown; they are reported through
 * {@link org.javai.bulkops.adapter.BulkResult}. Anything that reaches the caller
 * as a {@code BulkOperationException} left the persisted state untouched, so
 * {@link #isRetryable()} tells the front end whether repeating the same call on a
 * later turn can succeed.</p>
 */
public class BulkOperationException extends RuntimeException {

	private final boolean retryable;

	public BulkOperationException(String message, boolean retryable) {
		super(message);
		this.retryable = retryable;
	}

	public BulkOperationException(String message, Throwable cause, boolean retryable) {
		super(message, cause);
		this.retryable = retryable;
	}

	/**
	 * Whether the same call may succeed if repeated unchanged.
	 */
	public boolean isRetryable() {
		return retryable;
	}
}
