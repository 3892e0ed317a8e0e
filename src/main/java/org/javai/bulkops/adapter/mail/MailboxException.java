package org.javai.bulkops.adapter.mail;

/**
 * Failure reported by a {@link MailboxService} call.
 */
public class MailboxException extends Exception {

	private final int statusCode;

	public MailboxException(int statusCode, String message) {
		super(message);
		this.statusCode = statusCode;
	}

	public MailboxException(int statusCode, String message, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	/**
	 * HTTP-style status code of the failed call, or {@code 0} when none applies.
	 */
	public int statusCode() {
		return statusCode;
	}

	/**
	 * Whether the mailbox rejected the caller's credentials or permissions.
	 */
	public boolean isAuthorizationFailure() {
		return statusCode == 401 || statusCode == 403;
	}
}
