package org.javai.bulkops.conversation;

import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.state.BulkOperationState;

/**
 * An actor tried to start a bulk operation while another one is still active.
 */
public class SessionAlreadyActiveException extends BulkOperationException {

	private final transient BulkOperationState activeState;

	public SessionAlreadyActiveException(BulkOperationState activeState) {
		super(String.format(
				"A bulk %s on %s is already in progress (%d/%d items processed). "
						+ "Say 'continue' to finish it or 'cancel' to stop it before starting another.",
				activeState.action(), activeState.domain(), activeState.processed(), activeState.totalItems()),
				false);
		this.activeState = activeState;
	}

	public BulkOperationState activeState() {
		return activeState;
	}
}
