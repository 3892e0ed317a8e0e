package org.javai.bulkops.controller;

import java.util.Objects;
import org.javai.bulkops.state.BulkOperationState;

/**
 * The state produced by a controller call, paired with a summary of the call.
 * The caller is responsible for persisting {@link #state()}.
 *
 * @param state the updated state
 * @param summary what the call did
 */
public record BulkOperationResult(BulkOperationState state, BulkSummary summary) {

	public BulkOperationResult {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(summary, "summary must not be null");
	}

	public boolean isTerminal() {
		return state.status().isTerminal();
	}
}
