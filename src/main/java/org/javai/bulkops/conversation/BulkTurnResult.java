package org.javai.bulkops.conversation;

import org.javai.bulkops.state.BulkOperationState;

/**
 * Result of one turn handled by the {@link BulkConversationManager}.
 *
 * <p>When {@code handled} is false no bulk operation was pending and the caller routes
 * the message as usual; {@code response} is then null. In blob mode
 * {@code encodedState} is what the caller stores for the next turn; it is null once
 * the operation has been cleared.</p>
 *
 * @param handled whether the bulk layer answered this turn
 * @param response text for the user
 * @param state the state after this turn (the final state when cleared)
 * @param encodedState serialized state to hand back next turn (blob mode only)
 * @param cleared whether the operation ended and its state was discarded
 */
public record BulkTurnResult(
		boolean handled,
		String response,
		BulkOperationState state,
		String encodedState,
		boolean cleared
) {

	static BulkTurnResult notHandled(BulkOperationState state, String encodedState) {
		return new BulkTurnResult(false, null, state, encodedState, false);
	}
}
