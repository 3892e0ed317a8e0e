package org.javai.bulkops.gate;

import java.util.Objects;
import org.javai.bulkops.state.BulkOperationState;

/**
 * Result of consulting the {@link BulkGate} for one turn.
 * <ul>
 *   <li>{@link NotHandled} - no operation is pending; route the message normally</li>
 *   <li>{@link Handled} - the gate answered the message</li>
 * </ul>
 */
public sealed interface GateOutcome {

	static GateOutcome notHandled() {
		return NotHandled.INSTANCE;
	}

	boolean handled();

	/**
	 * No active operation; the front end continues with ordinary intent routing.
	 */
	final class NotHandled implements GateOutcome {
		private static final NotHandled INSTANCE = new NotHandled();

		private NotHandled() {
		}

		@Override
		public boolean handled() {
			return false;
		}

		@Override
		public String toString() {
			return "NotHandled";
		}
	}

	/**
	 * The gate consumed the message.
	 *
	 * @param intent how the message was classified
	 * @param response text to send back to the user
	 * @param state the state to persist; for cleared outcomes this is the final,
	 *        terminal state
	 * @param clearState whether the caller should delete the stored state
	 */
	record Handled(BulkIntent intent, String response, BulkOperationState state, boolean clearState)
			implements GateOutcome {

		public Handled {
			Objects.requireNonNull(intent, "intent must not be null");
			Objects.requireNonNull(response, "response must not be null");
			Objects.requireNonNull(state, "state must not be null");
		}

		@Override
		public boolean handled() {
			return true;
		}
	}
}
