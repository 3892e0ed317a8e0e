package org.javai.bulkops.state;

import org.javai.bulkops.BulkOperationException;

/**
 * Encodes {@link BulkOperationState} to text that an external key-value store can
 * hold, and restores it on the next turn.
 *
 * <p>The encoding carries a schema version and an integrity checksum. Decoding
 * verifies the checksum and migrates older schema versions transparently, so
 * {@code decode(encode(state))} equals {@code state} for every state the engine can
 * produce.</p>
 */
public interface BulkOperationStateSerializer {

	/**
	 * Encodes a state to text.
	 *
	 * @param state the state to encode
	 * @return a text-safe encoding
	 */
	String encode(BulkOperationState state);

	/**
	 * Decodes text produced by {@link #encode}.
	 *
	 * @param encoded the encoded state
	 * @return the state
	 * @throws IntegrityException if the text is not an encoded state or was altered
	 * @throws MigrationException if the schema version cannot be brought up to date
	 */
	BulkOperationState decode(String encoded);

	/**
	 * Pretty-prints an encoded state for debugging.
	 */
	String toReadableJson(String encoded);

	/**
	 * Thrown when an encoded state fails verification.
	 */
	class IntegrityException extends BulkOperationException {
		public IntegrityException(String message) {
			super(message, false);
		}

		public IntegrityException(String message, Throwable cause) {
			super(message, cause, false);
		}
	}

	/**
	 * Thrown when schema migration fails.
	 */
	class MigrationException extends BulkOperationException {
		public MigrationException(String message) {
			super(message, false);
		}

		public MigrationException(String message, Throwable cause) {
			super(message, cause, false);
		}
	}
}
