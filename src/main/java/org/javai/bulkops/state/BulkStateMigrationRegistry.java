package org.javai.bulkops.state;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Brings an encoded state up to the current schema.
 *
 * @see DefaultBulkStateMigrationRegistry
 */
public interface BulkStateMigrationRegistry {

	/**
	 * The schema version new encodings are written with.
	 */
	int currentVersion();

	/**
	 * Applies every migration from {@code fromVersion} up to {@link #currentVersion()}.
	 *
	 * @param state the {@code state} object of the envelope, modified in place
	 * @throws BulkOperationStateSerializer.MigrationException if the version is unknown
	 *         or a migration fails
	 */
	void upgrade(ObjectNode state, int fromVersion);
}
