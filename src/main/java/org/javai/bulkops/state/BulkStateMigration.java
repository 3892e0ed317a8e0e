package org.javai.bulkops.state;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Upgrades the JSON of an encoded state from one schema version to the next.
 *
 * <pre>{@code
 * BulkStateMigration renameProcessed = new BulkStateMigration() {
 *     public int fromVersion() { return 1; }
 *     public void migrate(ObjectNode state) {
 *         state.set("processedCount", state.remove("processed"));
 *     }
 * };
 * }</pre>
 */
public interface BulkStateMigration {

	/**
	 * The schema version this migration reads. It writes {@code fromVersion() + 1}.
	 */
	int fromVersion();

	/**
	 * Transforms the {@code state} object of the envelope in place. Older versions may lack fields.
	 */
	void migrate(ObjectNode state);

	default String description() {
		return "Migrate bulk state from v" + fromVersion() + " to v" + (fromVersion() + 1);
	}
}
