package org.javai.bulkops.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.bulkops.state.BulkOperationStateSerializer.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable chain of migrations starting at schema version 1. The current version
 * is one past the last migration.
 *
 * <pre>{@code
 * var serializer = new JsonBulkOperationStateSerializer(
 *     DefaultBulkStateMigrationRegistry.of(new V1ToV2(), new V2ToV3()));
 * }</pre>
 */
public final class DefaultBulkStateMigrationRegistry implements BulkStateMigrationRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultBulkStateMigrationRegistry.class);

	private static final int FIRST_VERSION = 1;

	private final List<BulkStateMigration> chain;

	private DefaultBulkStateMigrationRegistry(List<BulkStateMigration> chain) {
		for (int i = 0; i < chain.size(); i++) {
			int expected = FIRST_VERSION + i;
			if (chain.get(i).fromVersion() != expected) {
				throw new IllegalArgumentException("Migration " + (i + 1) + " must upgrade v" + expected
						+ " but upgrades v" + chain.get(i).fromVersion());
			}
		}
		this.chain = chain;
	}

	/**
	 * @param migrations the migrations in order, the first one reading version 1
	 * @throws IllegalArgumentException if the chain has gaps, repeats or is out of order
	 */
	public static DefaultBulkStateMigrationRegistry of(BulkStateMigration... migrations) {
		return new DefaultBulkStateMigrationRegistry(List.of(migrations));
	}

	@Override
	public int currentVersion() {
		return FIRST_VERSION + chain.size();
	}

	@Override
	public void upgrade(ObjectNode state, int fromVersion) {
		int current = currentVersion();
		if (fromVersion > current) {
			throw new MigrationException("State version " + fromVersion + " is newer than current version " + current);
		}
		if (fromVersion < FIRST_VERSION) {
			throw new MigrationException("Unknown state version " + fromVersion);
		}
		if (fromVersion < current) {
			logger.info("Migrating bulk operation state from version {} to {}", fromVersion, current);
		}
		for (BulkStateMigration migration : chain.subList(fromVersion - FIRST_VERSION, chain.size())) {
			try {
				migration.migrate(state);
			} catch (RuntimeException e) {
				throw new MigrationException("Migration failed: " + migration.description(), e);
			}
		}
	}
}
