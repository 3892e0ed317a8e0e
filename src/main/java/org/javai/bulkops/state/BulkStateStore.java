package org.javai.bulkops.state;

import java.util.Optional;

/**
 * Persistence contract for bulk operation state, keyed by actor id. At most one
 * state is held per actor.
 */
public interface BulkStateStore {
	Optional<BulkOperationState> load(String actorId);
	void save(String actorId, BulkOperationState state);
	void delete(String actorId);
}
