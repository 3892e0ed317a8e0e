package org.javai.bulkops.controller;

import java.util.List;
import org.javai.bulkops.state.BulkItemError;
import org.javai.bulkops.state.BulkOperationState;
import org.javai.bulkops.state.BulkStatus;

/**
 * What happened during one controller call.
 *
 * @param processedThisBatch items processed by this call (zero for start and cancel)
 * @param processedTotal items processed since start
 * @param remaining items not yet processed
 * @param total items counted at start
 * @param batchErrors failures from this call only
 * @param totalErrors failures accumulated since start
 * @param status status after the call
 */
public record BulkSummary(
		int processedThisBatch,
		int processedTotal,
		int remaining,
		int total,
		List<BulkItemError> batchErrors,
		int totalErrors,
		BulkStatus status
) {

	public BulkSummary {
		batchErrors = batchErrors != null ? List.copyOf(batchErrors) : List.of();
	}

	/**
	 * Summarizes a state after a call that processed {@code processedThisBatch} items.
	 */
	public static BulkSummary of(BulkOperationState state, int processedThisBatch, List<BulkItemError> batchErrors) {
		return new BulkSummary(processedThisBatch, state.processed(), state.remaining(), state.totalItems(),
				batchErrors, state.errors().size(), state.status());
	}

	/**
	 * Summarizes a state after a call that processed nothing.
	 */
	public static BulkSummary of(BulkOperationState state) {
		return of(state, 0, List.of());
	}

	/**
	 * Whether the user has to confirm before anything else happens.
	 */
	public boolean needsConfirmation() {
		return status == BulkStatus.ACTIVE;
	}
}
