package org.javai.bulkops.state;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.bulkops.adapter.PreparedBulkContext;

/**
 * Progress through one multi-item job.
 *
 * <p>Immutable value that the front end persists between turns and hands back on the
 * next one. It carries no adapter handles or callbacks, so an operation can always be
 * resumed from its serialized form.</p>
 *
 * <p>Invariants enforced on construction:</p>
 * <ul>
 *   <li>{@code 0 <= processed <= totalItems}</li>
 *   <li>{@code batchSize >= 1} and {@code cursor >= 0}</li>
 *   <li>identity fields, context, timestamps and status are non-null</li>
 * </ul>
 *
 * @param operationId unique id assigned at start
 * @param domain the adapter domain tag
 * @param action the action applied to every item
 * @param context the prepared context handed to the adapter on every call
 * @param totalItems number of items counted at start
 * @param batchSize items processed per continue call
 * @param processed items processed so far, successful or not
 * @param cursor offset of the next fetch
 * @param errors failed items, in the order they were processed
 * @param createdAt when the operation was started
 * @param status current lifecycle status
 */
public record BulkOperationState(
		String operationId,
		String domain,
		String action,
		PreparedBulkContext context,
		int totalItems,
		int batchSize,
		int processed,
		int cursor,
		List<BulkItemError> errors,
		Instant createdAt,
		BulkStatus status
) {

	public BulkOperationState {
		Objects.requireNonNull(operationId, "operationId must not be null");
		Objects.requireNonNull(domain, "domain must not be null");
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(context, "context must not be null");
		Objects.requireNonNull(createdAt, "createdAt must not be null");
		Objects.requireNonNull(status, "status must not be null");
		if (totalItems < 0) {
			throw new IllegalArgumentException("totalItems must be non-negative: " + totalItems);
		}
		if (batchSize < 1) {
			throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
		}
		if (processed < 0 || processed > totalItems) {
			throw new IllegalArgumentException(
					"processed must be within [0, " + totalItems + "]: " + processed);
		}
		if (cursor < 0) {
			throw new IllegalArgumentException("cursor must be non-negative: " + cursor);
		}
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	/**
	 * Creates the state of a freshly started operation.
	 */
	public static BulkOperationState started(String operationId, PreparedBulkContext context,
			int totalItems, int batchSize, Instant createdAt) {
		return new BulkOperationState(operationId, context.domain(), context.action(), context,
				totalItems, batchSize, 0, 0, List.of(), createdAt, BulkStatus.ACTIVE);
	}

	public int remaining() {
		return totalItems - processed;
	}

	public boolean isActive() {
		return status == BulkStatus.ACTIVE;
	}

	/**
	 * Creates a copy advanced past a processed batch.
	 *
	 * @param batchLength number of items processed in the batch
	 * @param batchErrors failures from the batch, appended to the accumulated errors
	 * @param nextStatus status after the batch
	 */
	public BulkOperationState advancedBy(int batchLength, List<BulkItemError> batchErrors, BulkStatus nextStatus) {
		List<BulkItemError> merged = new ArrayList<>(errors);
		if (batchErrors != null) {
			merged.addAll(batchErrors);
		}
		return new BulkOperationState(operationId, domain, action, context, totalItems, batchSize,
				processed + batchLength, cursor + batchLength, merged, createdAt, nextStatus);
	}

	/**
	 * Creates a copy with a different status and otherwise unchanged progress.
	 */
	public BulkOperationState withStatus(BulkStatus nextStatus) {
		return new BulkOperationState(operationId, domain, action, context, totalItems, batchSize,
				processed, cursor, errors, createdAt, nextStatus);
	}
}
