package org.javai.bulkops.adapter;

import java.util.List;
import java.util.Map;

/**
 * Contract implemented once per integrated service that supports bulk operations.
 *
 * <p>Adapters are stateless and know nothing about conversation flow, confirmation
 * or persistence. They provide four primitives that the
 * {@link org.javai.bulkops.controller.BulkOperationController} composes:</p>
 * <ol>
 *   <li>{@link #prepare(Map)} turns raw parameters into a {@link PreparedBulkContext}</li>
 *   <li>{@link #getTotalCount(PreparedBulkContext)} counts matching items</li>
 *   <li>{@link #getNextBatch(PreparedBulkContext, int, int)} reads one page of items</li>
 *   <li>{@link #executeBatch(List, PreparedBulkContext)} applies the action to a page</li>
 * </ol>
 *
 * <p>Reading and writing are separate calls so the controller can bound exactly how
 * many items are in flight per turn.</p>
 */
public interface BulkToolAdapter {

	/**
	 * The domain tag this adapter is registered under (e.g. {@code "mail"}).
	 */
	String domain();

	/**
	 * Validates and normalizes user parameters, resolving human-readable names to ids.
	 * Must not fetch items or mutate anything.
	 *
	 * @param rawParams parameters as supplied by the front end
	 * @return the prepared context
	 * @throws BulkValidationException if parameters are missing or invalid, or a
	 *         named reference cannot be resolved
	 */
	PreparedBulkContext prepare(Map<String, Object> rawParams);

	/**
	 * Counts the items matching the context, preferring a count-only query.
	 *
	 * @return a non-negative count
	 * @throws BulkCountException on transport failure
	 */
	int getTotalCount(PreparedBulkContext context);

	/**
	 * Fetches up to {@code batchSize} items starting at {@code offset}.
	 * Returns an empty list once the items are exhausted. Must not mutate anything.
	 *
	 * @throws BulkFetchException on transport failure
	 */
	List<BulkItem> getNextBatch(PreparedBulkContext context, int batchSize, int offset);

	/**
	 * Applies the action to every item and reports one result per item, in input order.
	 *
	 * <p>A failure on a single item becomes a failed {@link BulkResult}. Only faults
	 * affecting the whole batch may be thrown, in which case the caller assumes that
	 * no item was processed.</p>
	 *
	 * @throws BulkExecutionException on a batch-wide fault
	 */
	List<BulkResult> executeBatch(List<BulkItem> items, PreparedBulkContext context);
}
