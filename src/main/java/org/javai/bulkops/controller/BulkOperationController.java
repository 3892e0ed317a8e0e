package org.javai.bulkops.controller;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.adapter.BulkCountException;
import org.javai.bulkops.adapter.BulkExecutionException;
import org.javai.bulkops.adapter.BulkFetchException;
import org.javai.bulkops.adapter.BulkItem;
import org.javai.bulkops.adapter.BulkResult;
import org.javai.bulkops.adapter.BulkToolAdapter;
import org.javai.bulkops.adapter.BulkValidationException;
import org.javai.bulkops.adapter.PreparedBulkContext;
import org.javai.bulkops.limits.CapacityLimiter;
import org.javai.bulkops.limits.CapacityLimits;
import org.javai.bulkops.limits.CapacityLimitsLoader;
import org.javai.bulkops.state.BulkItemError;
import org.javai.bulkops.state.BulkOperationState;
import org.javai.bulkops.state.BulkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a bulk operation through its lifecycle, one confirmation step at a time.
 *
 * <p>Every operation is a single synchronous call tied to one conversational turn:</p>
 * <ul>
 *   <li>{@link #start} prepares and counts, but processes nothing</li>
 *   <li>{@link #continueOperation} processes exactly one batch</li>
 *   <li>{@link #cancel} stops the operation without touching any item</li>
 * </ul>
 *
 * <p>The controller never loops across batches and keeps nothing between calls: the
 * state goes in as a value and the updated state comes out as a new value. Input
 * states are never modified, and when a call fails the caller's state is still the
 * state to retry with.</p>
 *
 * <pre>{@code
 * BulkOperationController controller = new BulkOperationController(CapacityLimiter.withDefaults(), clock);
 * BulkOperationResult started = controller.start(adapter, params, 10);
 * store.save(actorId, started.state());
 *
 * // next turn, after the user confirms
 * BulkOperationResult next = controller.continueOperation(store.load(actorId).orElseThrow(), adapter);
 * }</pre>
 */
public class BulkOperationController {

	private static final Logger logger = LoggerFactory.getLogger(BulkOperationController.class);

	private final CapacityLimiter limiter;
	private final Clock clock;
	private final Supplier<String> operationIds;

	/**
	 * Creates a controller whose limits come from the bundled
	 * {@value CapacityLimitsLoader#DEFAULT_RESOURCE}.
	 */
	public BulkOperationController() {
		this(new CapacityLimiter(new CapacityLimitsLoader().loadDefault()), Clock.systemUTC());
	}

	public BulkOperationController(CapacityLimiter limiter, Clock clock) {
		this(limiter, clock, () -> UUID.randomUUID().toString());
	}

	public BulkOperationController(CapacityLimiter limiter, Clock clock, Supplier<String> operationIds) {
		this.limiter = Objects.requireNonNull(limiter, "limiter must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.operationIds = Objects.requireNonNull(operationIds, "operationIds must not be null");
	}

	public CapacityLimits limits() {
		return limiter.limits();
	}

	/**
	 * Prepares a new operation and counts its items without processing any.
	 *
	 * @param adapter the adapter for the target domain
	 * @param rawParams user parameters passed to {@link BulkToolAdapter#prepare}
	 * @param requestedBatchSize desired batch size, clamped to the capacity limits
	 * @return a new {@link BulkStatus#ACTIVE} state with nothing processed
	 * @throws BulkValidationException if parameters are invalid or nothing matches
	 * @throws org.javai.bulkops.limits.TooManyItemsException if too many items match
	 * @throws BulkCountException if counting fails
	 */
	public BulkOperationResult start(BulkToolAdapter adapter, Map<String, Object> rawParams, int requestedBatchSize) {
		Objects.requireNonNull(adapter, "adapter must not be null");

		PreparedBulkContext context = adapter.prepare(rawParams != null ? rawParams : Map.of());
		if (context == null) {
			throw new IllegalStateException(adapter.getClass().getSimpleName() + " returned no prepared context");
		}
		if (!adapter.domain().equals(context.domain())) {
			throw new IllegalStateException("Adapter for domain '" + adapter.domain()
					+ "' prepared a context for domain '" + context.domain() + "'");
		}

		int total = count(adapter, context);
		limiter.validateTotal(total);
		if (total == 0) {
			throw new BulkValidationException("No items found matching the request");
		}
		int batchSize = limiter.clampBatchSize(requestedBatchSize);

		BulkOperationState state = BulkOperationState.started(
				operationIds.get(), context, total, batchSize, clock.instant());
		logger.info("Started bulk {} on {} [{}]: {} item(s) in batches of {}",
				state.action(), state.domain(), state.operationId(), total, batchSize);
		return new BulkOperationResult(state, BulkSummary.of(state));
	}

	/**
	 * Processes exactly one batch of an active operation.
	 *
	 * <p>The batch is fetched at offset {@link BulkOperationState#cursor()} and is never
	 * larger than the batch size or the number of remaining items. Item failures are
	 * recorded in the returned state. The operation completes when a fetch returns
	 * nothing or every counted item has been processed.</p>
	 *
	 * @param state the current, active state
	 * @param adapter the adapter for the state's domain
	 * @return the advanced state
	 * @throws InvalidBulkStateException if the state is not active or the adapter serves
	 *         another domain
	 * @throws BulkFetchException if fetching fails; the input state remains current
	 * @throws BulkExecutionException if the batch failed as a whole; the input state
	 *         remains current
	 */
	public BulkOperationResult continueOperation(BulkOperationState state, BulkToolAdapter adapter) {
		requireActive(state, "continue");
		Objects.requireNonNull(adapter, "adapter must not be null");
		if (!state.domain().equals(adapter.domain())) {
			throw new InvalidBulkStateException("Bulk operation " + state.operationId() + " belongs to domain '"
					+ state.domain() + "' but was continued with the '" + adapter.domain() + "' adapter");
		}

		if (state.remaining() == 0) {
			return complete(state, 0, List.of());
		}

		List<BulkItem> fetched = fetch(adapter, state);
		if (fetched.isEmpty()) {
			logger.info("Bulk {} on {} [{}] found no further items at offset {}",
					state.action(), state.domain(), state.operationId(), state.cursor());
			return complete(state, 0, List.of());
		}

		int limit = Math.min(state.batchSize(), state.remaining());
		List<BulkItem> batch = fetched.size() > limit ? List.copyOf(fetched.subList(0, limit)) : fetched;

		List<BulkResult> results = execute(adapter, state, batch);
		List<BulkItemError> batchErrors = new ArrayList<>();
		for (BulkResult result : results) {
			if (!result.success()) {
				batchErrors.add(new BulkItemError(result.itemId(), result.error()));
			}
		}

		boolean done = state.processed() + batch.size() >= state.totalItems();
		BulkOperationState next = state.advancedBy(batch.size(), batchErrors,
				done ? BulkStatus.COMPLETED : BulkStatus.ACTIVE);
		logger.info("Bulk {} on {} [{}] processed {} item(s) ({}/{}), {} failed",
				next.action(), next.domain(), next.operationId(), batch.size(),
				next.processed(), next.totalItems(), batchErrors.size());
		if (done) {
			logCompletion(next);
		}
		return new BulkOperationResult(next, BulkSummary.of(next, batch.size(), batchErrors));
	}

	/**
	 * Stops an active operation. Nothing is rolled back and no adapter is called.
	 *
	 * @param state the current, active state
	 * @return the cancelled state, progress frozen
	 * @throws InvalidBulkStateException if the state is not active
	 */
	public BulkOperationResult cancel(BulkOperationState state) {
		requireActive(state, "cancel");
		BulkOperationState cancelled = state.withStatus(BulkStatus.CANCELLED);
		logger.info("Cancelled bulk {} on {} [{}] after {}/{} item(s)",
				cancelled.action(), cancelled.domain(), cancelled.operationId(),
				cancelled.processed(), cancelled.totalItems());
		return new BulkOperationResult(cancelled, BulkSummary.of(cancelled));
	}

	private BulkOperationResult complete(BulkOperationState state, int processedThisBatch,
			List<BulkItemError> batchErrors) {
		BulkOperationState completed = state.withStatus(BulkStatus.COMPLETED);
		logCompletion(completed);
		return new BulkOperationResult(completed, BulkSummary.of(completed, processedThisBatch, batchErrors));
	}

	private void logCompletion(BulkOperationState state) {
		logger.info("Completed bulk {} on {} [{}]: {}/{} item(s) processed, {} error(s)",
				state.action(), state.domain(), state.operationId(),
				state.processed(), state.totalItems(), state.errors().size());
	}

	private static void requireActive(BulkOperationState state, String operation) {
		Objects.requireNonNull(state, "state must not be null");
		if (!state.isActive()) {
			throw new InvalidBulkStateException("Cannot " + operation + " bulk operation "
					+ state.operationId() + ": status is " + state.status());
		}
	}

	private static int count(BulkToolAdapter adapter, PreparedBulkContext context) {
		int total;
		try {
			total = adapter.getTotalCount(context);
		} catch (BulkCountException e) {
			logger.warn("Counting items for bulk {} on {} failed: {}", context.action(), context.domain(), e.getMessage());
			throw new BulkCountException("Failed to count items for bulk " + context.action() + " on "
					+ context.domain() + "; no operation was started: " + e.getMessage(), e);
		} catch (BulkOperationException e) {
			throw e;
		} catch (RuntimeException e) {
			logger.warn("Counting items for bulk {} on {} failed", context.action(), context.domain(), e);
			throw new BulkCountException("Failed to count items for bulk " + context.action() + " on "
					+ context.domain() + "; no operation was started: " + e.getMessage(), e);
		}
		if (total < 0) {
			throw new IllegalStateException(adapter.getClass().getSimpleName() + " reported a negative count: " + total);
		}
		return total;
	}

	private static List<BulkItem> fetch(BulkToolAdapter adapter, BulkOperationState state) {
		try {
			List<BulkItem> items = adapter.getNextBatch(state.context(), state.batchSize(), state.cursor());
			return items != null ? items : List.of();
		} catch (BulkFetchException e) {
			logger.warn("Fetching batch for {} at offset {} failed: {}", state.operationId(), state.cursor(), e.getMessage());
			throw new BulkFetchException(describe(state, "failed to fetch batch") + e.getMessage(), e);
		} catch (BulkOperationException e) {
			throw e;
		} catch (RuntimeException e) {
			logger.warn("Fetching batch for {} at offset {} failed", state.operationId(), state.cursor(), e);
			throw new BulkFetchException(describe(state, "failed to fetch batch") + e.getMessage(), e);
		}
	}

	private static List<BulkResult> execute(BulkToolAdapter adapter, BulkOperationState state, List<BulkItem> batch) {
		List<BulkResult> results;
		try {
			results = adapter.executeBatch(batch, state.context());
		} catch (BulkExecutionException e) {
			logger.warn("Batch for {} at offset {} failed as a whole: {}", state.operationId(), state.cursor(), e.getMessage());
			throw new BulkExecutionException(describe(state, "batch failed as a whole") + e.getMessage(), e,
					e.isRetryable());
		} catch (BulkOperationException e) {
			throw e;
		} catch (RuntimeException e) {
			logger.warn("Batch for {} at offset {} failed as a whole", state.operationId(), state.cursor(), e);
			throw new BulkExecutionException(describe(state, "batch failed as a whole") + e.getMessage(), e);
		}
		verifyResults(state, batch, results);
		return results;
	}

	private static void verifyResults(BulkOperationState state, List<BulkItem> batch, List<BulkResult> results) {
		if (results == null || results.size() != batch.size()) {
			throw new BulkExecutionException(describe(state, "adapter contract violated")
					+ "expected " + batch.size() + " result(s) but got " + (results == null ? 0 : results.size()),
					null, false);
		}
		for (int i = 0; i < batch.size(); i++) {
			if (!batch.get(i).id().equals(results.get(i).itemId())) {
				throw new BulkExecutionException(describe(state, "adapter contract violated")
						+ "result " + i + " is for item '" + results.get(i).itemId() + "' but item '"
						+ batch.get(i).id() + "' was submitted", null, false);
			}
		}
	}

	private static String describe(BulkOperationState state, String what) {
		return "Bulk " + state.action() + " on " + state.domain() + " [" + state.operationId() + "] "
				+ what + " at offset " + state.cursor() + "; state unchanged: ";
	}
}
