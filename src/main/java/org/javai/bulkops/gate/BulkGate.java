package org.javai.bulkops.gate;

import java.util.Objects;
import java.util.Optional;
import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.adapter.BulkAdapterRegistry;
import org.javai.bulkops.adapter.BulkToolAdapter;
import org.javai.bulkops.controller.BulkOperationController;
import org.javai.bulkops.controller.BulkOperationResult;
import org.javai.bulkops.presenter.BulkStatusPresenter;
import org.javai.bulkops.state.BulkOperationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single per-turn decision point for bulk operations, consulted before any other
 * intent routing.
 *
 * <ol>
 *   <li>No active operation: {@link GateOutcome.NotHandled}.</li>
 *   <li>"continue": one batch is processed through the domain's adapter.</li>
 *   <li>"cancel": the operation is cancelled.</li>
 *   <li>Anything else: nothing happens and the user is reminded of the two valid
 *       answers. The gate never guesses.</li>
 * </ol>
 *
 * <p>Retryable failures during a continue are answered with an explanation and the
 * unchanged state, so the user can say "continue" again. Non-retryable failures,
 * including {@code InvalidBulkStateException} and {@code UnknownDomainException},
 * propagate; the stored state is still the last good one.</p>
 */
public class BulkGate {

	private static final Logger logger = LoggerFactory.getLogger(BulkGate.class);

	private final BulkOperationController controller;
	private final BulkAdapterRegistry adapters;
	private final BulkIntentClassifier classifier;
	private final BulkStatusPresenter presenter;

	public BulkGate(BulkOperationController controller, BulkAdapterRegistry adapters) {
		this(controller, adapters, new BulkIntentClassifier(), new BulkStatusPresenter());
	}

	public BulkGate(BulkOperationController controller, BulkAdapterRegistry adapters,
			BulkIntentClassifier classifier, BulkStatusPresenter presenter) {
		this.controller = Objects.requireNonNull(controller, "controller must not be null");
		this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.presenter = Objects.requireNonNull(presenter, "presenter must not be null");
	}

	/**
	 * Decides what this turn's message means for the actor's pending operation.
	 *
	 * @param userMessage the raw user message
	 * @param activeState the actor's stored state, if any
	 * @return the outcome; {@link GateOutcome.NotHandled} when nothing is pending
	 */
	public GateOutcome check(String userMessage, Optional<BulkOperationState> activeState) {
		if (activeState == null || activeState.isEmpty() || !activeState.get().isActive()) {
			return GateOutcome.notHandled();
		}
		BulkOperationState state = activeState.get();
		BulkIntent intent = classifier.classify(userMessage);
		logger.debug("Bulk operation {} pending; message classified as {}", state.operationId(), intent);

		return switch (intent) {
			case CONTINUE -> proceed(state);
			case CANCEL -> {
				BulkOperationResult result = controller.cancel(state);
				yield new GateOutcome.Handled(intent, presenter.present(result.state(), result.summary()),
						result.state(), true);
			}
			case UNRELATED -> new GateOutcome.Handled(intent, presenter.presentReminder(state), state, false);
		};
	}

	private GateOutcome proceed(BulkOperationState state) {
		BulkToolAdapter adapter = adapters.lookup(state.domain());
		try {
			BulkOperationResult result = controller.continueOperation(state, adapter);
			return new GateOutcome.Handled(BulkIntent.CONTINUE, presenter.present(result.state(), result.summary()),
					result.state(), result.isTerminal());
		} catch (BulkOperationException e) {
			if (!e.isRetryable()) {
				throw e;
			}
			logger.warn("Batch for bulk operation {} failed; awaiting retry: {}", state.operationId(), e.getMessage());
			return new GateOutcome.Handled(BulkIntent.CONTINUE, presenter.presentRetry(state, e), state, false);
		}
	}
}
