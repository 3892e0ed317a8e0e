package org.javai.bulkops.conversation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.bulkops.adapter.BulkAdapterRegistry;
import org.javai.bulkops.adapter.BulkToolAdapter;
import org.javai.bulkops.controller.BulkOperationController;
import org.javai.bulkops.controller.BulkOperationResult;
import org.javai.bulkops.gate.BulkGate;
import org.javai.bulkops.gate.BulkIntentClassifier;
import org.javai.bulkops.gate.GateOutcome;
import org.javai.bulkops.presenter.BulkStatusPresenter;
import org.javai.bulkops.state.BulkOperationState;
import org.javai.bulkops.state.BulkOperationStateSerializer;
import org.javai.bulkops.state.BulkStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front-end facing entry point for bulk operations across conversation turns.
 *
 * <h2>Two Usage Modes</h2>
 *
 * <h3>1. Store-Based</h3>
 * <p>State is kept per actor in a {@link BulkStateStore}:</p>
 * <pre>{@code
 * BulkConversationManager manager = new BulkConversationManager(controller, adapters, store);
 * manager.start(actorId, "mail", params, 10);
 * BulkTurnResult result = manager.handleTurn(actorId, userMessage);
 * }</pre>
 *
 * <h3>2. Blob-Based</h3>
 * <p>The application keeps the encoded state itself and passes it back each turn:</p>
 * <pre>{@code
 * BulkConversationManager manager = new BulkConversationManager(controller, adapters, serializer);
 * BulkTurnResult result = manager.handleBlobTurn(userMessage, priorEncodedState);
 * session.put("bulk", result.encodedState());  // null once the operation ends
 * }</pre>
 *
 * <p>Either way the bulk check runs before any other intent routing; a result with
 * {@code handled == false} means the message is the caller's to route.</p>
 */
public class BulkConversationManager {

	private static final Logger logger = LoggerFactory.getLogger(BulkConversationManager.class);

	private final BulkOperationController controller;
	private final BulkAdapterRegistry adapters;
	private final BulkGate gate;
	private final BulkStatusPresenter presenter;
	private final BulkStateStore stateStore;
	private final BulkOperationStateSerializer serializer;

	/**
	 * Creates a manager with store-based persistence.
	 */
	public BulkConversationManager(BulkOperationController controller, BulkAdapterRegistry adapters,
			BulkStateStore stateStore) {
		this(controller, adapters, new BulkStatusPresenter(),
				Objects.requireNonNull(stateStore, "stateStore must not be null"), null);
	}

	/**
	 * Creates a manager with blob-based persistence.
	 */
	public BulkConversationManager(BulkOperationController controller, BulkAdapterRegistry adapters,
			BulkOperationStateSerializer serializer) {
		this(controller, adapters, new BulkStatusPresenter(), null,
				Objects.requireNonNull(serializer, "serializer must not be null"));
	}

	private BulkConversationManager(BulkOperationController controller, BulkAdapterRegistry adapters,
			BulkStatusPresenter presenter, BulkStateStore stateStore, BulkOperationStateSerializer serializer) {
		this.controller = Objects.requireNonNull(controller, "controller must not be null");
		this.adapters = Objects.requireNonNull(adapters, "adapters must not be null");
		this.presenter = presenter;
		this.gate = new BulkGate(controller, adapters, new BulkIntentClassifier(), presenter);
		this.stateStore = stateStore;
		this.serializer = serializer;
	}

	/**
	 * Starts a bulk operation for an actor (store-based mode).
	 *
	 * @throws SessionAlreadyActiveException if the actor already has an active operation
	 * @throws IllegalStateException if not in store-based mode
	 */
	public BulkTurnResult start(String actorId, String domain, Map<String, Object> rawParams, int requestedBatchSize) {
		requireStore("start(actorId, ...)");
		Optional<BulkOperationState> existing = stateStore.load(actorId);
		rejectIfActive(existing);

		BulkOperationResult result = begin(domain, rawParams, requestedBatchSize);
		stateStore.save(actorId, result.state());
		logger.info("Actor {} started bulk operation {}", actorId, result.state().operationId());
		return new BulkTurnResult(true, presenter.present(result.state(), result.summary()), result.state(), null, false);
	}

	/**
	 * Handles one user message for an actor (store-based mode). The stored state is
	 * replaced when the turn changed it, or deleted once the operation has ended.
	 * Turns that leave the state as it was do not write, so the store's inactivity
	 * window keeps running from the last change.
	 *
	 * @throws IllegalStateException if not in store-based mode
	 */
	public BulkTurnResult handleTurn(String actorId, String userMessage) {
		requireStore("handleTurn(actorId, ...)");
		Optional<BulkOperationState> prior = stateStore.load(actorId);
		GateOutcome outcome = gate.check(userMessage, prior);
		if (!(outcome instanceof GateOutcome.Handled handled)) {
			return BulkTurnResult.notHandled(prior.orElse(null), null);
		}
		if (handled.clearState()) {
			stateStore.delete(actorId);
			logger.info("Cleared bulk operation {} for actor {} ({})", handled.state().operationId(), actorId,
					handled.state().status());
		} else if (!prior.map(handled.state()::equals).orElse(false)) {
			stateStore.save(actorId, handled.state());
		}
		return new BulkTurnResult(true, handled.response(), handled.state(), null, handled.clearState());
	}

	/**
	 * Returns the actor's active operation, if any (store-based mode).
	 */
	public Optional<BulkOperationState> activeState(String actorId) {
		requireStore("activeState");
		return stateStore.load(actorId).filter(BulkOperationState::isActive);
	}

	/**
	 * Starts a bulk operation with blob-based state.
	 *
	 * @param priorEncodedState the caller's current encoded state, or null if none
	 * @return the result, whose {@code encodedState} the caller must keep
	 * @throws SessionAlreadyActiveException if the prior state is an active operation
	 * @throws IllegalStateException if not in blob-based mode
	 */
	public BulkTurnResult startWithBlob(String priorEncodedState, String domain, Map<String, Object> rawParams,
			int requestedBatchSize) {
		requireSerializer("startWithBlob");
		rejectIfActive(decode(priorEncodedState));

		BulkOperationResult result = begin(domain, rawParams, requestedBatchSize);
		return new BulkTurnResult(true, presenter.present(result.state(), result.summary()), result.state(),
				serializer.encode(result.state()), false);
	}

	/**
	 * Handles one user message with blob-based state.
	 *
	 * @param userMessage the user's message for this turn
	 * @param priorEncodedState the encoded state from the previous turn (null if none)
	 * @return the result; when not handled the prior blob is passed back untouched
	 * @throws IllegalStateException if not in blob-based mode
	 */
	public BulkTurnResult handleBlobTurn(String userMessage, String priorEncodedState) {
		requireSerializer("handleBlobTurn");
		Optional<BulkOperationState> prior = decode(priorEncodedState);
		GateOutcome outcome = gate.check(userMessage, prior);
		if (!(outcome instanceof GateOutcome.Handled handled)) {
			return BulkTurnResult.notHandled(prior.orElse(null), priorEncodedState);
		}
		String encoded = handled.clearState() ? null : serializer.encode(handled.state());
		return new BulkTurnResult(true, handled.response(), handled.state(), encoded, handled.clearState());
	}

	/**
	 * Renders an encoded state as readable JSON, for debugging (blob-based mode).
	 */
	public String toReadableJson(String encodedState) {
		requireSerializer("toReadableJson");
		if (encodedState == null || encodedState.isBlank()) {
			return "{}";
		}
		return serializer.toReadableJson(encodedState);
	}

	private BulkOperationResult begin(String domain, Map<String, Object> rawParams, int requestedBatchSize) {
		BulkToolAdapter adapter = adapters.lookup(domain);
		return controller.start(adapter, rawParams, requestedBatchSize);
	}

	private Optional<BulkOperationState> decode(String encodedState) {
		if (encodedState == null || encodedState.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(serializer.decode(encodedState));
	}

	private static void rejectIfActive(Optional<BulkOperationState> existing) {
		if (existing.isPresent() && existing.get().isActive()) {
			throw new SessionAlreadyActiveException(existing.get());
		}
	}

	private void requireStore(String operation) {
		if (stateStore == null) {
			throw new IllegalStateException(operation + " requires a BulkStateStore. "
					+ "Use startWithBlob/handleBlobTurn for blob-based mode.");
		}
	}

	private void requireSerializer(String operation) {
		if (serializer == null) {
			throw new IllegalStateException(operation + " requires a BulkOperationStateSerializer. "
					+ "Use start/handleTurn for store-based mode.");
		}
	}
}
