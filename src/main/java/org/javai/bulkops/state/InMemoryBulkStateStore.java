package org.javai.bulkops.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory key-value store for bulk operation state, intended for tests and local use.
 *
 * <p>States are held in their encoded form, exactly as an external store would hold
 * them, and entries not written for longer than the time-to-live are evicted when
 * next read.</p>
 */
public class InMemoryBulkStateStore implements BulkStateStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryBulkStateStore.class);

	/** Inactivity timeout applied when none is given. */
	public static final Duration DEFAULT_TTL = Duration.ofHours(1);

	private final Map<String, Entry> store = new ConcurrentHashMap<>();
	private final BulkOperationStateSerializer serializer;
	private final Duration ttl;
	private final Clock clock;

	public InMemoryBulkStateStore() {
		this(new JsonBulkOperationStateSerializer(), DEFAULT_TTL, Clock.systemUTC());
	}

	public InMemoryBulkStateStore(BulkOperationStateSerializer serializer, Duration ttl, Clock clock) {
		this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
		this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		if (ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
	}

	@Override
	public Optional<BulkOperationState> load(String actorId) {
		Entry entry = store.get(actorId);
		if (entry == null) {
			return Optional.empty();
		}
		if (!clock.instant().isBefore(entry.writtenAt().plus(ttl))) {
			store.remove(actorId, entry);
			logger.info("Evicted inactive bulk operation state for actor {}", actorId);
			return Optional.empty();
		}
		return Optional.of(serializer.decode(entry.encoded()));
	}

	@Override
	public void save(String actorId, BulkOperationState state) {
		Objects.requireNonNull(state, "state must not be null");
		store.put(actorId, new Entry(serializer.encode(state), clock.instant()));
	}

	@Override
	public void delete(String actorId) {
		store.remove(actorId);
	}

	/**
	 * The raw encoded value held for an actor, for inspection.
	 */
	public Optional<String> encoded(String actorId) {
		Entry entry = store.get(actorId);
		return entry != null ? Optional.of(entry.encoded()) : Optional.empty();
	}

	private record Entry(String encoded, Instant writtenAt) {
	}
}
