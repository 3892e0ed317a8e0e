package org.javai.bulkops.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.apache.logging.log4j.Level;
import org.javai.bulkops.testsupport.BulkStates;
import org.javai.bulkops.testsupport.LogCaptorAppender;
import org.javai.bulkops.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

class InMemoryBulkStateStoreTest {

	private final MutableClock clock = new MutableClock(BulkStates.CREATED_AT);
	private final InMemoryBulkStateStore store =
			new InMemoryBulkStateStore(new JsonBulkOperationStateSerializer(), Duration.ofMinutes(30), clock);

	@Test
	void savesLoadsAndDeletes() {
		BulkOperationState state = BulkStates.fresh(42, 10);

		assertThat(store.load("alice")).isEmpty();
		store.save("alice", state);

		assertThat(store.load("alice")).contains(state);
		assertThat(store.load("bob")).isEmpty();
		assertThat(store.encoded("alice")).hasValueSatisfying(s -> assertThat(s).contains("bulk-operation-state"));

		store.delete("alice");
		assertThat(store.load("alice")).isEmpty();
	}

	@Test
	void saveReplacesPreviousState() {
		store.save("alice", BulkStates.fresh(42, 10));
		BulkOperationState later = BulkStates.state(42, 10, 10, BulkStatus.ACTIVE);

		store.save("alice", later);

		assertThat(store.load("alice")).contains(later);
	}

	@Test
	void evictsAfterInactivity() {
		store.save("alice", BulkStates.fresh(42, 10));
		clock.advance(Duration.ofMinutes(29));
		assertThat(store.load("alice")).isPresent();

		try (LogCaptorAppender logs = LogCaptorAppender.capture(InMemoryBulkStateStore.class, Level.INFO)) {
			clock.advance(Duration.ofMinutes(1));

			assertThat(store.load("alice")).isEmpty();
			assertThat(store.encoded("alice")).isEmpty();
			assertThat(logs.messagesAt(Level.INFO)).anyMatch(m -> m.contains("actor alice"));
		}
	}

	@Test
	void writingResetsTheTimer() {
		store.save("alice", BulkStates.fresh(42, 10));
		clock.advance(Duration.ofMinutes(20));
		store.save("alice", BulkStates.state(42, 10, 10, BulkStatus.ACTIVE));
		clock.advance(Duration.ofMinutes(20));

		assertThat(store.load("alice")).isPresent();
	}

	@Test
	void requiresPositiveTtl() {
		assertThatThrownBy(() -> new InMemoryBulkStateStore(new JsonBulkOperationStateSerializer(), Duration.ZERO, clock))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
