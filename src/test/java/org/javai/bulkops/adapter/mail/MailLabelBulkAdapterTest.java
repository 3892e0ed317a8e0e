package org.javai.bulkops.adapter.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.adapter.BulkCountException;
import org.javai.bulkops.adapter.BulkExecutionException;
import org.javai.bulkops.adapter.BulkFetchException;
import org.javai.bulkops.adapter.BulkItem;
import org.javai.bulkops.adapter.BulkResult;
import org.javai.bulkops.adapter.BulkValidationException;
import org.javai.bulkops.adapter.PreparedBulkContext;
import org.javai.bulkops.controller.BulkOperationController;
import org.javai.bulkops.controller.BulkOperationResult;
import org.javai.bulkops.state.BulkStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

@DisplayName("Mail labelling adapter")
class MailLabelBulkAdapterTest {

	private InMemoryMailboxService mailbox;
	private MailLabelBulkAdapter adapter;

	@BeforeEach
	void setUp() {
		mailbox = new InMemoryMailboxService();
		mailbox.createLabel("Receipts");
		for (int i = 1; i <= 7; i++) {
			mailbox.deliver("m" + i, "billing@shop.example", "Your receipt #" + i, "Thanks for shopping",
					LocalDate.of(2024, 1, i));
		}
		mailbox.deliver("x1", "friend@example.com", "Lunch?", "Are you free for lunch", LocalDate.of(2024, 2, 1));
		adapter = new MailLabelBulkAdapter(mailbox);
	}

	private static Map<String, Object> params(Object... keyValues) {
		Map<String, Object> params = new LinkedHashMap<>();
		for (int i = 0; i < keyValues.length; i += 2) {
			params.put((String) keyValues[i], keyValues[i + 1]);
		}
		return params;
	}

	@Nested
	@DisplayName("prepare")
	class Prepare {

		@Test
		@DisplayName("resolves the label and records the query")
		void preparesLabelAction() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "label", "query_type", "sender", "query_value", "billing@shop.example",
					"label_name", "receipts"));

			assertThat(context.domain()).isEqualTo("mail");
			assertThat(context.action()).isEqualTo("label");
			assertThat(context.queryParam("query_type")).isEqualTo("sender");
			assertThat(context.queryParam("sender")).isEqualTo("billing@shop.example");
			assertThat(context.queryParam("search")).isEqualTo("from:billing@shop.example");
			assertThat(context.actionParam("label_id")).isEqualTo("Label_1");
			assertThat(context.actionParam("label_name")).isEqualTo("receipts");
		}

		@Test
		@DisplayName("archive needs no label")
		void archiveNeedsNoLabel() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "subject", "query_value", "receipt"));

			assertThat(context.actionParams()).isEmpty();
			assertThat(context.queryParam("search")).isEqualTo("subject:receipt");
		}

		@Test
		@DisplayName("date ranges need at least one bound")
		void dateRange() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "date_range", "after", "2024/01/03"));

			assertThat(context.queryParam("search")).isEqualTo("after:2024/01/03");
			assertThatThrownBy(() -> adapter.prepare(params("action", "archive", "query_type", "date_range")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessageContaining("after");
		}

		@Test
		@DisplayName("rejects invalid parameters")
		void rejectsInvalidParameters() {
			assertThatThrownBy(() -> adapter.prepare(params("action", "delete", "query_type", "sender",
					"query_value", "x")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessageContaining("label, archive, move_to_label");
			assertThatThrownBy(() -> adapter.prepare(params("action", "archive", "query_type", "mood",
					"query_value", "x")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessageContaining("query_type");
			assertThatThrownBy(() -> adapter.prepare(params("action", "archive", "query_type", "sender")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessageContaining("query_value");
			assertThatThrownBy(() -> adapter.prepare(params("action", "move_to_label", "query_type", "sender",
					"query_value", "x")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessageContaining("label_name");
		}

		@Test
		@DisplayName("rejects unknown labels")
		void rejectsUnknownLabel() {
			assertThatThrownBy(() -> adapter.prepare(params("action", "label", "query_type", "sender",
					"query_value", "x", "label_name", "Travel")))
					.isInstanceOf(BulkValidationException.class)
					.hasMessage("Label 'Travel' not found");
		}
	}

	@Nested
	@DisplayName("count and fetch")
	class CountAndFetch {

		@Test
		@DisplayName("counts and pages through matching messages")
		void countsAndPages() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));

			assertThat(adapter.getTotalCount(context)).isEqualTo(7);
			assertThat(adapter.getNextBatch(context, 5, 0)).extracting(BulkItem::id)
					.containsExactly("m1", "m2", "m3", "m4", "m5");
			assertThat(adapter.getNextBatch(context, 5, 5)).extracting(BulkItem::id)
					.containsExactly("m6", "m7");
			assertThat(adapter.getNextBatch(context, 5, 7)).isEmpty();
		}

		@Test
		@DisplayName("keyword matches subject or body")
		void keywordQuery() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "keyword", "query_value", "lunch"));

			assertThat(adapter.getTotalCount(context)).isEqualTo(1);
		}

		@Test
		@DisplayName("transport failures become count and fetch exceptions")
		void transportFailures() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));

			mailbox.failNextCount(503, "backend unavailable");
			assertThatThrownBy(() -> adapter.getTotalCount(context))
					.isInstanceOfSatisfying(BulkCountException.class, e -> assertThat(e.isRetryable()).isTrue())
					.hasMessageContaining("backend unavailable");

			mailbox.failNextList(503, "backend unavailable");
			assertThatThrownBy(() -> adapter.getNextBatch(context, 5, 0))
					.isInstanceOf(BulkFetchException.class)
					.hasMessageContaining("offset 0");
		}
	}

	@Nested
	@DisplayName("selections emptied by their own action")
	class DrainingSelections {

		private final BulkOperationController controller = new BulkOperationController();

		@BeforeEach
		void fillInbox() {
			for (int i = 1; i <= 4; i++) {
				mailbox.deliver("n" + i, "news@list.example", "Issue " + i, "Weekly news", LocalDate.of(2024, 3, i));
			}
		}

		private long inboxSize() {
			return adapter.getTotalCount(adapter.prepare(params(
					"action", "label", "query_type", "label", "query_value", "INBOX", "label_name", "Receipts")));
		}

		@Test
		@DisplayName("archiving the inbox reaches every message")
		void archivesWholeInbox() {
			BulkOperationResult result = controller.start(adapter,
					params("action", "archive", "query_type", "label", "query_value", "INBOX"), 5);
			assertThat(result.state().totalItems()).isEqualTo(12);

			while (!result.isTerminal()) {
				result = controller.continueOperation(result.state(), adapter);
			}

			assertThat(result.state().status()).isEqualTo(BulkStatus.COMPLETED);
			assertThat(result.state().processed()).isEqualTo(12);
			assertThat(result.state().errors()).isEmpty();
			assertThat(mailbox.modifyCalls()).isEqualTo(3);
			assertThat(inboxSize()).isZero();
		}

		@Test
		@DisplayName("moving out of the inbox reads from the start of the selection")
		void moveOutOfInboxIgnoresOffset() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "move_to_label", "query_type", "label", "query_value", "inbox",
					"label_name", "Receipts"));

			adapter.executeBatch(adapter.getNextBatch(context, 5, 0), context);

			assertThat(adapter.getNextBatch(context, 5, 5)).extracting(BulkItem::id)
					.containsExactly("m6", "m7", "x1", "n1", "n2");
		}

		@Test
		@DisplayName("messages that failed are attempted again")
		void failedMessagesRetried() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "label", "query_value", "INBOX"));
			List<BulkItem> first = adapter.getNextBatch(context, 3, 0);
			mailbox.failNextModify(500, "internal error");
			adapter.executeBatch(first, context);

			assertThat(adapter.getNextBatch(context, 3, 3)).isEqualTo(first);
		}

		@Test
		@DisplayName("labelling the inbox pages by offset")
		void labellingInboxPagesByOffset() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "label", "query_type", "label", "query_value", "INBOX", "label_name", "Receipts"));

			adapter.executeBatch(adapter.getNextBatch(context, 5, 0), context);

			assertThat(adapter.getNextBatch(context, 5, 5)).extracting(BulkItem::id)
					.containsExactly("m6", "m7", "x1", "n1", "n2");
		}
	}

	@Nested
	@DisplayName("executeBatch")
	class Execute {

		@Test
		@DisplayName("moves a batch with a single mailbox call")
		void moveToLabel() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "move_to_label", "query_type", "sender", "query_value", "billing",
					"label_name", "Receipts"));
			List<BulkItem> batch = adapter.getNextBatch(context, 5, 0);

			List<BulkResult> results = adapter.executeBatch(batch, context);

			assertThat(results).extracting(BulkResult::itemId).containsExactly("m1", "m2", "m3", "m4", "m5");
			assertThat(results).allMatch(BulkResult::success);
			assertThat(mailbox.modifyCalls()).isEqualTo(1);
			assertThat(mailbox.message("m1").orElseThrow().labelIds()).containsExactly("Label_1");
			assertThat(mailbox.message("m6").orElseThrow().labelIds()).containsExactly("INBOX");
		}

		@Test
		@DisplayName("archive removes the inbox label only")
		void archive() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "friend"));

			adapter.executeBatch(adapter.getNextBatch(context, 5, 0), context);

			assertThat(mailbox.message("x1").orElseThrow().labelIds()).isEmpty();
		}

		@Test
		@DisplayName("a mailbox failure fails every item in the batch")
		void failureFailsWholeBatch() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));
			List<BulkItem> batch = adapter.getNextBatch(context, 3, 0);
			mailbox.failNextModify(500, "internal error");

			List<BulkResult> results = adapter.executeBatch(batch, context);

			assertThat(results).hasSize(3)
					.allSatisfy(r -> {
						assertThat(r.success()).isFalse();
						assertThat(r.error()).isEqualTo("internal error");
					});
		}

		@Test
		@DisplayName("missing messages fail the batch without aborting it")
		void missingMessage() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));
			List<BulkItem> batch = adapter.getNextBatch(context, 3, 0);
			mailbox.remove("m2");

			List<BulkResult> results = adapter.executeBatch(batch, context);

			assertThat(results).extracting(BulkResult::itemId).containsExactly("m1", "m2", "m3");
			assertThat(results).noneMatch(BulkResult::success);
		}

		@Test
		@DisplayName("authorization failures abort the batch")
		void authorizationFailure() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));
			List<BulkItem> batch = adapter.getNextBatch(context, 3, 0);
			mailbox.failNextModify(401, "token expired");

			assertThatThrownBy(() -> adapter.executeBatch(batch, context))
					.isInstanceOfSatisfying(BulkExecutionException.class, e -> assertThat(e.isRetryable()).isFalse())
					.hasMessageContaining("401");
		}

		@Test
		@DisplayName("an empty batch makes no mailbox call")
		void emptyBatch() {
			PreparedBulkContext context = adapter.prepare(params(
					"action", "archive", "query_type", "sender", "query_value", "billing"));

			assertThat(adapter.executeBatch(List.of(), context)).isEmpty();
			assertThat(mailbox.modifyCalls()).isZero();
		}

		@Test
		@DisplayName("a context without a label id fails every item")
		void missingLabelId() {
			PreparedBulkContext context = new PreparedBulkContext("mail", "label",
					Map.of("query_type", "sender", "sender", "billing"), Map.of());

			List<BulkResult> results = adapter.executeBatch(List.of(BulkItem.of("m1"), BulkItem.of("m2")), context);

			assertThat(results).extracting(BulkResult::error)
					.containsOnly("Missing label_id for action 'label'");
		}
	}

	@Nested
	@DisplayName("with a failing mailbox")
	class MockedMailbox {

		@Mock
		private MailboxService service;

		@BeforeEach
		void openMocks() {
			MockitoAnnotations.openMocks(this);
		}

		@Test
		@DisplayName("label lookup failures are retryable")
		void labelLookupFailure() throws Exception {
			when(service.resolveLabelId(anyString())).thenThrow(new MailboxException(503, "unavailable"));
			MailLabelBulkAdapter failing = new MailLabelBulkAdapter(service);

			assertThatThrownBy(() -> failing.prepare(params("action", "label", "query_type", "sender",
					"query_value", "x", "label_name", "Receipts")))
					.isInstanceOfSatisfying(BulkOperationException.class, e -> assertThat(e.isRetryable()).isTrue())
					.hasMessageContaining("Receipts");
		}
	}
}
