package org.javai.bulkops.testsupport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.bulkops.adapter.PreparedBulkContext;
import org.javai.bulkops.state.BulkItemError;
import org.javai.bulkops.state.BulkOperationState;
import org.javai.bulkops.state.BulkStatus;

/**
 * Ready-made states for tests.
 */
public final class BulkStates {

	public static final Instant CREATED_AT = Instant.parse("2024-03-01T10:15:30Z");

	private BulkStates() {
	}

	public static PreparedBulkContext mailContext() {
		Map<String, Object> query = new LinkedHashMap<>();
		query.put("query_type", "sender");
		query.put("sender", "billing@shop.example");
		query.put("search", "from:billing@shop.example");
		Map<String, Object> action = new LinkedHashMap<>();
		action.put("label_id", "Label_1");
		action.put("label_name", "Receipts");
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("requestedBy", "assistant");
		metadata.put("attempt", 2);
		metadata.put("dryRun", false);
		metadata.put("tags", List.of("finance", "2024"));
		metadata.put("note", null);
		return new PreparedBulkContext("mail", "move_to_label", query, action, metadata);
	}

	public static BulkOperationState fresh(int total, int batchSize) {
		return BulkOperationState.started("op-1", mailContext(), total, batchSize, CREATED_AT);
	}

	public static BulkOperationState state(int total, int batchSize, int processed, BulkStatus status,
			BulkItemError... errors) {
		return new BulkOperationState("op-1", "mail", "move_to_label", mailContext(), total, batchSize,
				processed, processed, List.of(errors), CREATED_AT, status);
	}
}
