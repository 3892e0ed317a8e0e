package org.javai.bulkops.state;

import java.util.Objects;

/**
 * A failed item recorded in the operation state.
 *
 * @param itemId the id of the item that failed
 * @param error the failure description reported by the adapter
 */
public record BulkItemError(String itemId, String error) {

	public BulkItemError {
		Objects.requireNonNull(itemId, "itemId must not be null");
		error = error != null ? error : "Unknown error";
	}
}
