package org.javai.bulkops.adapter;

import java.util.Objects;

/**
 * Outcome of applying the action to one item.
 *
 * @param itemId the id of the processed item
 * @param success whether the action succeeded
 * @param error failure description, {@code null} on success
 */
public record BulkResult(String itemId, boolean success, String error) {

	public BulkResult {
		Objects.requireNonNull(itemId, "itemId must not be null");
		if (success) {
			error = null;
		} else if (error == null || error.isBlank()) {
			error = "Unknown error";
		}
	}

	public static BulkResult succeeded(String itemId) {
		return new BulkResult(itemId, true, null);
	}

	public static BulkResult failed(String itemId, String error) {
		return new BulkResult(itemId, false, error);
	}
}
