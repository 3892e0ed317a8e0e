package org.javai.bulkops.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One item fetched for processing. Items live for a single batch and are never
 * persisted between turns.
 *
 * @param id identifier, unique within the operation
 * @param displayName human-readable name for logs and summaries
 * @param rawData optional full item data, may be {@code null}
 */
public record BulkItem(String id, String displayName, Map<String, Object> rawData) {

	public BulkItem {
		Objects.requireNonNull(id, "id must not be null");
		displayName = displayName != null ? displayName : id;
		rawData = rawData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(rawData)) : null;
	}

	public BulkItem(String id, String displayName) {
		this(id, displayName, null);
	}

	public static BulkItem of(String id) {
		return new BulkItem(id, id, null);
	}
}
