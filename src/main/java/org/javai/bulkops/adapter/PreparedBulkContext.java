package org.javai.bulkops.adapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an adapter needs to fetch and act on items, derived once from the
 * user's parameters by {@link BulkToolAdapter#prepare(Map)}.
 *
 * <p>The context never holds live item data and can always be rebuilt from the
 * original parameters. Its maps are opaque to the engine: they are persisted
 * verbatim between turns, so values must be JSON-compatible (strings, numbers,
 * booleans, lists, maps or {@code null}).</p>
 *
 * <p>Values are normalized on construction to the types they decode to: integral
 * numbers become {@code Integer} when they fit and {@code Long} otherwise, other
 * numbers become {@code Double}, collections become lists and map keys become strings.
 * Any other value type is rejected.</p>
 *
 * @param domain the adapter domain tag (e.g. {@code "mail"})
 * @param action the action to apply to every item (e.g. {@code "label"})
 * @param queryParams adapter-specific parameters selecting the items
 * @param actionParams adapter-specific parameters for executing the action
 * @param metadata optional additional context
 */
public record PreparedBulkContext(
		String domain,
		String action,
		Map<String, Object> queryParams,
		Map<String, Object> actionParams,
		Map<String, Object> metadata
) {

	public PreparedBulkContext {
		Objects.requireNonNull(domain, "domain must not be null");
		Objects.requireNonNull(action, "action must not be null");
		queryParams = copy(queryParams);
		actionParams = copy(actionParams);
		metadata = copy(metadata);
	}

	public PreparedBulkContext(String domain, String action,
			Map<String, Object> queryParams, Map<String, Object> actionParams) {
		this(domain, action, queryParams, actionParams, Map.of());
	}

	/**
	 * Reads a query parameter as a string.
	 *
	 * @return the value, or {@code null} when absent
	 */
	public String queryParam(String name) {
		Object value = queryParams.get(name);
		return value != null ? value.toString() : null;
	}

	/**
	 * Reads an action parameter as a string.
	 *
	 * @return the value, or {@code null} when absent
	 */
	public String actionParam(String name) {
		Object value = actionParams.get(name);
		return value != null ? value.toString() : null;
	}

	// Map.copyOf rejects null values, which JSON payloads may legitimately contain
	private static Map<String, Object> copy(Map<String, Object> source) {
		if (source == null || source.isEmpty()) {
			return Map.of();
		}
		return normalizeMap(source);
	}

	private static Map<String, Object> normalizeMap(Map<?, ?> source) {
		Map<String, Object> copy = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : source.entrySet()) {
			copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
		}
		return Collections.unmodifiableMap(copy);
	}

	private static Object normalize(Object value) {
		if (value == null || value instanceof String || value instanceof Boolean) {
			return value;
		}
		if (value instanceof Number number) {
			return normalizeNumber(number);
		}
		if (value instanceof Map<?, ?> map) {
			return normalizeMap(map);
		}
		if (value instanceof Collection<?> collection) {
			List<Object> list = new ArrayList<>(collection.size());
			for (Object element : collection) {
				list.add(normalize(element));
			}
			return Collections.unmodifiableList(list);
		}
		throw new IllegalArgumentException("Unsupported context value of type " + value.getClass().getName()
				+ "; values must be strings, numbers, booleans, lists, maps or null");
	}

	private static Object normalizeNumber(Number number) {
		if (number instanceof Integer || number instanceof Long || number instanceof Short
				|| number instanceof Byte) {
			return narrow(number.longValue());
		}
		if (number instanceof BigInteger big) {
			if (big.bitLength() < Long.SIZE) {
				return narrow(big.longValue());
			}
			throw new IllegalArgumentException("Context value " + big + " does not fit in a long");
		}
		if (number instanceof BigDecimal || number instanceof Float || number instanceof Double) {
			return number.doubleValue();
		}
		throw new IllegalArgumentException("Unsupported numeric context value of type " + number.getClass().getName());
	}

	private static Object narrow(long value) {
		if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
			return (int) value;
		}
		return value;
	}
}
