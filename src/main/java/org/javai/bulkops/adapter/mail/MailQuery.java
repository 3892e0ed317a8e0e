package org.javai.bulkops.adapter.mail;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message selection, convertible to and from the opaque query parameters stored in
 * a {@link org.javai.bulkops.adapter.PreparedBulkContext}.
 *
 * @param type how messages are selected
 * @param value the sender, keyword, subject or label (unused for date ranges)
 * @param after inclusive lower date bound for date ranges, {@code yyyy/MM/dd}
 * @param before exclusive upper date bound for date ranges, {@code yyyy/MM/dd}
 */
public record MailQuery(MailQueryType type, String value, String after, String before) {

	static final String QUERY_TYPE = "query_type";
	static final String AFTER = "after";
	static final String BEFORE = "before";
	static final String SEARCH = "search";

	public MailQuery {
		Objects.requireNonNull(type, "type must not be null");
	}

	public static MailQuery of(MailQueryType type, String value) {
		return new MailQuery(type, value, null, null);
	}

	public static MailQuery dateRange(String after, String before) {
		return new MailQuery(MailQueryType.DATE_RANGE, null, after, before);
	}

	/**
	 * Renders the provider search string, e.g. {@code from:billing@example.com}.
	 */
	public String toSearchString() {
		return switch (type) {
			case SENDER -> "from:" + value;
			case KEYWORD -> value;
			case SUBJECT -> "subject:" + value;
			case LABEL -> "label:" + value;
			case DATE_RANGE -> {
				StringBuilder sb = new StringBuilder();
				if (after != null) {
					sb.append("after:").append(after);
				}
				if (before != null) {
					if (sb.length() > 0) {
						sb.append(' ');
					}
					sb.append("before:").append(before);
				}
				yield sb.toString();
			}
		};
	}

	/**
	 * Whether applying {@code action} takes messages out of this selection, so that
	 * messages already processed no longer occupy leading positions in it.
	 */
	boolean isDrainedBy(MailBulkAction action) {
		return type == MailQueryType.LABEL
				&& action.removesInbox()
				&& MailLabelBulkAdapter.INBOX_LABEL_ID.equalsIgnoreCase(value);
	}

	Map<String, Object> toParams() {
		Map<String, Object> params = new LinkedHashMap<>();
		params.put(QUERY_TYPE, type.tag());
		if (type == MailQueryType.DATE_RANGE) {
			params.put(AFTER, after);
			params.put(BEFORE, before);
		} else {
			params.put(type.tag(), value);
		}
		params.put(SEARCH, toSearchString());
		return params;
	}

	static MailQuery fromParams(Map<String, Object> params) {
		Object tag = params.get(QUERY_TYPE);
		MailQueryType type = MailQueryType.fromTag(tag != null ? tag.toString() : null)
				.orElseThrow(() -> new IllegalArgumentException("Missing or unknown query_type: " + tag));
		if (type == MailQueryType.DATE_RANGE) {
			return dateRange(stringOrNull(params.get(AFTER)), stringOrNull(params.get(BEFORE)));
		}
		return of(type, stringOrNull(params.get(type.tag())));
	}

	private static String stringOrNull(Object value) {
		return value != null ? value.toString() : null;
	}
}
