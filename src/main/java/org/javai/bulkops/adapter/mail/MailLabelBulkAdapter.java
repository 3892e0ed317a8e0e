package org.javai.bulkops.adapter.mail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.bulkops.BulkOperationException;
import org.javai.bulkops.adapter.BulkCountException;
import org.javai.bulkops.adapter.BulkExecutionException;
import org.javai.bulkops.adapter.BulkFetchException;
import org.javai.bulkops.adapter.BulkItem;
import org.javai.bulkops.adapter.BulkResult;
import org.javai.bulkops.adapter.BulkToolAdapter;
import org.javai.bulkops.adapter.BulkValidationException;
import org.javai.bulkops.adapter.PreparedBulkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk adapter that labels, archives or moves mail messages.
 *
 * <p>Expected raw parameters:</p>
 * <ul>
 *   <li>{@code action}: {@code label}, {@code archive} or {@code move_to_label}</li>
 *   <li>{@code query_type}: {@code sender}, {@code keyword}, {@code subject}, {@code label}
 *       or {@code date_range}</li>
 *   <li>{@code query_value}: required unless {@code query_type} is {@code date_range}</li>
 *   <li>{@code after} / {@code before}: date bounds, at least one for {@code date_range}</li>
 *   <li>{@code label_name}: required for {@code label} and {@code move_to_label}</li>
 * </ul>
 *
 * <p>Each batch is applied with exactly one {@link MailboxService#modifyLabels} call.</p>
 *
 * <p>When the action removes the very label being queried (archiving {@code label:INBOX}),
 * processed messages leave the selection, so batches are always read from its start.
 * Messages that failed stay in the selection and are attempted again.</p>
 */
public class MailLabelBulkAdapter implements BulkToolAdapter {

	private static final Logger logger = LoggerFactory.getLogger(MailLabelBulkAdapter.class);

	public static final String DOMAIN = "mail";

	static final String INBOX_LABEL_ID = "INBOX";
	static final String LABEL_ID = "label_id";
	static final String LABEL_NAME = "label_name";

	private final MailboxService mailbox;

	public MailLabelBulkAdapter(MailboxService mailbox) {
		this.mailbox = Objects.requireNonNull(mailbox, "mailbox must not be null");
	}

	@Override
	public String domain() {
		return DOMAIN;
	}

	@Override
	public PreparedBulkContext prepare(Map<String, Object> rawParams) {
		Map<String, Object> params = rawParams != null ? rawParams : Map.of();

		String actionTag = text(params, "action");
		MailBulkAction action = MailBulkAction.fromTag(actionTag)
				.orElseThrow(() -> new BulkValidationException(
						"Invalid or missing action. Must be one of: " + MailBulkAction.allTags()));

		MailQuery query = parseQuery(params);

		Map<String, Object> actionParams = new LinkedHashMap<>();
		if (action.addsLabel()) {
			String labelName = text(params, LABEL_NAME);
			if (labelName == null) {
				throw new BulkValidationException("label_name is required for action '" + action.tag() + "'");
			}
			actionParams.put(LABEL_ID, resolveLabel(labelName));
			actionParams.put(LABEL_NAME, labelName);
		}

		return new PreparedBulkContext(DOMAIN, action.tag(), query.toParams(), actionParams);
	}

	@Override
	public int getTotalCount(PreparedBulkContext context) {
		MailQuery query = queryOf(context);
		try {
			int count = mailbox.countMessages(query);
			logger.debug("Mailbox reports {} message(s) for '{}'", count, query.toSearchString());
			return Math.max(0, count);
		} catch (MailboxException e) {
			throw new BulkCountException("Failed to count messages for '" + query.toSearchString() + "': "
					+ e.getMessage(), e);
		}
	}

	@Override
	public List<BulkItem> getNextBatch(PreparedBulkContext context, int batchSize, int offset) {
		MailQuery query = queryOf(context);
		int start = MailBulkAction.fromTag(context.action()).filter(query::isDrainedBy).isPresent() ? 0 : offset;
		try {
			List<String> ids = mailbox.listMessageIds(query, start, batchSize);
			List<BulkItem> items = new ArrayList<>(ids.size());
			for (String id : ids) {
				items.add(BulkItem.of(id));
			}
			return items;
		} catch (MailboxException e) {
			throw new BulkFetchException("Failed to list messages for '" + query.toSearchString()
					+ "' at offset " + start + ": " + e.getMessage(), e);
		}
	}

	@Override
	public List<BulkResult> executeBatch(List<BulkItem> items, PreparedBulkContext context) {
		List<String> ids = items.stream().map(BulkItem::id).toList();
		if (ids.isEmpty()) {
			return List.of();
		}

		Optional<MailBulkAction> action = MailBulkAction.fromTag(context.action());
		if (action.isEmpty()) {
			return failAll(ids, "Unsupported mail bulk action: " + context.action());
		}

		List<String> add = new ArrayList<>();
		List<String> remove = new ArrayList<>();
		if (action.get().addsLabel()) {
			String labelId = context.actionParam(LABEL_ID);
			if (labelId == null) {
				return failAll(ids, "Missing label_id for action '" + context.action() + "'");
			}
			add.add(labelId);
		}
		if (action.get().removesInbox()) {
			remove.add(INBOX_LABEL_ID);
		}

		try {
			mailbox.modifyLabels(ids, add, remove);
			return ids.stream().map(BulkResult::succeeded).toList();
		} catch (MailboxException e) {
			if (e.isAuthorizationFailure()) {
				logger.warn("Mailbox rejected bulk {} with status {}", context.action(), e.statusCode());
				throw new BulkExecutionException("Mailbox authorization failed (status " + e.statusCode() + "): "
						+ e.getMessage(), e, false);
			}
			logger.warn("Bulk {} failed for {} message(s): {}", context.action(), ids.size(), e.getMessage());
			return failAll(ids, e.getMessage());
		}
	}

	private MailQuery parseQuery(Map<String, Object> params) {
		String typeTag = text(params, "query_type");
		MailQueryType type = MailQueryType.fromTag(typeTag)
				.orElseThrow(() -> new BulkValidationException(
						"Invalid or missing query_type. Must be one of: " + MailQueryType.allTags()));

		if (type == MailQueryType.DATE_RANGE) {
			String after = text(params, "after");
			String before = text(params, "before");
			if (after == null && before == null) {
				throw new BulkValidationException("date_range requires at least 'after' or 'before'");
			}
			return MailQuery.dateRange(after, before);
		}

		String value = text(params, "query_value");
		if (value == null) {
			throw new BulkValidationException("query_value is required for query_type '" + type.tag() + "'");
		}
		return MailQuery.of(type, value);
	}

	private String resolveLabel(String labelName) {
		try {
			return mailbox.resolveLabelId(labelName)
					.orElseThrow(() -> new BulkValidationException("Label '" + labelName + "' not found"));
		} catch (MailboxException e) {
			throw new BulkOperationException("Failed to resolve label '" + labelName + "': " + e.getMessage(), e, true);
		}
	}

	private static MailQuery queryOf(PreparedBulkContext context) {
		try {
			return MailQuery.fromParams(context.queryParams());
		} catch (IllegalArgumentException e) {
			throw new BulkValidationException("Prepared context has no usable mail query: " + e.getMessage(), e);
		}
	}

	private static List<BulkResult> failAll(List<String> ids, String error) {
		return ids.stream().map(id -> BulkResult.failed(id, error)).toList();
	}

	private static String text(Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value == null) {
			return null;
		}
		String text = value.toString().trim();
		return text.isEmpty() ? null : text;
	}
}
