package org.javai.bulkops.adapter.mail;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Simple in-memory mailbox, intended for tests and local use.
 *
 * <p>Messages are returned in insertion order. A failure can be scheduled for the
 * next call of each kind with {@link #failNextCount}, {@link #failNextList} and
 * {@link #failNextModify}.</p>
 */
public class InMemoryMailboxService implements MailboxService {

	private static final DateTimeFormatter SLASH_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

	private final Map<String, MailMessage> messages = new LinkedHashMap<>();
	private final Map<String, String> labelIdsByName = new LinkedHashMap<>();
	private MailboxException nextCountFailure;
	private MailboxException nextListFailure;
	private MailboxException nextModifyFailure;
	private int modifyCalls;

	public InMemoryMailboxService() {
		labelIdsByName.put("INBOX", MailLabelBulkAdapter.INBOX_LABEL_ID);
	}

	/**
	 * Creates a user label, or returns the id of an existing one with the same name.
	 */
	public synchronized String createLabel(String name) {
		return labelIdsByName.computeIfAbsent(name, n -> "Label_" + labelIdsByName.size());
	}

	/**
	 * Adds a message to the inbox.
	 */
	public synchronized MailMessage deliver(String id, String sender, String subject, String body, LocalDate received) {
		MailMessage message = new MailMessage(id, sender, subject, body, received,
				Set.of(MailLabelBulkAdapter.INBOX_LABEL_ID));
		messages.put(id, message);
		return message;
	}

	public synchronized Optional<MailMessage> message(String id) {
		return Optional.ofNullable(messages.get(id));
	}

	public synchronized void remove(String id) {
		messages.remove(id);
	}

	public synchronized int modifyCalls() {
		return modifyCalls;
	}

	public synchronized void failNextCount(int statusCode, String message) {
		nextCountFailure = new MailboxException(statusCode, message);
	}

	public synchronized void failNextList(int statusCode, String message) {
		nextListFailure = new MailboxException(statusCode, message);
	}

	public synchronized void failNextModify(int statusCode, String message) {
		nextModifyFailure = new MailboxException(statusCode, message);
	}

	@Override
	public synchronized Optional<String> resolveLabelId(String labelName) {
		if (labelName == null) {
			return Optional.empty();
		}
		String exact = labelIdsByName.get(labelName);
		if (exact != null) {
			return Optional.of(exact);
		}
		return labelIdsByName.entrySet().stream()
				.filter(e -> e.getKey().equalsIgnoreCase(labelName))
				.map(Map.Entry::getValue)
				.findFirst();
	}

	@Override
	public synchronized int countMessages(MailQuery query) throws MailboxException {
		if (nextCountFailure != null) {
			MailboxException failure = nextCountFailure;
			nextCountFailure = null;
			throw failure;
		}
		return matching(query).size();
	}

	@Override
	public synchronized List<String> listMessageIds(MailQuery query, int offset, int limit) throws MailboxException {
		if (nextListFailure != null) {
			MailboxException failure = nextListFailure;
			nextListFailure = null;
			throw failure;
		}
		List<String> all = matching(query);
		if (offset >= all.size() || limit <= 0) {
			return List.of();
		}
		return List.copyOf(all.subList(offset, Math.min(all.size(), offset + limit)));
	}

	@Override
	public synchronized void modifyLabels(List<String> messageIds, List<String> addLabelIds,
			List<String> removeLabelIds) throws MailboxException {
		modifyCalls++;
		if (nextModifyFailure != null) {
			MailboxException failure = nextModifyFailure;
			nextModifyFailure = null;
			throw failure;
		}
		for (String id : messageIds) {
			if (!messages.containsKey(id)) {
				throw new MailboxException(404, "Message not found: " + id);
			}
		}
		for (String id : messageIds) {
			MailMessage message = messages.get(id);
			Set<String> labels = new LinkedHashSet<>(message.labelIds());
			labels.addAll(addLabelIds);
			labels.removeAll(removeLabelIds);
			messages.put(id, message.withLabelIds(labels));
		}
	}

	private List<String> matching(MailQuery query) throws MailboxException {
		List<String> ids = new ArrayList<>();
		for (MailMessage message : messages.values()) {
			if (matches(message, query)) {
				ids.add(message.id());
			}
		}
		return ids;
	}

	private boolean matches(MailMessage message, MailQuery query) throws MailboxException {
		return switch (query.type()) {
			case SENDER -> containsIgnoreCase(message.sender(), query.value());
			case SUBJECT -> containsIgnoreCase(message.subject(), query.value());
			case KEYWORD -> containsIgnoreCase(message.subject(), query.value())
					|| containsIgnoreCase(message.body(), query.value());
			case LABEL -> {
				Optional<String> labelId = resolveLabelId(query.value());
				yield labelId.isPresent() && message.labelIds().contains(labelId.get());
			}
			case DATE_RANGE -> inRange(message.received(), parseDate(query.after()), parseDate(query.before()));
		};
	}

	private static boolean inRange(LocalDate received, LocalDate after, LocalDate before) {
		if (received == null) {
			return false;
		}
		if (after != null && received.isBefore(after)) {
			return false;
		}
		return before == null || received.isBefore(before);
	}

	private static LocalDate parseDate(String text) throws MailboxException {
		if (text == null) {
			return null;
		}
		try {
			return text.contains("/") ? LocalDate.parse(text, SLASH_DATE) : LocalDate.parse(text);
		} catch (DateTimeParseException e) {
			throw new MailboxException(400, "Invalid date in query: " + text, e);
		}
	}

	private static boolean containsIgnoreCase(String haystack, String needle) {
		if (haystack == null || needle == null) {
			return false;
		}
		return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
	}
}
