package org.javai.bulkops.adapter.mail;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * A message held by {@link InMemoryMailboxService}.
 *
 * @param id message id
 * @param sender sender address
 * @param subject subject line
 * @param body plain-text body
 * @param received date the message arrived
 * @param labelIds ids of the labels currently applied
 */
public record MailMessage(String id, String sender, String subject, String body, LocalDate received,
		Set<String> labelIds) {

	public MailMessage {
		Objects.requireNonNull(id, "id must not be null");
		sender = sender != null ? sender : "";
		subject = subject != null ? subject : "";
		body = body != null ? body : "";
		labelIds = labelIds != null ? Set.copyOf(labelIds) : Set.of();
	}

	MailMessage withLabelIds(Set<String> labels) {
		return new MailMessage(id, sender, subject, body, received, labels);
	}
}
