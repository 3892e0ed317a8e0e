package org.javai.bulkops.adapter.mail;

import java.util.Arrays;
import java.util.Optional;

/**
 * Ways of selecting messages for a bulk mail operation.
 */
public enum MailQueryType {
	SENDER("sender"),
	KEYWORD("keyword"),
	SUBJECT("subject"),
	LABEL("label"),
	DATE_RANGE("date_range");

	private final String tag;

	MailQueryType(String tag) {
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}

	public static Optional<MailQueryType> fromTag(String tag) {
		return Arrays.stream(values()).filter(t -> t.tag.equalsIgnoreCase(tag)).findFirst();
	}

	public static String allTags() {
		return String.join(", ", Arrays.stream(values()).map(MailQueryType::tag).toList());
	}
}
