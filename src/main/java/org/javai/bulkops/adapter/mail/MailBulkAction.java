package org.javai.bulkops.adapter.mail;

import java.util.Arrays;
import java.util.Optional;

/**
 * Label changes supported by {@link MailLabelBulkAdapter}.
 */
public enum MailBulkAction {

	/** Adds a label. */
	LABEL("label", true, false),
	/** Removes the inbox label. */
	ARCHIVE("archive", false, true),
	/** Adds a label and removes the inbox label. */
	MOVE_TO_LABEL("move_to_label", true, true);

	private final String tag;
	private final boolean addsLabel;
	private final boolean removesInbox;

	MailBulkAction(String tag, boolean addsLabel, boolean removesInbox) {
		this.tag = tag;
		this.addsLabel = addsLabel;
		this.removesInbox = removesInbox;
	}

	public String tag() {
		return tag;
	}

	public boolean addsLabel() {
		return addsLabel;
	}

	public boolean removesInbox() {
		return removesInbox;
	}

	public static Optional<MailBulkAction> fromTag(String tag) {
		return Arrays.stream(values()).filter(a -> a.tag.equalsIgnoreCase(tag)).findFirst();
	}

	public static String allTags() {
		return String.join(", ", Arrays.stream(values()).map(MailBulkAction::tag).toList());
	}
}
