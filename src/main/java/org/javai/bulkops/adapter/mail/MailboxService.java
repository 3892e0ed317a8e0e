package org.javai.bulkops.adapter.mail;

import java.util.List;
import java.util.Optional;

/**
 * Transport seam to a mail provider. Implementations wrap the provider's HTTP API;
 * {@link InMemoryMailboxService} serves local use and tests.
 */
public interface MailboxService {

	/**
	 * Resolves a human-readable label name to the provider's label id.
	 *
	 * @return the id, or empty when no such label exists
	 */
	Optional<String> resolveLabelId(String labelName) throws MailboxException;

	/**
	 * Counts messages matching the query without listing them.
	 */
	int countMessages(MailQuery query) throws MailboxException;

	/**
	 * Lists the ids of matching messages, skipping {@code offset} and returning at
	 * most {@code limit} ids.
	 */
	List<String> listMessageIds(MailQuery query, int offset, int limit) throws MailboxException;

	/**
	 * Adds and removes labels on every listed message in a single call.
	 */
	void modifyLabels(List<String> messageIds, List<String> addLabelIds, List<String> removeLabelIds)
			throws MailboxException;
}
