package org.javai.bulkops.adapter;

import java.util.Set;
import java.util.TreeSet;
import org.javai.bulkops.BulkOperationException;

/**
 * Thrown when no adapter is registered for a domain tag.
 */
public class UnknownDomainException extends BulkOperationException {

	private final String domain;

	public UnknownDomainException(String domain, Set<String> available) {
		super("No bulk adapter registered for domain: " + domain
				+ ". Available adapters: " + String.join(", ", new TreeSet<>(available)), false);
		this.domain = domain;
	}

	public String domain() {
		return domain;
	}
}
