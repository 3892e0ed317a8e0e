package org.javai.bulkops.adapter;

import java.util.Set;

/**
 * Resolves the adapter responsible for a domain tag.
 *
 * @see DefaultBulkAdapterRegistry
 */
public interface BulkAdapterRegistry {

	/**
	 * Gets the adapter registered for a domain.
	 *
	 * @param domain the domain tag stored in the operation state
	 * @return the adapter
	 * @throws UnknownDomainException if no adapter is registered for the domain
	 */
	BulkToolAdapter lookup(String domain);

	/**
	 * Checks whether an adapter is registered for a domain.
	 */
	boolean supports(String domain);

	/**
	 * All registered domain tags.
	 */
	Set<String> domains();
}
