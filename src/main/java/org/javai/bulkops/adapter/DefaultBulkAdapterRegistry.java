package org.javai.bulkops.adapter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable registry mapping each domain tag to exactly one adapter.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * BulkAdapterRegistry registry = DefaultBulkAdapterRegistry.builder()
 *         .register(new MailLabelBulkAdapter(mailbox))
 *         .build();
 *
 * BulkToolAdapter adapter = registry.lookup(state.domain());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable once built and safe to share.</p>
 */
public final class DefaultBulkAdapterRegistry implements BulkAdapterRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultBulkAdapterRegistry.class);

	private final Map<String, BulkToolAdapter> adapters;

	private DefaultBulkAdapterRegistry(Map<String, BulkToolAdapter> adapters) {
		this.adapters = Map.copyOf(adapters);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Convenience factory for a fixed set of adapters.
	 */
	public static DefaultBulkAdapterRegistry of(BulkToolAdapter... adapters) {
		Builder builder = builder();
		for (BulkToolAdapter adapter : adapters) {
			builder.register(adapter);
		}
		return builder.build();
	}

	@Override
	public BulkToolAdapter lookup(String domain) {
		BulkToolAdapter adapter = domain != null ? adapters.get(domain) : null;
		if (adapter == null) {
			throw new UnknownDomainException(domain, adapters.keySet());
		}
		return adapter;
	}

	@Override
	public boolean supports(String domain) {
		return domain != null && adapters.containsKey(domain);
	}

	@Override
	public Set<String> domains() {
		return adapters.keySet();
	}

	/**
	 * Builder for {@link DefaultBulkAdapterRegistry}.
	 */
	public static final class Builder {
		private final Map<String, BulkToolAdapter> adapters = new LinkedHashMap<>();

		private Builder() {}

		/**
		 * Registers an adapter under its own {@link BulkToolAdapter#domain()}.
		 *
		 * @throws IllegalArgumentException if the domain is blank or already registered
		 */
		public Builder register(BulkToolAdapter adapter) {
			if (adapter == null) {
				throw new IllegalArgumentException("adapter must not be null");
			}
			String domain = adapter.domain();
			if (domain == null || domain.isBlank()) {
				throw new IllegalArgumentException("adapter domain must not be null or blank");
			}
			if (adapters.containsKey(domain)) {
				throw new IllegalArgumentException("An adapter for domain '" + domain + "' is already registered");
			}
			adapters.put(domain, adapter);
			logger.debug("Registered bulk adapter {} for domain '{}'", adapter.getClass().getSimpleName(), domain);
			return this;
		}

		public DefaultBulkAdapterRegistry build() {
			return new DefaultBulkAdapterRegistry(adapters);
		}
	}
}
