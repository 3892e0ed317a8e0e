package org.javai.bulkops.limits;

/**
 * Capacity bounds applied to every bulk operation.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults (5..20 items per batch, at most 200 items overall)
 * CapacityLimits limits = CapacityLimits.defaults();
 *
 * // Custom configuration
 * CapacityLimits limits = CapacityLimits.builder()
 *         .maxBatchSize(50)
 *         .maxTotalItems(500)
 *         .build();
 * }</pre>
 *
 * @param minBatchSize smallest batch processed per confirmation step
 * @param maxBatchSize largest batch processed per confirmation step
 * @param maxTotalItems largest number of items a single operation may cover
 */
public record CapacityLimits(
		int minBatchSize,
		int maxBatchSize,
		int maxTotalItems
) {

	public static final int DEFAULT_MIN_BATCH_SIZE = 5;

	public static final int DEFAULT_MAX_BATCH_SIZE = 20;

	public static final int DEFAULT_MAX_TOTAL_ITEMS = 200;

	public CapacityLimits {
		if (minBatchSize < 1) {
			throw new IllegalArgumentException("minBatchSize must be positive");
		}
		if (maxBatchSize < 1) {
			throw new IllegalArgumentException("maxBatchSize must be positive");
		}
		if (maxTotalItems < 1) {
			throw new IllegalArgumentException("maxTotalItems must be positive");
		}
		if (minBatchSize > maxBatchSize) {
			throw new IllegalArgumentException(
					"minBatchSize (" + minBatchSize + ") must not exceed maxBatchSize (" + maxBatchSize + ")");
		}
	}

	/**
	 * Creates limits with default values.
	 *
	 * @return default limits
	 */
	public static CapacityLimits defaults() {
		return new CapacityLimits(DEFAULT_MIN_BATCH_SIZE, DEFAULT_MAX_BATCH_SIZE, DEFAULT_MAX_TOTAL_ITEMS);
	}

	/**
	 * Creates a new builder seeded with the defaults.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CapacityLimits}.
	 */
	public static class Builder {
		private int minBatchSize = DEFAULT_MIN_BATCH_SIZE;
		private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
		private int maxTotalItems = DEFAULT_MAX_TOTAL_ITEMS;

		private Builder() {}

		public Builder minBatchSize(int minBatchSize) {
			this.minBatchSize = minBatchSize;
			return this;
		}

		public Builder maxBatchSize(int maxBatchSize) {
			this.maxBatchSize = maxBatchSize;
			return this;
		}

		public Builder maxTotalItems(int maxTotalItems) {
			this.maxTotalItems = maxTotalItems;
			return this;
		}

		/**
		 * Builds the limits.
		 *
		 * @return the limits
		 * @throws IllegalArgumentException if the values are not positive or min exceeds max
		 */
		public CapacityLimits build() {
			return new CapacityLimits(minBatchSize, maxBatchSize, maxTotalItems);
		}
	}
}
