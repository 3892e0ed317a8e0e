package org.javai.bulkops.limits;

import java.util.Objects;

/**
 * Pure validation and clamping against {@link CapacityLimits}. Performs no I/O.
 */
public final class CapacityLimiter {

	private final CapacityLimits limits;

	public CapacityLimiter(CapacityLimits limits) {
		this.limits = Objects.requireNonNull(limits, "limits must not be null");
	}

	public static CapacityLimiter withDefaults() {
		return new CapacityLimiter(CapacityLimits.defaults());
	}

	/**
	 * Rejects totals above {@link CapacityLimits#maxTotalItems()}.
	 *
	 * @param count the number of items an operation would cover
	 * @throws TooManyItemsException if {@code count} exceeds the maximum
	 * @throws IllegalArgumentException if {@code count} is negative
	 */
	public void validateTotal(int count) {
		if (count < 0) {
			throw new IllegalArgumentException("count must be non-negative: " + count);
		}
		if (count > limits.maxTotalItems()) {
			throw new TooManyItemsException(count, limits.maxTotalItems());
		}
	}

	/**
	 * Clamps a requested batch size into {@code [minBatchSize, maxBatchSize]}.
	 */
	public int clampBatchSize(int requested) {
		return Math.max(limits.minBatchSize(), Math.min(requested, limits.maxBatchSize()));
	}

	public CapacityLimits limits() {
		return limits;
	}
}
