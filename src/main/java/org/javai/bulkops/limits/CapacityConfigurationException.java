package org.javai.bulkops.limits;

/**
 * Thrown when capacity limits cannot be read or are invalid.
 */
public class CapacityConfigurationException extends RuntimeException {

	public CapacityConfigurationException(String message) {
		super(message);
	}

	public CapacityConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
