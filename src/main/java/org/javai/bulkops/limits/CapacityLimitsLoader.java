package org.javai.bulkops.limits;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link CapacityLimits} from YAML.
 *
 * <pre>
 * min_batch_size: 5
 * max_batch_size: 20
 * max_total_items: 200
 * </pre>
 *
 * Missing keys fall back to the defaults.
 */
public class CapacityLimitsLoader {

	private static final Logger logger = LoggerFactory.getLogger(CapacityLimitsLoader.class);

	/** Classpath resource consulted by {@link #loadDefault()}. */
	public static final String DEFAULT_RESOURCE = "bulk-limits.yaml";

	static final String MIN_BATCH_SIZE = "min_batch_size";
	static final String MAX_BATCH_SIZE = "max_batch_size";
	static final String MAX_TOTAL_ITEMS = "max_total_items";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when
	 * the resource is absent.
	 */
	public CapacityLimits loadDefault() {
		InputStream in = CapacityLimitsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.debug("No {} on classpath, using default capacity limits", DEFAULT_RESOURCE);
			return CapacityLimits.defaults();
		}
		try (in) {
			return load(in);
		} catch (CapacityConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new CapacityConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public CapacityLimits load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (CapacityConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new CapacityConfigurationException("Failed to load capacity limits from path: " + path, e);
		}
	}

	public CapacityLimits load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (CapacityConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new CapacityConfigurationException("Failed to load capacity limits from input stream", e);
		}
	}

	public CapacityLimits loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (CapacityConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new CapacityConfigurationException("Failed to load capacity limits from string", e);
		}
	}

	private CapacityLimits build(Object document) {
		if (document == null) {
			return CapacityLimits.defaults();
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new CapacityConfigurationException(
					"Capacity limits must be a YAML mapping, got " + document.getClass().getSimpleName());
		}
		try {
			CapacityLimits limits = CapacityLimits.builder()
					.minBatchSize(intValue(data, MIN_BATCH_SIZE, CapacityLimits.DEFAULT_MIN_BATCH_SIZE))
					.maxBatchSize(intValue(data, MAX_BATCH_SIZE, CapacityLimits.DEFAULT_MAX_BATCH_SIZE))
					.maxTotalItems(intValue(data, MAX_TOTAL_ITEMS, CapacityLimits.DEFAULT_MAX_TOTAL_ITEMS))
					.build();
			logger.debug("Loaded capacity limits: {}", limits);
			return limits;
		} catch (IllegalArgumentException e) {
			throw new CapacityConfigurationException("Invalid capacity limits: " + e.getMessage(), e);
		}
	}

	private static int intValue(Map<?, ?> data, String key, int defaultValue) {
		Object value = data.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Integer i) {
			return i;
		}
		if (value instanceof Number n) {
			throw new CapacityConfigurationException(key + " must be an integer, got " + n);
		}
		try {
			return Integer.parseInt(value.toString().trim());
		} catch (NumberFormatException e) {
			throw new CapacityConfigurationException(key + " must be an integer, got '" + value + "'", e);
		}
	}
}
