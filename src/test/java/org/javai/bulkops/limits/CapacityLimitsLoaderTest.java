package org.javai.bulkops.limits;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CapacityLimitsLoaderTest {

	private final CapacityLimitsLoader loader = new CapacityLimitsLoader();

	@Test
	void loadsAllKeys() {
		CapacityLimits limits = loader.loadString("""
				min_batch_size: 2
				max_batch_size: 8
				max_total_items: 50
				""");

		assertThat(limits).isEqualTo(new CapacityLimits(2, 8, 50));
	}

	@Test
	void missingKeysTakeDefaults() {
		CapacityLimits limits = loader.loadString("max_total_items: 500\n");

		assertThat(limits.minBatchSize()).isEqualTo(CapacityLimits.DEFAULT_MIN_BATCH_SIZE);
		assertThat(limits.maxBatchSize()).isEqualTo(CapacityLimits.DEFAULT_MAX_BATCH_SIZE);
		assertThat(limits.maxTotalItems()).isEqualTo(500);
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(loader.loadString("")).isEqualTo(CapacityLimits.defaults());
	}

	@Test
	void loadsBundledResource() {
		assertThat(loader.loadDefault()).isEqualTo(CapacityLimits.defaults());
	}

	@Test
	void loadsFromPathAndStream(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("limits.yaml");
		Files.writeString(file, "min_batch_size: 3\nmax_batch_size: 4\n");

		assertThat(loader.load(file)).isEqualTo(new CapacityLimits(3, 4, 200));
		assertThat(loader.load(new ByteArrayInputStream("max_batch_size: 7".getBytes(StandardCharsets.UTF_8))))
				.isEqualTo(new CapacityLimits(5, 7, 200));
	}

	@Test
	void rejectsNonMappingDocument() {
		assertThatThrownBy(() -> loader.loadString("- 1\n- 2\n"))
				.isInstanceOf(CapacityConfigurationException.class)
				.hasMessageContaining("mapping");
	}

	@Test
	void rejectsNonIntegerValue() {
		assertThatThrownBy(() -> loader.loadString("max_batch_size: lots\n"))
				.isInstanceOf(CapacityConfigurationException.class)
				.hasMessageContaining("max_batch_size");
	}

	@Test
	void rejectsInconsistentLimits() {
		assertThatThrownBy(() -> loader.loadString("min_batch_size: 50\nmax_batch_size: 10\n"))
				.isInstanceOf(CapacityConfigurationException.class)
				.hasMessageContaining("Invalid capacity limits");
	}

	@Test
	void missingFileIsReported(@TempDir Path dir) {
		Path missing = dir.resolve("nope.yaml");

		assertThatThrownBy(() -> loader.load(missing))
				.isInstanceOf(CapacityConfigurationException.class)
				.hasMessageContaining("nope.yaml");
	}
}
