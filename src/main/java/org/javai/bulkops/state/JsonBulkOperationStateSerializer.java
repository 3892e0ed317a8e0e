package org.javai.bulkops.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.bulkops.adapter.PreparedBulkContext;

/**
 * JSON implementation of {@link BulkOperationStateSerializer}.
 *
 * <p>The encoding is a single JSON object:</p>
 * <pre>{@code
 * {
 *   "format": "bulk-operation-state",
 *   "schemaVersion": 1,
 *   "checksum": "<SHA-256 hex of the compact state JSON>",
 *   "state": { ... }
 * }
 * }</pre>
 *
 * <h2>Integrity Protection</h2>
 * <p>The checksum covers the compact form of {@code state}; any edit to it is
 * detected during decoding and raises an {@link IntegrityException}.</p>
 *
 * <h2>Schema Migrations</h2>
 * <p>States written with an older schema version are migrated through the
 * configured {@link BulkStateMigrationRegistry} before they are read.</p>
 *
 * <h2>Opaque maps</h2>
 * <p>Context maps are written as JSON and read back as {@link LinkedHashMap}s.
 * Integral numbers come back as {@code Integer} when they fit, otherwise
 * {@code Long}; fractional numbers come back as {@code Double}. {@link PreparedBulkContext}
 * normalizes values to the same types, so a decoded state equals the one encoded.</p>
 */
public class JsonBulkOperationStateSerializer implements BulkOperationStateSerializer {

	static final String FORMAT = "bulk-operation-state";

	/** Current schema version for new encodings */
	public static final int CURRENT_SCHEMA_VERSION = 1;

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

	private final ObjectMapper mapper;
	private final BulkStateMigrationRegistry migrationRegistry;
	private final int schemaVersion;

	/**
	 * Creates a serializer without migration support.
	 */
	public JsonBulkOperationStateSerializer() {
		this(null);
	}

	/**
	 * Creates a serializer with migration support.
	 *
	 * @param migrationRegistry the registry for schema migrations (may be null)
	 */
	public JsonBulkOperationStateSerializer(BulkStateMigrationRegistry migrationRegistry) {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
		this.migrationRegistry = migrationRegistry;
		this.schemaVersion = migrationRegistry != null
				? migrationRegistry.currentVersion()
				: CURRENT_SCHEMA_VERSION;
	}

	@Override
	public String encode(BulkOperationState state) {
		if (state == null) {
			throw new IllegalArgumentException("state must not be null");
		}
		try {
			ObjectNode stateNode = stateToJson(state);
			ObjectNode envelope = mapper.createObjectNode();
			envelope.put("format", FORMAT);
			envelope.put("schemaVersion", schemaVersion);
			envelope.put("checksum", checksum(stateNode));
			envelope.set("state", stateNode);
			return mapper.writeValueAsString(envelope);
		} catch (JsonProcessingException | IllegalArgumentException e) {
			throw new IllegalStateException("Failed to encode bulk operation state " + state.operationId(), e);
		}
	}

	@Override
	public BulkOperationState decode(String encoded) {
		if (encoded == null || encoded.isBlank()) {
			throw new IntegrityException("Encoded state is empty or null");
		}

		JsonNode root;
		try {
			root = mapper.readTree(encoded);
		} catch (JsonProcessingException e) {
			throw new IntegrityException("Encoded state is not valid JSON", e);
		}
		if (root == null || !root.isObject() || !FORMAT.equals(root.path("format").asText(null))) {
			throw new IntegrityException("Encoded state has an unrecognized format");
		}

		JsonNode versionNode = root.get("schemaVersion");
		if (versionNode == null || !versionNode.canConvertToInt()) {
			throw new IntegrityException("Encoded state has no schema version");
		}
		int version = versionNode.asInt();
		if (version > schemaVersion) {
			throw new MigrationException(
					"State version " + version + " is newer than current version " + schemaVersion);
		}

		JsonNode stateNode = root.get("state");
		if (stateNode == null || !stateNode.isObject()) {
			throw new IntegrityException("Encoded state has no state object");
		}
		String storedChecksum = root.path("checksum").asText("");
		try {
			if (!storedChecksum.equals(checksum(stateNode))) {
				throw new IntegrityException("State integrity check failed - data may have been tampered with");
			}
		} catch (JsonProcessingException e) {
			throw new IntegrityException("State could not be verified", e);
		}

		ObjectNode state = (ObjectNode) stateNode;
		if (version < schemaVersion) {
			if (migrationRegistry == null) {
				throw new MigrationException(
						"State version " + version + " requires migration but no registry configured");
			}
			migrationRegistry.upgrade(state, version);
		}

		try {
			return jsonToState(state);
		} catch (IntegrityException | MigrationException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new IntegrityException("Encoded state is incomplete or invalid: " + e.getMessage(), e);
		}
	}

	/**
	 * Gets the schema version used for new encodings.
	 */
	public int schemaVersion() {
		return schemaVersion;
	}

	@Override
	public String toReadableJson(String encoded) {
		if (encoded == null || encoded.isBlank()) {
			return "{}";
		}
		try {
			Object parsed = mapper.readValue(encoded, Object.class);
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
		} catch (JsonProcessingException e) {
			return mapper.createObjectNode().put("error", e.getOriginalMessage()).toString();
		}
	}

	private ObjectNode stateToJson(BulkOperationState state) {
		ObjectNode json = mapper.createObjectNode();
		json.put("operationId", state.operationId());
		json.put("domain", state.domain());
		json.put("action", state.action());
		json.set("context", contextToJson(state.context()));
		json.put("totalItems", state.totalItems());
		json.put("batchSize", state.batchSize());
		json.put("processed", state.processed());
		json.put("cursor", state.cursor());

		ArrayNode errors = json.putArray("errors");
		for (BulkItemError error : state.errors()) {
			ObjectNode e = errors.addObject();
			e.put("itemId", error.itemId());
			e.put("error", error.error());
		}

		json.put("createdAt", state.createdAt().toString());
		json.put("status", state.status().name());
		return json;
	}

	private ObjectNode contextToJson(PreparedBulkContext context) {
		ObjectNode json = mapper.createObjectNode();
		json.put("domain", context.domain());
		json.put("action", context.action());
		json.set("queryParams", mapper.valueToTree(context.queryParams()));
		json.set("actionParams", mapper.valueToTree(context.actionParams()));
		json.set("metadata", mapper.valueToTree(context.metadata()));
		return json;
	}

	private BulkOperationState jsonToState(ObjectNode json) {
		List<BulkItemError> errors = new ArrayList<>();
		for (JsonNode e : json.path("errors")) {
			errors.add(new BulkItemError(required(e, "itemId").asText(), e.path("error").asText(null)));
		}

		return new BulkOperationState(
				required(json, "operationId").asText(),
				required(json, "domain").asText(),
				required(json, "action").asText(),
				jsonToContext(required(json, "context")),
				required(json, "totalItems").asInt(),
				required(json, "batchSize").asInt(),
				required(json, "processed").asInt(),
				required(json, "cursor").asInt(),
				errors,
				Instant.parse(required(json, "createdAt").asText()),
				BulkStatus.valueOf(required(json, "status").asText()));
	}

	private PreparedBulkContext jsonToContext(JsonNode json) {
		return new PreparedBulkContext(
				required(json, "domain").asText(),
				required(json, "action").asText(),
				toMap(json.get("queryParams")),
				toMap(json.get("actionParams")),
				toMap(json.get("metadata")));
	}

	private Map<String, Object> toMap(JsonNode node) {
		if (node == null || node.isNull()) {
			return Map.of();
		}
		return mapper.convertValue(node, MAP_TYPE);
	}

	private static JsonNode required(JsonNode json, String field) {
		JsonNode value = json.get(field);
		if (value == null || value.isNull()) {
			throw new IntegrityException("Encoded state is missing field '" + field + "'");
		}
		return value;
	}

	private String checksum(JsonNode stateNode) throws JsonProcessingException {
		byte[] bytes = mapper.writeValueAsString(stateNode).getBytes(StandardCharsets.UTF_8);
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(bytes));
		} catch (NoSuchAlgorithmException e) {
			// SHA-256 is guaranteed to be available in all Java implementations
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}
}
