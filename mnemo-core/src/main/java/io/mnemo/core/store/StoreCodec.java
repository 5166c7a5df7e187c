package io.mnemo.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Line codec for the memory store format.
 * <p>
 * Each line is one JSON object carrying a {@code type} discriminator of {@code "entity"} or
 * {@code "relation"}. Encoding writes keys in a fixed order so that decoding and re-encoding a
 * conformant line reproduces it byte for byte:
 * <pre>
 *   {"type":"entity","name":...,"entityType":...,"observations":[...]}      (optional "timestamp" last)
 *   {"type":"relation","from":...,"to":...,"relationType":...}
 * </pre>
 * Missing string fields decode to {@code null}; checking them is the validator's job.
 */
public final class StoreCodec {
    public static final String EMPTY_STORE = "{}";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StoreCodec() {
    }

    public static MemoryRecord decode(String line) {
        if (line == null || line.isBlank()) {
            throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "empty line");
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new StoreDecodeException(
                StoreDecodeException.Kind.MALFORMED,
                "invalid JSON: " + e.getOriginalMessage(),
                e
            );
        }
        if (node == null || !node.isObject()) {
            throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "record is not a JSON object");
        }

        JsonNode type = node.get("type");
        RecordKind kind = type != null && type.isTextual() ? RecordKind.fromWireName(type.asText()) : null;
        if (kind == null) {
            String seen = type == null ? "missing" : type.toString();
            throw new StoreDecodeException(StoreDecodeException.Kind.UNKNOWN_KIND, "unknown record type: " + seen);
        }

        return switch (kind) {
            case ENTITY -> new EntityRecord(
                text(node, "name"),
                text(node, "entityType"),
                observations(node.get("observations")),
                timestamp(node.get("timestamp"))
            );
            case RELATION -> new RelationRecord(
                text(node, "from"),
                text(node, "to"),
                text(node, "relationType")
            );
        };
    }

    public static String encode(MemoryRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", record.kind().wireName());
        if (record instanceof EntityRecord entity) {
            node.put("name", entity.name());
            node.put("entityType", entity.entityType());
            ArrayNode observations = node.putArray("observations");
            entity.observations().forEach(observations::add);
            if (entity.timestamp() != null) {
                node.put("timestamp", entity.timestamp());
            }
        } else if (record instanceof RelationRecord relation) {
            node.put("from", relation.from());
            node.put("to", relation.to());
            node.put("relationType", relation.relationType());
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode record", e);
        }
    }

    public static boolean isEmptyStoreMarker(String line) {
        if (line == null) {
            return false;
        }
        String stripped = line.strip();
        if (!stripped.startsWith("{") || !stripped.endsWith("}")) {
            return false;
        }
        try {
            JsonNode node = MAPPER.readTree(stripped);
            return node != null && node.isObject() && node.size() == 0;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static List<String> observations(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "field 'observations' must be an array");
        }
        List<String> out = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isValueNode() || item.isNull()) {
                throw new StoreDecodeException(StoreDecodeException.Kind.MALFORMED, "observations must be strings");
            }
            out.add(item.asText());
        }
        return out;
    }

    private static Long timestamp(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.canConvertToLong() && value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
