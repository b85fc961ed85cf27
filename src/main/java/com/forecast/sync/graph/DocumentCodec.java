package com.forecast.sync.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON encoding of {@link Document}s and {@link FieldValue}s. Timestamps are written as
 * {@code {"$timestamp": "<ISO-8601>"}} so they survive a round trip distinct from strings.
 */
public final class DocumentCodec {

    private static final String TIMESTAMP_KEY = "$timestamp";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private DocumentCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(Document document) {
        return write(toNode(document));
    }

    public static Document decode(String json) {
        if (json == null || json.isBlank()) {
            return Document.empty();
        }
        return fromNode(read(json));
    }

    public static String encodeValue(FieldValue value) {
        return write(toNode(value));
    }

    public static FieldValue decodeValue(String json) {
        if (json == null) {
            return FieldValue.nullValue();
        }
        return fromValueNode(read(json));
    }

    public static ObjectNode toNode(Document document) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, FieldValue> entry : document.asMap().entrySet()) {
            node.set(entry.getKey(), toNode(entry.getValue()));
        }
        return node;
    }

    public static JsonNode toNode(FieldValue value) {
        return switch (value.kind()) {
            case NULL -> NODES.nullNode();
            case STRING -> NODES.textNode(value.asString());
            case NUMBER -> NODES.numberNode(value.asNumber());
            case BOOLEAN -> NODES.booleanNode(value.asBoolean());
            case TIMESTAMP -> NODES.objectNode().put(TIMESTAMP_KEY, value.asTimestamp().toString());
        };
    }

    /**
     * Reads a JSON object into a document.
     *
     * @throws IllegalArgumentException if the node is not an object or holds unsupported values
     */
    public static Document fromNode(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Document JSON must be an object");
        }
        Document.Builder builder = Document.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), fromValueNode(field.getValue()));
        }
        return builder.build();
    }

    public static FieldValue fromValueNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.nullValue();
        }
        if (node.isTextual()) {
            return FieldValue.ofString(node.textValue());
        }
        if (node.isBoolean()) {
            return FieldValue.ofBoolean(node.booleanValue());
        }
        if (node.isNumber()) {
            return FieldValue.ofNumber(node.decimalValue());
        }
        if (node.isObject() && node.size() == 1 && node.has(TIMESTAMP_KEY)) {
            return FieldValue.ofTimestamp(Instant.parse(node.get(TIMESTAMP_KEY).asText()));
        }
        throw new IllegalArgumentException("Unsupported document value: " + node.getNodeType());
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static JsonNode read(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed document JSON", e);
        }
    }
}
