package com.memos.vecdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MetadataCodec} that stores nested values as compact JSON text.
 * <p>
 * Encode: maps, iterables and arrays → JSON; strings, numbers and booleans unchanged; nulls dropped;
 * other objects go through Jackson's tree model (containers → JSON, scalars → text).
 * <p>
 * Decode: only strings starting with an opening brace or bracket are parsed, and only a complete
 * object or array result replaces the string. Numeric or boolean looking strings therefore always stay strings.
 * Numbers inside decoded containers come back as Jackson's defaults: integers as {@code Integer} (or
 * {@code Long}/{@code BigInteger} when out of range) and decimals as {@code Double}, so a nested {@code Long}
 * or {@code Float} is not {@code equals} to its decoded value.
 */
public final class JsonMetadataCodec implements MetadataCodec {

    private static final Logger log = LoggerFactory.getLogger(JsonMetadataCodec.class);

    private static final JsonMetadataCodec INSTANCE = new JsonMetadataCodec(
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));

    private final ObjectMapper mapper;

    public JsonMetadataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static JsonMetadataCodec getInstance() {
        return INSTANCE;
    }

    @Override
    public Map<String, Object> encodeMetadata(Map<String, ?> metadata) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (metadata == null) {
            return out;
        }
        for (Map.Entry<String, ?> e : metadata.entrySet()) {
            Object value = e.getValue();
            if (value == null) {
                continue;
            }
            out.put(e.getKey(), encodeValue(e.getKey(), value));
        }
        return out;
    }

    private Object encodeValue(String key, Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        try {
            if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
                return mapper.writeValueAsString(value);
            }
            JsonNode node = mapper.valueToTree(value);
            return node.isContainerNode() ? mapper.writeValueAsString(node) : node.asText();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Metadata field '" + key + "' cannot be serialized: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> decodeMetadata(Map<String, ?> metadata) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (metadata == null) {
            return out;
        }
        for (Map.Entry<String, ?> e : metadata.entrySet()) {
            Object value = e.getValue();
            out.put(e.getKey(), value instanceof String ? decodeValue(e.getKey(), (String) value) : value);
        }
        return out;
    }

    private Object decodeValue(String key, String value) {
        String trimmed = value.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return value;
        }
        try {
            JsonNode node = mapper.readTree(trimmed);
            if (node != null && node.isContainerNode()) {
                return mapper.treeToValue(node, Object.class);
            }
        } catch (JsonProcessingException e) {
            log.debug("Metadata field '{}' looks like JSON but does not parse; keeping the raw string: {}",
                    key, e.getOriginalMessage());
        }
        return value;
    }
}
