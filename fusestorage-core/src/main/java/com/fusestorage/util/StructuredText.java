package com.fusestorage.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * JSON encoding of arrays, maps and nested objects stored in a single text column.
 */
@Slf4j
public final class StructuredText {
    public static final String EMPTY_ARRAY = "[]";
    public static final String EMPTY_OBJECT = "{}";

    private static final int MAX_NATIVE_DEPTH = 16;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private StructuredText() {
    }

    /**
     * Shared mapper; configured once and never mutated afterwards.
     *
     * @return object mapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * True for collections and arrays other than {@code byte[]}.
     *
     * @param value value to check
     * @return whether the value is a sequence container
     */
    public static boolean isSequence(Object value) {
        if (value instanceof Collection<?>) {
            return true;
        }
        return value != null && value.getClass().isArray() && !(value instanceof byte[]);
    }

    /**
     * Encode a collection or array as a JSON array.
     *
     * @param sequence collection or array
     * @return JSON array text, {@code []} when encoding fails
     */
    public static String writeArray(Object sequence) {
        try {
            if (isJsonNative(sequence, 0)) {
                return MAPPER.writeValueAsString(sequence);
            }
            ArrayNode node = MAPPER.createArrayNode();
            for (Object element : elements(sequence)) {
                node.add(toNode(element));
            }
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Falling back to empty array for {}: {}", sequence.getClass().getName(), e.getMessage());
            return EMPTY_ARRAY;
        }
    }

    /**
     * Encode a map as a JSON object, keys in sorted order.
     *
     * @param map map to encode
     * @return JSON object text, {@code {}} when encoding fails
     */
    public static String writeObject(Map<?, ?> map) {
        try {
            if (isJsonNative(map, 0)) {
                return MAPPER.writeValueAsString(map);
            }
            ObjectNode node = MAPPER.createObjectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                node.set(String.valueOf(entry.getKey()), toNode(entry.getValue()));
            }
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Falling back to empty object for map: {}", e.getMessage());
            return EMPTY_OBJECT;
        }
    }

    /**
     * Encode an arbitrary object through Jackson.
     *
     * @param value object to encode
     * @return JSON text, {@code {}} when encoding fails
     */
    public static String writeValue(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Falling back to empty object for {}: {}", value.getClass().getName(), e.getMessage());
            return EMPTY_OBJECT;
        }
    }

    /**
     * Decode JSON text into the given type.
     *
     * @param json JSON text
     * @param type target type
     * @return decoded value, or {@code null} when the text does not decode into {@code type}
     */
    public static Object read(String json, JavaType type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("Structured text did not decode as {}: {}", type, e.getOriginalMessage());
            return null;
        }
    }

    private static JsonNode toNode(Object element) {
        if (element == null) {
            return MAPPER.nullNode();
        }
        try {
            return MAPPER.valueToTree(element);
        } catch (IllegalArgumentException e) {
            log.debug("Storing {} as its string form: {}", element.getClass().getName(), e.getMessage());
            return TextNode.valueOf(String.valueOf(element));
        }
    }

    private static Iterable<?> elements(Object sequence) {
        if (sequence instanceof Collection<?> c) {
            return c;
        }
        int length = Array.getLength(sequence);
        Object[] copy = new Object[length];
        for (int i = 0; i < length; i++) {
            copy[i] = Array.get(sequence, i);
        }
        return java.util.Arrays.asList(copy);
    }

    private static boolean isJsonNative(Object value, int depth) {
        if (depth > MAX_NATIVE_DEPTH) {
            return false;
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isJsonNative(entry.getValue(), depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        if (isSequence(value)) {
            for (Object element : elements(value)) {
                if (!isJsonNative(element, depth + 1)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }
}
