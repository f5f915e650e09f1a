package com.intelmonitor.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helpers used by the MapStruct mappers and the snapshot store for
 * columns that hold JSON documents (settings, change lists, metric maps).
 *
 * <p>Dates are written as ISO-8601 strings; unknown properties are ignored so older
 * rows stay readable after a model gains a field.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** Same settings, with map entries written in key order. Used for content comparison. */
    private static final ObjectMapper CANONICAL_MAPPER;

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        CANONICAL_MAPPER = OBJECT_MAPPER.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    private JsonHelper() {}

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /**
     * Serialize with map entries sorted by key at every level, so equal maps built in a
     * different insertion order give the same string. Returns null if input is null.
     */
    public static String toCanonicalJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to canonical JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Deserialize a JSON string to an object. Returns null if input is null or empty. */
    public static <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", type.getSimpleName(), json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }

    /** Deserialize a JSON string to a generic type (e.g. Map&lt;String, Integer&gt;). */
    public static <T> T fromJson(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON to {}: {}", typeRef.getType(), json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }

    /** Deserialize a JSON array string to a List. Returns empty list if input is null. */
    public static <T> List<T> fromJsonList(String json, Class<T> elementType) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            return OBJECT_MAPPER.readValue(
                    json, OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON list of {}: {}", elementType.getSimpleName(), json, e);
            throw new IllegalStateException("JSON list deserialization failed", e);
        }
    }

    /** Deserialize a JSON object string to a Map with values of the given type. Empty map for null input. */
    public static <V> Map<String, V> fromJsonMap(String json, Class<V> valueType) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return OBJECT_MAPPER.readValue(
                    json,
                    OBJECT_MAPPER
                            .getTypeFactory()
                            .constructMapType(LinkedHashMap.class, String.class, valueType));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON map of {}: {}", valueType.getSimpleName(), json, e);
            throw new IllegalStateException("JSON map deserialization failed", e);
        }
    }
}
