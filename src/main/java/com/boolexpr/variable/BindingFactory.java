package com.boolexpr.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Map;

/**
 * Factory for creating variable bindings from JSON payloads.
 * Only top-level members become variables; nested objects and arrays are kept as-is.
 */
public final class BindingFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private BindingFactory() {
    }

    /**
     * Create a binding from a JSON object.
     *
     * @param json JSON object text, may be null or blank
     * @return Unmodifiable binding (empty for null or blank input)
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid JSON payload: root must be an object");
            }
            return Collections.unmodifiableMap(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }
}
