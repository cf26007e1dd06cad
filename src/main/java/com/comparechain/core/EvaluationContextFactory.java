package com.comparechain.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating an EvaluationContext from a JSON payload.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 */
public class EvaluationContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private EvaluationContextFactory() {
    }

    /**
     * Create a context whose variables come from a JSON object.
     *
     * @param jsonPayload JSON object; null or blank gives an empty context
     * @return Context with flattened variables
     */
    public static EvaluationContext fromJson(String jsonPayload) {
        return fromJson(jsonPayload, Map.of());
    }

    /**
     * Create a context from a JSON object plus callable functions.
     *
     * @param jsonPayload JSON object; null or blank gives no variables
     * @param functions   Functions by name - can be null
     * @return Context with flattened variables and the functions
     */
    public static EvaluationContext fromJson(String jsonPayload, Map<String, ExpressionFunction> functions) {
        EvaluationContext.Builder builder = EvaluationContext.builder();

        if (jsonPayload != null && !jsonPayload.isBlank()) {
            builder.variables(flatten(parseJson(jsonPayload)));
        }

        if (functions != null) {
            functions.forEach(builder::function);
        }

        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Flatten nested maps into dot-notation keys.
     * Example: {"x": {"y": "z"}} becomes {"x.y": "z"}
     */
    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value instanceof List) {
                // Lists are compared as sequences, not flattened
                result.put(key, value);
            } else {
                result.put(key, value);
            }
        }
    }
}
