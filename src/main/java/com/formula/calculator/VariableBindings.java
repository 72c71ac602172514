package com.formula.calculator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.exception.FormulaException;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds variable bindings from a JSON object.
 * Nested objects are flattened with underscores (e.g., {"math":{"y1":4}} becomes "math_y1" -> 4)
 * so that every key is a valid identifier in formulas.
 */
public final class VariableBindings {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private VariableBindings() {
    }

    /**
     * Parse a JSON object into bindings.
     *
     * @param json JSON object text; null or blank yields no bindings
     * @return flattened bindings
     * @throws FormulaException if the payload is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", parseJson(json), result);
        return result;
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new FormulaException("Invalid JSON bindings: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "_" + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value != null) {
                // lists are kept as-is and fail as type mismatches if referenced
                result.put(key, value);
            }
        }
    }
}
