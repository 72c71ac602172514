package com.formula.calculator;

import com.formula.exception.FormulaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VariableBindings.
 */
class VariableBindingsTest {

    @Test
    @DisplayName("Should flatten nested objects with underscores")
    void shouldFlattenNestedObjects() {
        Map<String, Object> bindings = VariableBindings.fromJson("""
                {"grade": {"math": {"y1": 4, "y2": 5}, "art": 3}, "days": 2, "active": true}
                """);

        assertEquals(Map.of(
                "grade_math_y1", 4,
                "grade_math_y2", 5,
                "grade_art", 3,
                "days", 2,
                "active", true), bindings);
    }

    @Test
    @DisplayName("Should skip nulls and keep lists as values")
    void shouldSkipNulls() {
        Map<String, Object> bindings = VariableBindings.fromJson("{\"a\": null, \"b\": [1, 2], \"c\": \"x\"}");

        assertFalse(bindings.containsKey("a"));
        assertEquals(List.of(1, 2), bindings.get("b"));
        assertEquals("x", bindings.get("c"));
    }

    @Test
    @DisplayName("Should return no bindings for blank input")
    void shouldHandleBlankInput() {
        assertTrue(VariableBindings.fromJson(null).isEmpty());
        assertTrue(VariableBindings.fromJson("  ").isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Should reject payloads that are not JSON objects")
    @ValueSource(strings = {"{\"a\": ", "[1, 2]", "not json"})
    void shouldRejectInvalidPayloads(String json) {
        FormulaException e = assertThrows(FormulaException.class, () -> VariableBindings.fromJson(json));

        assertTrue(e.getMessage().startsWith("Invalid JSON bindings"));
    }

    @Test
    @DisplayName("Should feed flattened bindings into calculations")
    void shouldBindIntoCalculation() {
        Map<String, Object> bindings = VariableBindings.fromJson("{\"grade\": {\"math\": 4, \"art\": 2}}");

        assertEquals(3.0, Calculator.createDefault().evaluate("(grade_math + grade_art) / 2", bindings));
    }
}
