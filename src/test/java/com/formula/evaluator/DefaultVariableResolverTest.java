package com.formula.evaluator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultVariableResolver.
 */
class DefaultVariableResolverTest {

    @Test
    @DisplayName("Should convert every numeric type to Double")
    void shouldConvertNumbers() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("i", 3);
        bindings.put("l", 4L);
        bindings.put("d", new BigDecimal("2.5"));
        VariableResolver resolver = VariableResolver.of(bindings);

        assertEquals(Optional.of(3.0), resolver.resolveValue("i"));
        assertEquals(Optional.of(4.0), resolver.resolveValue("l"));
        assertEquals(Optional.of(2.5), resolver.resolveValue("d"));
    }

    @Test
    @DisplayName("Should parse numeric and boolean strings")
    void shouldConvertStrings() {
        VariableResolver resolver = VariableResolver.of(Map.of("n", " 12.5 ", "t", "True", "s", "abc"));

        assertEquals(Optional.of(12.5), resolver.resolveValue("n"));
        assertEquals(Optional.of(true), resolver.resolveValue("t"));
        assertTrue(resolver.resolve("s").isPresent());
        assertTrue(resolver.resolveValue("s").isEmpty());
    }

    @Test
    @DisplayName("Should treat null bindings and unsupported values as unresolvable")
    void shouldHandleNullsAndOtherTypes() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("nothing", null);
        bindings.put("list", List.of(1, 2));
        DefaultVariableResolver resolver = new DefaultVariableResolver(bindings);

        assertTrue(resolver.resolve("nothing").isEmpty());
        assertTrue(resolver.resolveValue("list").isEmpty());
        assertTrue(resolver.resolve("").isEmpty());
        assertTrue(new DefaultVariableResolver(null).bindings().isEmpty());
        assertTrue(VariableResolver.empty().resolve("x").isEmpty());
    }
}
