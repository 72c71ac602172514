package com.formula.calculator;

import com.formula.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultCache.
 */
class ResultCacheTest {

    private static CalculationResult result(String formula, double value) {
        return new CalculationResult(formula, List.of(), null, value, formula, List.of(), List.of(),
                0, 0, 0, 0.0, 0.0, false, null);
    }

    private static String key(CalculationRequest request) {
        return ResultCache.key(new Lexer(request.formula()).tokenize(), request);
    }

    @Test
    @DisplayName("Should ignore layout, comments and variable order in keys")
    void shouldNormalizeKeys() {
        String a = key(new CalculationRequest(" a +  b ", Map.of("a", 1, "b", 2)));
        String b = key(new CalculationRequest("a\n+ b /* sum */", Map.of("b", 2, "a", 1)));

        assertEquals(a, b);
    }

    @Test
    @DisplayName("Should keep formulas apart when a line break ends a comment")
    void shouldRespectCommentEnds() {
        assertNotEquals(key(new CalculationRequest("1 // note\n+ 2")), key(new CalculationRequest("1 // note + 2")));
        assertNotEquals(key(new CalculationRequest("1 # note\n+ 2")), key(new CalculationRequest("1 # note + 2")));
    }

    @Test
    @DisplayName("Should distinguish bindings and request flags")
    void shouldDistinguishRequests() {
        CalculationRequest request = new CalculationRequest("a + b", Map.of("a", 1, "b", 2));

        assertNotEquals(key(request), key(new CalculationRequest("a + b", Map.of("a", 1, "b", 3))));
        assertNotEquals(key(request), key(request.withoutOptimization()));
        assertNotEquals(key(request), key(new CalculationRequest("a + b", request.variables(), true, false)));
        assertNotEquals(key(new CalculationRequest("ab")), key(new CalculationRequest("a b")));
    }

    @Test
    @DisplayName("Should count hits and misses")
    void shouldCountHitsAndMisses() {
        ResultCache cache = new ResultCache(4);

        assertNull(cache.get("k"));
        cache.put("k", result("1", 1.0));
        assertEquals(1.0, cache.get("k").result());
        assertEquals(1.0, cache.get("k").result());

        assertEquals(2, cache.hits());
        assertEquals(1, cache.misses());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Should evict the oldest entry beyond capacity")
    void shouldEvictOldest() {
        ResultCache cache = new ResultCache(2);

        cache.put("one", result("1", 1.0));
        cache.put("two", result("2", 2.0));
        cache.get("one");
        cache.put("three", result("3", 3.0));

        assertEquals(2, cache.size());
        assertNull(cache.get("one"));
        assertNotNull(cache.get("two"));
        assertNotNull(cache.get("three"));

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(2, cache.capacity());
    }
}
