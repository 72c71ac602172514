package com.formula.lr;

import com.formula.grammar.ExpressionGrammar;
import com.formula.grammar.Grammar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ParsingTableCache.
 */
class ParsingTableCacheTest {

    private ParsingTableCache cache;

    @BeforeEach
    void setUp() {
        cache = new ParsingTableCache();
    }

    @Test
    @DisplayName("Should build once and serve the same table afterwards")
    void shouldMemoizeTables() {
        Grammar grammar = ExpressionGrammar.get();

        ParsingTable first = cache.get(grammar);
        ParsingTable second = cache.get(grammar);

        assertSame(first, second);
        assertEquals(1, cache.misses());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Should key tables by grammar instance and options")
    void shouldKeyByGrammarAndOptions() {
        Grammar grammar = ExpressionGrammar.get();

        ParsingTable lalr = cache.get(grammar, TableOptions.defaults());
        ParsingTable canonical = cache.get(grammar, TableOptions.canonical());
        ParsingTable copy = cache.get(ExpressionGrammar.create());

        assertNotSame(lalr, canonical);
        assertNotSame(lalr, copy);
        assertEquals(3, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should hand concurrent callers the same table")
    void shouldShareTableAcrossThreads() throws Exception {
        Grammar grammar = ExpressionGrammar.create();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ParsingTable>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> cache.get(grammar));
            }
            List<Future<ParsingTable>> futures = executor.invokeAll(tasks);
            ParsingTable expected = futures.get(0).get();
            for (Future<ParsingTable> future : futures) {
                assertSame(expected, future.get());
            }
        } finally {
            executor.shutdown();
        }
        assertEquals(1, cache.misses());
    }
}
