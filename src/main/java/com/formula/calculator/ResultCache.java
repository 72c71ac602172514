package com.formula.calculator;

import com.formula.lexer.Token;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Bounded result cache with insertion-order eviction.
 * Keys combine the formula's tokens, the sorted bindings and the request flags.
 */
public class ResultCache {

    private final int capacity;
    private final Map<String, CalculationResult> entries;
    private long hits;
    private long misses;

    public ResultCache(int capacity) {
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CalculationResult> eldest) {
                return size() > ResultCache.this.capacity;
            }
        };
    }

    /**
     * Key of a request whose formula lexed to {@code tokens}. Formulas that differ only in
     * layout or comments share a key.
     */
    public static String key(List<Token> tokens, CalculationRequest request) {
        String formula = tokens.stream()
                .map(token -> token.type() + ":" + token.text())
                .collect(Collectors.joining(" "));
        return formula + "|" + new TreeMap<>(request.variables())
                + "|" + request.enableOptimization() + "|" + request.enableValidation();
    }

    public synchronized CalculationResult get(String key) {
        CalculationResult cached = entries.get(key);
        if (cached == null) {
            misses++;
        } else {
            hits++;
        }
        return cached;
    }

    public synchronized void put(String key, CalculationResult result) {
        entries.put(key, result);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int capacity() {
        return capacity;
    }
}
