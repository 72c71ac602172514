package com.formula.lr;

import com.formula.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes parsing tables per grammar instance and options.
 * Concurrent first callers for the same grammar wait for a single build.
 */
public class ParsingTableCache {

    private static final Logger log = LoggerFactory.getLogger(ParsingTableCache.class);

    private record Key(Grammar grammar, TableOptions options) {
    }

    private final Map<Key, ParsingTable> tables = new ConcurrentHashMap<>();
    private final TableOptions options;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ParsingTableCache() {
        this(TableOptions.defaults());
    }

    public ParsingTableCache(TableOptions options) {
        this.options = options;
    }

    public ParsingTable get(Grammar grammar) {
        return get(grammar, options);
    }

    /**
     * Return the cached table, building it on first use.
     */
    public ParsingTable get(Grammar grammar, TableOptions tableOptions) {
        Key key = new Key(grammar, tableOptions);
        ParsingTable cached = tables.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        return tables.computeIfAbsent(key, k -> {
            misses.incrementAndGet();
            log.debug("Parsing table cache miss for {}", grammar);
            return ParsingTableBuilder.build(k.grammar(), k.options());
        });
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public int size() {
        return tables.size();
    }

    public void clear() {
        tables.clear();
        log.debug("Parsing table cache cleared");
    }
}
