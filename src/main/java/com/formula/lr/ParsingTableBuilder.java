package com.formula.lr;

import com.formula.exception.ConflictException;
import com.formula.grammar.FirstFollowSets;
import com.formula.grammar.Grammar;
import com.formula.grammar.GrammarValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a grammar and compiles it into a {@link ParsingTable}.
 */
public final class ParsingTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(ParsingTableBuilder.class);

    private ParsingTableBuilder() {
    }

    public static ParsingTable build(Grammar grammar) {
        return build(grammar, TableOptions.defaults());
    }

    /**
     * Build the table.
     *
     * @param grammar Grammar to compile
     * @param options Build options
     * @return the parsing table
     * @throws com.formula.exception.GrammarException if the grammar is invalid
     * @throws ConflictException if strict and some conflicts stay unresolved
     */
    public static ParsingTable build(Grammar grammar, TableOptions options) {
        long start = System.nanoTime();
        GrammarValidator.validate(grammar);

        FirstFollowSets sets = FirstFollowSets.compute(grammar);
        ConflictResolver resolver = new ConflictResolver();
        List<ParsingState> canonical = new LRStateBuilder(grammar, sets, options.maxStates()).build(resolver);

        List<ParsingState> states = canonical;
        if (options.lalr()) {
            LALRMerger merger = new LALRMerger();
            LALRMerger.Result result = merger.compressStatesLALR(canonical);
            List<String> problems = merger.validateLALRMerging(canonical, result);
            if (problems.isEmpty()) {
                states = result.states();
            } else {
                log.warn("Discarding LALR compression of '{}': {}", grammar.name(), problems);
            }
        }

        List<Conflict> conflicts = resolver.conflicts();
        List<Conflict> unresolved = resolver.unresolved();
        if (options.strictConflicts() && !unresolved.isEmpty()) {
            List<String> descriptions = new ArrayList<>();
            unresolved.forEach(conflict -> descriptions.add(conflict.toString()));
            throw new ConflictException(descriptions);
        }

        ParsingTable table = new ParsingTable(grammar, states, conflicts, canonical.size());
        log.info("Built parsing table for '{}': {} LR(1) states, {} in table, {} conflicts ({} unresolved) in {} ms",
                grammar.name(), canonical.size(), table.stateCount(), conflicts.size(), unresolved.size(),
                (System.nanoTime() - start) / 1_000_000);
        return table;
    }
}
