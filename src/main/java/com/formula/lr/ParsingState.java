package com.formula.lr;

import com.formula.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * State of the LR automaton. Immutable once built.
 */
public final class ParsingState {

    private final int id;
    private final Set<LRItem> kernel;
    private final Set<LRItem> items;
    private final Map<TokenType, Integer> transitions;
    private final Map<TokenType, LRAction> actions;

    public ParsingState(int id, Set<LRItem> kernel, Set<LRItem> items,
                        Map<TokenType, Integer> transitions, Map<TokenType, LRAction> actions) {
        this.id = id;
        this.kernel = Set.copyOf(kernel);
        this.items = Set.copyOf(items);
        this.transitions = Collections.unmodifiableMap(copy(transitions));
        this.actions = Collections.unmodifiableMap(copy(actions));
    }

    private static <V> Map<TokenType, V> copy(Map<TokenType, V> source) {
        Map<TokenType, V> copy = new EnumMap<>(TokenType.class);
        copy.putAll(source);
        return copy;
    }

    public int id() {
        return id;
    }

    public Set<LRItem> kernel() {
        return kernel;
    }

    public Set<LRItem> items() {
        return items;
    }

    /**
     * Successor state for every symbol, terminal or not.
     */
    public Map<TokenType, Integer> transitions() {
        return transitions;
    }

    /**
     * Resolved action for every terminal that has one.
     */
    public Map<TokenType, LRAction> actions() {
        return actions;
    }

    /**
     * Successor states on non-terminals.
     */
    public Map<TokenType, Integer> gotos() {
        Map<TokenType, Integer> gotos = new EnumMap<>(TokenType.class);
        transitions.forEach((symbol, target) -> {
            if (symbol.isNonTerminal()) {
                gotos.put(symbol, target);
            }
        });
        return gotos;
    }

    public Set<ItemCore> kernelCores() {
        return kernel.stream().map(LRItem::core).collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Sorted {@code productionId:dot} pairs of the kernel, ignoring lookaheads.
     */
    public String coreSignature() {
        return kernelCores().stream().map(ItemCore::toString).collect(Collectors.joining(","));
    }

    @Override
    public String toString() {
        return "State " + id + " " + kernel;
    }
}
