package com.formula.grammar;

import com.formula.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FIRST and FOLLOW sets of a grammar, computed by fixpoint iteration.
 */
public final class FirstFollowSets {

    private final Grammar grammar;
    private final Map<TokenType, Set<TokenType>> first = new EnumMap<>(TokenType.class);
    private final Map<TokenType, Set<TokenType>> follow = new EnumMap<>(TokenType.class);
    private final Set<TokenType> nullable = EnumSet.noneOf(TokenType.class);

    private FirstFollowSets(Grammar grammar) {
        this.grammar = grammar;
    }

    public static FirstFollowSets compute(Grammar grammar) {
        FirstFollowSets sets = new FirstFollowSets(grammar);
        sets.computeFirst();
        sets.computeFollow();
        return sets;
    }

    private List<Production> allProductions() {
        List<Production> all = new ArrayList<>(grammar.productions());
        all.add(grammar.augmentedProduction());
        return all;
    }

    private void computeFirst() {
        for (TokenType terminal : grammar.terminals()) {
            first.put(terminal, EnumSet.of(terminal));
        }
        for (TokenType nonTerminal : grammar.nonTerminals()) {
            first.put(nonTerminal, EnumSet.noneOf(TokenType.class));
        }
        first.put(TokenType.START, EnumSet.noneOf(TokenType.class));

        List<Production> productions = allProductions();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production production : productions) {
                Set<TokenType> target = first.computeIfAbsent(production.left(), k -> EnumSet.noneOf(TokenType.class));
                boolean allNullable = true;
                for (TokenType symbol : production.right()) {
                    changed |= target.addAll(firstOf(symbol));
                    if (!nullable.contains(symbol)) {
                        allNullable = false;
                        break;
                    }
                }
                if (allNullable) {
                    changed |= nullable.add(production.left());
                }
            }
        }
    }

    private void computeFollow() {
        for (TokenType nonTerminal : grammar.nonTerminals()) {
            follow.put(nonTerminal, EnumSet.noneOf(TokenType.class));
        }
        follow.put(TokenType.START, EnumSet.of(TokenType.DOLLAR));
        if (grammar.startSymbol() != null) {
            follow.computeIfAbsent(grammar.startSymbol(), k -> EnumSet.noneOf(TokenType.class)).add(TokenType.DOLLAR);
        }

        List<Production> productions = allProductions();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Production production : productions) {
                List<TokenType> right = production.right();
                for (int i = 0; i < right.size(); i++) {
                    TokenType symbol = right.get(i);
                    if (!grammar.isNonTerminal(symbol)) {
                        continue;
                    }
                    Set<TokenType> target = follow.computeIfAbsent(symbol, k -> EnumSet.noneOf(TokenType.class));
                    List<TokenType> rest = right.subList(i + 1, right.size());
                    changed |= target.addAll(firstOfSequence(rest));
                    if (isNullable(rest)) {
                        changed |= target.addAll(follow.getOrDefault(production.left(), Set.of()));
                    }
                }
            }
        }
    }

    /**
     * FIRST of a single symbol. Undeclared symbols have an empty set.
     */
    public Set<TokenType> firstOf(TokenType symbol) {
        Set<TokenType> set = first.get(symbol);
        if (set == null) {
            return symbol.isTerminal() ? EnumSet.of(symbol) : Collections.emptySet();
        }
        return set;
    }

    /**
     * FIRST of a symbol sequence, without the lookahead of a nullable suffix.
     */
    public Set<TokenType> firstOfSequence(List<TokenType> symbols) {
        Set<TokenType> result = EnumSet.noneOf(TokenType.class);
        for (TokenType symbol : symbols) {
            result.addAll(firstOf(symbol));
            if (!nullable.contains(symbol)) {
                break;
            }
        }
        return result;
    }

    /**
     * FIRST(β·a): terminals that can begin {@code symbols} followed by {@code lookahead}.
     */
    public Set<TokenType> firstOfSequence(List<TokenType> symbols, TokenType lookahead) {
        Set<TokenType> result = firstOfSequence(symbols);
        if (isNullable(symbols)) {
            result.add(lookahead);
        }
        return result;
    }

    public boolean isNullable(TokenType symbol) {
        return nullable.contains(symbol);
    }

    public boolean isNullable(List<TokenType> symbols) {
        for (TokenType symbol : symbols) {
            if (!nullable.contains(symbol)) {
                return false;
            }
        }
        return true;
    }

    public Set<TokenType> followOf(TokenType nonTerminal) {
        return Collections.unmodifiableSet(follow.getOrDefault(nonTerminal, EnumSet.noneOf(TokenType.class)));
    }

    public Map<TokenType, Set<TokenType>> firstSets() {
        return Collections.unmodifiableMap(first);
    }

    public Map<TokenType, Set<TokenType>> followSets() {
        return Collections.unmodifiableMap(follow);
    }
}
