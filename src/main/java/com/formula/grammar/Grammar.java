package com.formula.grammar;

import com.formula.ast.ASTNode;
import com.formula.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Context-free grammar with an augmented start production {@code START → start}.
 * Instances are immutable and compared by identity.
 */
public final class Grammar {

    /** Id of the augmented production; never reduced, only accepted. */
    public static final int AUGMENTED_ID = -1;

    private final String name;
    private final Set<TokenType> terminals;
    private final Set<TokenType> nonTerminals;
    private final TokenType startSymbol;
    private final List<Production> productions;
    private final Production augmentedProduction;
    private final Map<TokenType, List<Production>> byLeft;

    private Grammar(Builder builder) {
        this.name = builder.name;
        this.terminals = Collections.unmodifiableSet(EnumSet.copyOf(withEnd(builder.terminals)));
        this.nonTerminals = builder.nonTerminals.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.nonTerminals));
        this.startSymbol = builder.startSymbol;
        this.productions = List.copyOf(builder.productions);
        this.augmentedProduction = new Production(AUGMENTED_ID, TokenType.START,
                startSymbol == null ? List.of() : List.of(startSymbol),
                (children, factory) -> (ASTNode) children.get(0));

        Map<TokenType, List<Production>> index = new EnumMap<>(TokenType.class);
        for (Production production : productions) {
            index.computeIfAbsent(production.left(), k -> new ArrayList<>()).add(production);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.byLeft = Collections.unmodifiableMap(index);
    }

    private static Set<TokenType> withEnd(Set<TokenType> terminals) {
        Set<TokenType> all = EnumSet.of(TokenType.DOLLAR);
        all.addAll(terminals);
        return all;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    /**
     * @return declared terminals, always including the end-of-input terminal
     */
    public Set<TokenType> terminals() {
        return terminals;
    }

    public Set<TokenType> nonTerminals() {
        return nonTerminals;
    }

    public TokenType startSymbol() {
        return startSymbol;
    }

    public List<Production> productions() {
        return productions;
    }

    public Production augmentedProduction() {
        return augmentedProduction;
    }

    public List<Production> productionsFor(TokenType left) {
        if (left == TokenType.START) {
            return List.of(augmentedProduction);
        }
        return byLeft.getOrDefault(left, List.of());
    }

    public boolean isTerminal(TokenType symbol) {
        return terminals.contains(symbol);
    }

    public boolean isNonTerminal(TokenType symbol) {
        return nonTerminals.contains(symbol) || symbol == TokenType.START;
    }

    @Override
    public String toString() {
        return "Grammar[" + name + ", " + productions.size() + " productions]";
    }

    /**
     * Builder for grammars; productions get sequential ids unless given one.
     */
    public static final class Builder {
        private String name = "grammar";
        private final Set<TokenType> terminals = EnumSet.noneOf(TokenType.class);
        private final Set<TokenType> nonTerminals = EnumSet.noneOf(TokenType.class);
        private TokenType startSymbol;
        private final List<Production> productions = new ArrayList<>();
        private int nextId = 0;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder terminals(TokenType... symbols) {
            Collections.addAll(terminals, symbols);
            return this;
        }

        public Builder terminals(Set<TokenType> symbols) {
            terminals.addAll(symbols);
            return this;
        }

        public Builder nonTerminals(TokenType... symbols) {
            Collections.addAll(nonTerminals, symbols);
            return this;
        }

        public Builder nonTerminals(Set<TokenType> symbols) {
            nonTerminals.addAll(symbols);
            return this;
        }

        public Builder start(TokenType symbol) {
            this.startSymbol = symbol;
            return this;
        }

        public Builder production(TokenType left, List<TokenType> right, AstBuilder builder) {
            return production(nextId, left, right, builder);
        }

        public Builder production(int id, TokenType left, List<TokenType> right, AstBuilder builder) {
            productions.add(new Production(id, left, right, builder));
            nextId = Math.max(nextId, id + 1);
            return this;
        }

        public Grammar build() {
            return new Grammar(this);
        }
    }
}
