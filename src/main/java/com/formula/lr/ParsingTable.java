package com.formula.lr;

import com.formula.grammar.Grammar;
import com.formula.lexer.TokenType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Dense action and goto tables indexed by state id and symbol ordinal.
 * Immutable; safe to share between concurrent parses.
 */
public final class ParsingTable {

    private static final int NO_STATE = -1;

    private final Grammar grammar;
    private final LRAction[][] actions;
    private final int[][] gotos;
    private final List<Conflict> conflicts;
    private final int canonicalStateCount;

    ParsingTable(Grammar grammar, List<ParsingState> states, List<Conflict> conflicts, int canonicalStateCount) {
        this.grammar = grammar;
        this.conflicts = List.copyOf(conflicts);
        this.canonicalStateCount = canonicalStateCount;

        int symbols = TokenType.values().length;
        this.actions = new LRAction[states.size()][symbols];
        this.gotos = new int[states.size()][symbols];
        for (ParsingState state : states) {
            int[] row = gotos[state.id()];
            Arrays.fill(row, NO_STATE);
            state.actions().forEach((terminal, action) -> actions[state.id()][terminal.ordinal()] = action);
            state.gotos().forEach((nonTerminal, target) -> row[nonTerminal.ordinal()] = target);
        }
    }

    /**
     * @return the action, or null when the terminal is an error in this state
     */
    public LRAction getAction(int state, TokenType terminal) {
        return actions[state][terminal.ordinal()];
    }

    /**
     * @return the successor state, or -1 when there is none
     */
    public int getGoto(int state, TokenType nonTerminal) {
        return gotos[state][nonTerminal.ordinal()];
    }

    /**
     * Every conflict met while filling the table, resolved or not.
     */
    public List<Conflict> getConflicts() {
        return conflicts;
    }

    public boolean hasUnresolvedConflicts() {
        return conflicts.stream().anyMatch(conflict -> !conflict.resolved());
    }

    /**
     * Terminals with an action in the given state.
     */
    public Set<TokenType> expectedTerminals(int state) {
        Set<TokenType> expected = EnumSet.noneOf(TokenType.class);
        for (TokenType type : TokenType.values()) {
            if (type.isTerminal() && actions[state][type.ordinal()] != null) {
                expected.add(type);
            }
        }
        return Collections.unmodifiableSet(expected);
    }

    public Grammar grammar() {
        return grammar;
    }

    public int stateCount() {
        return actions.length;
    }

    /**
     * Number of canonical LR(1) states before any compression.
     */
    public int canonicalStateCount() {
        return canonicalStateCount;
    }

    @Override
    public String toString() {
        return "ParsingTable[" + grammar.name() + ", " + stateCount() + " states, "
                + conflicts.size() + " conflicts]";
    }
}
