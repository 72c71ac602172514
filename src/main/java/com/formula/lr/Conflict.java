package com.formula.lr;

import com.formula.lexer.TokenType;

/**
 * A (state, terminal) pair for which more than one action was computed.
 *
 * @param state    state id at detection time
 * @param terminal lookahead terminal
 * @param existing action registered first
 * @param incoming action that collided with it
 * @param chosen   action kept in the table
 * @param resolved whether a rule settled the conflict
 * @param reason   rule that applied, or why none did
 */
public record Conflict(int state, TokenType terminal, LRAction existing, LRAction incoming,
                       LRAction chosen, boolean resolved, String reason) {

    public Kind kind() {
        if (existing instanceof LRAction.Reduce && incoming instanceof LRAction.Reduce) {
            return Kind.REDUCE_REDUCE;
        }
        return Kind.SHIFT_REDUCE;
    }

    public enum Kind {
        SHIFT_REDUCE,
        REDUCE_REDUCE
    }

    @Override
    public String toString() {
        return kind() + " in state " + state + " on '" + terminal.symbol() + "': "
                + existing + " vs " + incoming + " -> " + chosen + (resolved ? "" : " (unresolved)")
                + " [" + reason + "]";
    }
}
