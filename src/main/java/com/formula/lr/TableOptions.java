package com.formula.lr;

/**
 * Options for building a parsing table.
 *
 * @param lalr            compress canonical LR(1) states into LALR(1) states
 * @param strictConflicts fail with a ConflictException instead of logging unresolved conflicts
 * @param maxStates       largest automaton accepted
 */
public record TableOptions(boolean lalr, boolean strictConflicts, int maxStates) {

    public static TableOptions defaults() {
        return new TableOptions(true, false, LRStateBuilder.DEFAULT_MAX_STATES);
    }

    public static TableOptions canonical() {
        return new TableOptions(false, false, LRStateBuilder.DEFAULT_MAX_STATES);
    }
}
