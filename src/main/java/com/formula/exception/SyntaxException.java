package com.formula.exception;

import java.util.Set;

/**
 * Exception thrown when the parser finds no action for the current token.
 */
public class SyntaxException extends FormulaException {

    private final Set<String> expected;
    private final String actual;
    private final int state;
    private final int position;

    public SyntaxException(String message) {
        super(message);
        this.expected = Set.of();
        this.actual = null;
        this.state = -1;
        this.position = -1;
    }

    public SyntaxException(Set<String> expected, String actual, int state, int position) {
        super("Unexpected token '" + actual + "' at position " + position
                + " (state " + state + "), expected one of " + expected);
        this.expected = Set.copyOf(expected);
        this.actual = actual;
        this.state = state;
        this.position = position;
    }

    /**
     * @return names of the terminals that would have been accepted
     */
    public Set<String> getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    public int getState() {
        return state;
    }

    public int getPosition() {
        return position;
    }
}
