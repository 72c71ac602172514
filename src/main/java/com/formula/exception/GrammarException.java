package com.formula.exception;

import java.util.List;

/**
 * Exception thrown when a grammar fails validation.
 * Results in fail-fast before any parsing table is built.
 */
public class GrammarException extends FormulaException {

    private final List<String> symbols;

    public GrammarException(String message) {
        this(message, List.of());
    }

    public GrammarException(String message, List<String> symbols) {
        super(symbols.isEmpty() ? message : message + ": " + symbols);
        this.symbols = List.copyOf(symbols);
    }

    /**
     * @return the offending symbols, empty when the error is not about particular symbols
     */
    public List<String> getSymbols() {
        return symbols;
    }
}
