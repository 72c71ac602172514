package com.formula.lexer;

/**
 * Grammar symbols. Terminals are produced by the lexer, non-terminals only appear in productions.
 */
public enum TokenType {
    // Literals and names
    NUMBER(true, "NUMBER"),
    IDENTIFIER(true, "IDENTIFIER"),
    VARIABLE(true, "VARIABLE"),

    // Keywords
    TRUE(true, "true"),
    FALSE(true, "false"),
    IF(true, "if"),

    // Arithmetic operators
    PLUS(true, "+"),
    MINUS(true, "-"),
    MULTIPLY(true, "*"),
    DIVIDE(true, "/"),
    POWER(true, "^"),
    MODULO(true, "%"),

    // Comparison operators
    EQUAL(true, "=="),
    NOT_EQUAL(true, "!="),
    LESS(true, "<"),
    LESS_EQUAL(true, "<="),
    GREATER(true, ">"),
    GREATER_EQUAL(true, ">="),

    // Logical operators
    AND(true, "&&"),
    OR(true, "||"),
    NOT(true, "!"),

    // Delimiters
    LEFT_PAREN(true, "("),
    RIGHT_PAREN(true, ")"),
    COMMA(true, ","),

    // End of input
    DOLLAR(true, "$"),

    // Non-terminals
    START(false, "START"),
    EXPR(false, "EXPR"),
    AND_EXPR(false, "AND_EXPR"),
    COMP_EXPR(false, "COMP_EXPR"),
    ARITH_EXPR(false, "ARITH_EXPR"),
    TERM(false, "TERM"),
    FACTOR(false, "FACTOR"),
    PRIMARY(false, "PRIMARY"),
    ARGS(false, "ARGS");

    private final boolean terminal;
    private final String symbol;

    TokenType(boolean terminal, String symbol) {
        this.terminal = terminal;
        this.symbol = symbol;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isNonTerminal() {
        return !terminal;
    }

    /**
     * @return the text used for this symbol in diagnostics
     */
    public String symbol() {
        return symbol;
    }

    public boolean isOperator() {
        return ordinal() >= PLUS.ordinal() && ordinal() <= NOT.ordinal();
    }
}
