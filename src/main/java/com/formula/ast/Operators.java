package com.formula.ast;

import java.util.Set;

/**
 * Operator spellings used in tree nodes.
 */
public final class Operators {

    public static final String PLUS = "+";
    public static final String MINUS = "-";
    public static final String MULTIPLY = "*";
    public static final String DIVIDE = "/";
    public static final String MODULO = "%";
    public static final String POWER = "^";
    public static final String EQUAL = "==";
    public static final String NOT_EQUAL = "!=";
    public static final String LESS = "<";
    public static final String LESS_EQUAL = "<=";
    public static final String GREATER = ">";
    public static final String GREATER_EQUAL = ">=";
    public static final String AND = "&&";
    public static final String OR = "||";
    public static final String NOT = "!";

    public static final Set<String> BINARY = Set.of(
            PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER,
            EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
            AND, OR);

    public static final Set<String> UNARY = Set.of(MINUS, PLUS, NOT);

    public static final Set<String> ARITHMETIC = Set.of(PLUS, MINUS, MULTIPLY, DIVIDE, MODULO, POWER);

    public static final Set<String> COMPARISON = Set.of(
            EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL);

    public static final Set<String> LOGICAL = Set.of(AND, OR);

    private Operators() {
    }
}
