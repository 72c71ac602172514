package com.formula.format;

/**
 * Output notations supported by {@link ExpressionFormatter}.
 */
public enum Notation {
    /** Conventional infix with the fewest parentheses that re-parse to the same tree. */
    INFIX,
    /** Parenthesized prefix, e.g. {@code (+ 3 (* 4 2))}. */
    PREFIX,
    /** Indented multi-line dump, one node per line. */
    TREE
}
