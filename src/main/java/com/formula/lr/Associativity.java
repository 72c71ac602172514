package com.formula.lr;

/**
 * Operator associativity.
 */
public enum Associativity {
    LEFT,
    RIGHT,
    NONE
}
