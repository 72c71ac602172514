package com.formula.evaluator;

import java.util.Optional;

/**
 * Lookup of numeric functions by name and arity.
 */
public interface FunctionLibrary {

    /**
     * Find a function accepting the given number of arguments.
     *
     * @param name  Function name, matched case-insensitively
     * @param arity Number of arguments at the call site
     * @return the function, or empty if none is registered for that name and arity
     */
    Optional<MathFunction> lookup(String name, int arity);

    /**
     * Whether any function of that name exists, regardless of arity.
     */
    boolean isDefined(String name);

    /**
     * Whether the function always returns the same result for the same arguments.
     */
    default boolean isPure(String name) {
        return true;
    }
}
