package com.formula.evaluator;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves variable references while a tree is evaluated.
 */
public interface VariableResolver {

    /**
     * Resolve a variable.
     *
     * @param name Variable name as written in the formula
     * @return Resolved value, or empty if not bound
     */
    Optional<Object> resolve(String name);

    /**
     * Resolve a variable as a number or boolean, the two value kinds of the evaluator.
     * Numbers of any type and numeric strings become {@link Double}.
     *
     * @param name Variable name
     * @return Converted value, or empty if not bound or not convertible
     */
    default Optional<Object> resolveValue(String name) {
        return resolve(name).flatMap(DefaultVariableResolver::convert);
    }

    static VariableResolver of(Map<String, ?> bindings) {
        return new DefaultVariableResolver(bindings);
    }

    static VariableResolver empty() {
        return name -> Optional.empty();
    }
}
