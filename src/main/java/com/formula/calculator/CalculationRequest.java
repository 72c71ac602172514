package com.formula.calculator;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One formula to calculate.
 *
 * @param formula            formula text
 * @param variables          variable bindings, never null
 * @param enableOptimization run the tree optimizer (when the calculator allows it)
 * @param enableValidation   run the structural pre-checks (when the calculator allows it)
 */
public record CalculationRequest(String formula, Map<String, Object> variables,
                                 boolean enableOptimization, boolean enableValidation) {

    public CalculationRequest {
        Objects.requireNonNull(formula, "formula");
        variables = copy(variables);
    }

    public CalculationRequest(String formula) {
        this(formula, Map.of(), true, true);
    }

    public CalculationRequest(String formula, Map<String, ?> variables) {
        this(formula, copy(variables), true, true);
    }

    public CalculationRequest withoutOptimization() {
        return new CalculationRequest(formula, variables, false, enableValidation);
    }

    private static Map<String, Object> copy(Map<String, ?> variables) {
        return variables == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(variables));
    }
}
