package com.formula.evaluator;

/**
 * Numeric function implementation.
 */
@FunctionalInterface
public interface MathFunction {

    /**
     * @throws com.formula.exception.EvaluationException on a domain error
     */
    double apply(double[] args);
}
