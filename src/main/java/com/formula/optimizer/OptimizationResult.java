package com.formula.optimizer;

import com.formula.ast.ASTNode;
import com.formula.evaluator.ExpressionEvaluator;
import com.formula.evaluator.VariableResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optimized tree together with what the optimizer did to it.
 *
 * @param tree             optimized tree
 * @param metrics          rewrite counters of the run
 * @param numericVariables variables that rewrites such as {@code x * 1 -> x} took to be numbers,
 *                         mapped to the operator that consumed them
 */
public record OptimizationResult(ASTNode tree, OptimizationMetrics metrics, Map<String, String> numericVariables) {

    public OptimizationResult {
        numericVariables = numericVariables == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(numericVariables));
    }

    public OptimizationResult(ASTNode tree, OptimizationMetrics metrics) {
        this(tree, metrics, Map.of());
    }

    /**
     * Evaluate the optimized tree so that it fails wherever the original tree would have:
     * variables in {@link #numericVariables()} must be bound to numbers.
     */
    public Object evaluate(ExpressionEvaluator evaluator, VariableResolver variables) {
        evaluator.requireNumbers(numericVariables, variables);
        return evaluator.evaluate(tree, variables);
    }
}
