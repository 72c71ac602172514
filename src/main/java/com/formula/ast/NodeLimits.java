package com.formula.ast;

/**
 * Bounds enforced while building trees.
 *
 * @param maxNumberMagnitude largest absolute value of a numeric literal
 * @param maxDepth           deepest tree accepted
 * @param maxNodes           largest tree accepted
 * @param maxArguments       most arguments in one function call
 * @param maxVariables       most distinct variables in one tree
 */
public record NodeLimits(double maxNumberMagnitude, int maxDepth, int maxNodes, int maxArguments, int maxVariables) {

    public static NodeLimits defaults() {
        return new NodeLimits(1e15, 100, 10_000, 50, 100);
    }
}
