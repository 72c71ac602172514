package com.formula.optimizer;

/**
 * Counters of one optimizer run.
 *
 * @param passes                   passes executed
 * @param nodesBefore              tree size before optimizing
 * @param nodesAfter               tree size after optimizing
 * @param constantFolds            subtrees replaced by their value
 * @param identityEliminations     algebraic identities and annihilators applied
 * @param conditionalEliminations  conditionals replaced by one branch
 * @param doubleNegations          double negations and double logical nots removed
 * @param sharedSubtrees           subtrees replaced by an equal, already seen subtree
 */
public record OptimizationMetrics(int passes, int nodesBefore, int nodesAfter, int constantFolds,
                                  int identityEliminations, int conditionalEliminations,
                                  int doubleNegations, int sharedSubtrees) {

    public int nodesRemoved() {
        return nodesBefore - nodesAfter;
    }

    public int totalRewrites() {
        return constantFolds + identityEliminations + conditionalEliminations + doubleNegations;
    }
}
