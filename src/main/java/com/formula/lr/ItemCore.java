package com.formula.lr;

/**
 * Item without its lookahead.
 */
public record ItemCore(int productionId, int dot) implements Comparable<ItemCore> {

    @Override
    public int compareTo(ItemCore other) {
        int byProduction = Integer.compare(productionId, other.productionId);
        return byProduction != 0 ? byProduction : Integer.compare(dot, other.dot);
    }

    @Override
    public String toString() {
        return productionId + ":" + dot;
    }
}
