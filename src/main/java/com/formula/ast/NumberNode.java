package com.formula.ast;

/**
 * Numeric literal.
 *
 * @param value finite value
 */
public record NumberNode(double value) implements ASTNode {

    public static final NumberNode ZERO = new NumberNode(0.0);
    public static final NumberNode ONE = new NumberNode(1.0);

    public NumberNode {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Number literal must be finite: " + value);
        }
        // normalize -0.0 so structural equality treats both zeros alike
        if (value == 0.0) {
            value = 0.0;
        }
    }

    public boolean isZero() {
        return value == 0.0;
    }

    public boolean isOne() {
        return value == 1.0;
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
