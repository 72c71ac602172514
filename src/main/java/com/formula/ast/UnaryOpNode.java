package com.formula.ast;

import java.util.Objects;

/**
 * Prefix operation: negation, unary plus or logical not.
 */
public record UnaryOpNode(String operator, ASTNode operand) implements ASTNode {

    public UnaryOpNode {
        Objects.requireNonNull(operand, "operand");
        if (!Operators.UNARY.contains(operator)) {
            throw new IllegalArgumentException("Unsupported unary operator: " + operator);
        }
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }
}
