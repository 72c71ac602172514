package com.formula.ast;

import java.util.Objects;

/**
 * Conditional expression {@code IF(condition, trueValue, falseValue)}.
 */
public record IfNode(ASTNode condition, ASTNode trueValue, ASTNode falseValue) implements ASTNode {

    public IfNode {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(trueValue, "trueValue");
        Objects.requireNonNull(falseValue, "falseValue");
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
