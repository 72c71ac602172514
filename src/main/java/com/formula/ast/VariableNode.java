package com.formula.ast;

import java.util.Objects;

/**
 * Reference to a variable bound at evaluation time.
 */
public record VariableNode(String name) implements ASTNode {

    public VariableNode {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
