package com.formula.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call of a library function.
 */
public record FunctionCallNode(String name, List<ASTNode> args) implements ASTNode {

    public FunctionCallNode {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        args = List.copyOf(args);
    }

    public int arity() {
        return args.size();
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
