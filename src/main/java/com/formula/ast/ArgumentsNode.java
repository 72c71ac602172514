package com.formula.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument list under construction. Only appears transiently while reducing
 * {@code ARGS} productions and is folded into a {@link FunctionCallNode}.
 */
public record ArgumentsNode(List<ASTNode> arguments) implements ASTNode {

    public ArgumentsNode {
        arguments = List.copyOf(arguments);
    }

    public ArgumentsNode append(ASTNode argument) {
        List<ASTNode> extended = new ArrayList<>(arguments);
        extended.add(argument);
        return new ArgumentsNode(extended);
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitArguments(this);
    }
}
