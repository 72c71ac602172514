package com.formula.ast;

/**
 * Visitor over every node kind.
 *
 * @param <R> result type
 */
public interface ASTVisitor<R> {

    R visitNumber(NumberNode node);

    R visitBoolean(BooleanNode node);

    R visitVariable(VariableNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitFunctionCall(FunctionCallNode node);

    R visitIf(IfNode node);

    R visitArguments(ArgumentsNode node);
}
