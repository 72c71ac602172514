package com.formula.ast;

/**
 * Node of a formula syntax tree. Nodes are immutable values compared structurally;
 * rewrites always produce new nodes.
 */
public sealed interface ASTNode
        permits NumberNode, BooleanNode, VariableNode, BinaryOpNode, UnaryOpNode,
                FunctionCallNode, IfNode, ArgumentsNode {

    <R> R accept(ASTVisitor<R> visitor);
}
