package com.formula.grammar;

import com.formula.ast.ASTNode;
import com.formula.ast.NodeFactory;

import java.util.List;

/**
 * Builds the tree node for a reduced production.
 * Children are the popped stack values in right-hand-side order: a {@link com.formula.lexer.Token}
 * for each terminal and an {@link ASTNode} for each non-terminal.
 */
@FunctionalInterface
public interface AstBuilder {

    ASTNode build(List<Object> children, NodeFactory factory);
}
