package com.formula.ast;

/**
 * Boolean literal.
 */
public record BooleanNode(boolean value) implements ASTNode {

    public static final BooleanNode TRUE = new BooleanNode(true);
    public static final BooleanNode FALSE = new BooleanNode(false);

    public static BooleanNode of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
