package com.formula.ast;

import com.formula.exception.EvaluationException;

import java.util.Objects;

/**
 * Binary operation. A division or modulo whose right operand is the literal zero is rejected here,
 * before evaluation.
 */
public record BinaryOpNode(ASTNode left, String operator, ASTNode right) implements ASTNode {

    public BinaryOpNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!Operators.BINARY.contains(operator)) {
            throw new IllegalArgumentException("Unsupported binary operator: " + operator);
        }
        if (right instanceof NumberNode number && number.isZero()) {
            if (Operators.DIVIDE.equals(operator)) {
                throw EvaluationException.divisionByZero();
            }
            if (Operators.MODULO.equals(operator)) {
                throw EvaluationException.moduloByZero();
            }
        }
    }

    public boolean isArithmetic() {
        return Operators.ARITHMETIC.contains(operator);
    }

    public boolean isComparison() {
        return Operators.COMPARISON.contains(operator);
    }

    public boolean isLogical() {
        return Operators.LOGICAL.contains(operator);
    }

    @Override
    public <R> R accept(ASTVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }
}
