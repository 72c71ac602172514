package com.formula.grammar;

import com.formula.lexer.TokenType;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Grammar production {@code left → right}. Equality ignores the builder.
 *
 * @param id      production number, used for reduce/reduce tie-breaking
 * @param left    non-terminal being defined
 * @param right   right-hand-side symbols, empty for an epsilon production
 * @param builder tree builder invoked on reduce
 */
public record Production(int id, TokenType left, List<TokenType> right, AstBuilder builder) {

    public Production {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(builder, "builder");
        right = List.copyOf(right);
    }

    public int length() {
        return right.size();
    }

    public boolean isEpsilon() {
        return right.isEmpty();
    }

    /**
     * Rightmost terminal of the right-hand side, used for operator precedence.
     */
    public TokenType lastTerminal() {
        for (int i = right.size() - 1; i >= 0; i--) {
            if (right.get(i).isTerminal()) {
                return right.get(i);
            }
        }
        return null;
    }

    /**
     * Same left and right sides, regardless of id.
     */
    public boolean sameShape(Production other) {
        return left == other.left && right.equals(other.right);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Production)) {
            return false;
        }
        Production other = (Production) o;
        return id == other.id && left == other.left && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, left, right);
    }

    @Override
    public String toString() {
        String rhs = right.isEmpty() ? "ε"
                : right.stream().map(TokenType::symbol).collect(Collectors.joining(" "));
        return id + ": " + left.symbol() + " → " + rhs;
    }
}
