package com.formula.lr;

import com.formula.grammar.Production;
import com.formula.lexer.TokenType;

import java.util.List;

/**
 * LR(1) item: a production, a dot position and one lookahead terminal.
 */
public record LRItem(Production production, int dot, TokenType lookahead) {

    public LRItem {
        if (dot < 0 || dot > production.length()) {
            throw new IllegalArgumentException("Dot " + dot + " outside production " + production);
        }
    }

    public boolean isComplete() {
        return dot == production.length();
    }

    /**
     * @return symbol right after the dot, or null for a complete item
     */
    public TokenType nextSymbol() {
        return isComplete() ? null : production.right().get(dot);
    }

    /**
     * Symbols after the one following the dot.
     */
    public List<TokenType> remainderAfterNext() {
        List<TokenType> right = production.right();
        return dot + 1 >= right.size() ? List.of() : right.subList(dot + 1, right.size());
    }

    public LRItem advance() {
        return new LRItem(production, dot + 1, lookahead);
    }

    public ItemCore core() {
        return new ItemCore(production.id(), dot);
    }

    public boolean isKernel() {
        return dot > 0 || production.left() == TokenType.START;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[").append(production.left().symbol()).append(" →");
        List<TokenType> right = production.right();
        for (int i = 0; i < right.size(); i++) {
            sb.append(i == dot ? " •" : "").append(' ').append(right.get(i).symbol());
        }
        if (isComplete()) {
            sb.append(" •");
        }
        return sb.append(", ").append(lookahead.symbol()).append(']').toString();
    }
}
