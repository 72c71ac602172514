package com.formula.lr;

import com.formula.grammar.Production;
import com.formula.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Precedence levels (higher binds tighter) and associativity of operator terminals.
 */
public final class OperatorPrecedence {

    public static final int OR = 1;
    public static final int AND = 2;
    public static final int EQUALITY = 3;
    public static final int RELATIONAL = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;
    public static final int UNARY = 7;
    public static final int POWER = 8;

    /**
     * Precedence and associativity of one operator.
     */
    public record Level(int precedence, Associativity associativity) {
    }

    private static final Map<TokenType, Level> LEVELS = new EnumMap<>(TokenType.class);

    static {
        LEVELS.put(TokenType.OR, new Level(OR, Associativity.LEFT));
        LEVELS.put(TokenType.AND, new Level(AND, Associativity.LEFT));
        LEVELS.put(TokenType.EQUAL, new Level(EQUALITY, Associativity.LEFT));
        LEVELS.put(TokenType.NOT_EQUAL, new Level(EQUALITY, Associativity.LEFT));
        LEVELS.put(TokenType.LESS, new Level(RELATIONAL, Associativity.LEFT));
        LEVELS.put(TokenType.LESS_EQUAL, new Level(RELATIONAL, Associativity.LEFT));
        LEVELS.put(TokenType.GREATER, new Level(RELATIONAL, Associativity.LEFT));
        LEVELS.put(TokenType.GREATER_EQUAL, new Level(RELATIONAL, Associativity.LEFT));
        LEVELS.put(TokenType.PLUS, new Level(ADDITIVE, Associativity.LEFT));
        LEVELS.put(TokenType.MINUS, new Level(ADDITIVE, Associativity.LEFT));
        LEVELS.put(TokenType.MULTIPLY, new Level(MULTIPLICATIVE, Associativity.LEFT));
        LEVELS.put(TokenType.DIVIDE, new Level(MULTIPLICATIVE, Associativity.LEFT));
        LEVELS.put(TokenType.MODULO, new Level(MULTIPLICATIVE, Associativity.LEFT));
        LEVELS.put(TokenType.NOT, new Level(UNARY, Associativity.RIGHT));
        LEVELS.put(TokenType.POWER, new Level(POWER, Associativity.RIGHT));
    }

    private static final Level PREFIX = new Level(UNARY, Associativity.RIGHT);

    private OperatorPrecedence() {
    }

    /**
     * @return level of a lookahead terminal, or null when it is not an operator
     */
    public static Level of(TokenType terminal) {
        return LEVELS.get(terminal);
    }

    /**
     * Level of a production: prefix productions ({@code op X}) bind as unary operators,
     * anything else takes the level of its rightmost terminal.
     *
     * @return the level, or null when the production has no operator
     */
    public static Level of(Production production) {
        if (production.length() == 2
                && production.right().get(0).isOperator()
                && production.right().get(1).isNonTerminal()) {
            return PREFIX;
        }
        TokenType last = production.lastTerminal();
        return last == null ? null : LEVELS.get(last);
    }
}
