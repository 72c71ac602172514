package com.formula.grammar;

import com.formula.ast.ASTNode;
import com.formula.ast.ArgumentsNode;
import com.formula.ast.NodeFactory;
import com.formula.ast.Operators;
import com.formula.lexer.Token;

import java.util.List;

import static com.formula.lexer.TokenType.*;

/**
 * The built-in formula grammar.
 * <p>
 * Precedence is encoded in the layering (lowest first):
 * <pre>
 * EXPR       := EXPR '||' AND_EXPR | AND_EXPR
 * AND_EXPR   := AND_EXPR '&amp;&amp;' COMP_EXPR | COMP_EXPR
 * COMP_EXPR  := COMP_EXPR ('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') ARITH_EXPR | ARITH_EXPR
 * ARITH_EXPR := ARITH_EXPR ('+' | '-') TERM | TERM
 * TERM       := TERM ('*' | '/' | '%') FACTOR | FACTOR
 * FACTOR     := PRIMARY '^' FACTOR | PRIMARY
 * PRIMARY    := '(' EXPR ')' | '-' PRIMARY | '!' PRIMARY
 *             | NUMBER | VARIABLE | IDENTIFIER | TRUE | FALSE
 *             | IDENTIFIER '(' ARGS ')' | IDENTIFIER '(' ')'
 *             | IF '(' EXPR ',' EXPR ',' EXPR ')'
 * ARGS       := EXPR | ARGS ',' EXPR
 * </pre>
 * There is no prefix plus, so an operator directly following a binary {@code +} is a syntax error.
 */
public final class ExpressionGrammar {

    private static final Grammar INSTANCE = create();

    private ExpressionGrammar() {
    }

    /**
     * Shared instance; parsing tables are cached by grammar identity, so callers should prefer it.
     */
    public static Grammar get() {
        return INSTANCE;
    }

    /**
     * Build a fresh copy of the grammar.
     */
    public static Grammar create() {
        return Grammar.builder()
                .name("formula")
                .terminals(NUMBER, IDENTIFIER, VARIABLE, TRUE, FALSE, IF,
                        PLUS, MINUS, MULTIPLY, DIVIDE, POWER, MODULO,
                        EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
                        AND, OR, NOT, LEFT_PAREN, RIGHT_PAREN, COMMA, DOLLAR)
                .nonTerminals(EXPR, AND_EXPR, COMP_EXPR, ARITH_EXPR, TERM, FACTOR, PRIMARY, ARGS)
                .start(EXPR)
                // Logical
                .production(0, EXPR, List.of(EXPR, OR, AND_EXPR), binary(Operators.OR))
                .production(1, EXPR, List.of(AND_EXPR), ExpressionGrammar::identity)
                .production(2, AND_EXPR, List.of(AND_EXPR, AND, COMP_EXPR), binary(Operators.AND))
                .production(3, AND_EXPR, List.of(COMP_EXPR), ExpressionGrammar::identity)
                // Comparison
                .production(4, COMP_EXPR, List.of(COMP_EXPR, EQUAL, ARITH_EXPR), binary(Operators.EQUAL))
                .production(5, COMP_EXPR, List.of(COMP_EXPR, NOT_EQUAL, ARITH_EXPR), binary(Operators.NOT_EQUAL))
                .production(6, COMP_EXPR, List.of(COMP_EXPR, LESS, ARITH_EXPR), binary(Operators.LESS))
                .production(7, COMP_EXPR, List.of(COMP_EXPR, LESS_EQUAL, ARITH_EXPR), binary(Operators.LESS_EQUAL))
                .production(8, COMP_EXPR, List.of(COMP_EXPR, GREATER, ARITH_EXPR), binary(Operators.GREATER))
                .production(9, COMP_EXPR, List.of(COMP_EXPR, GREATER_EQUAL, ARITH_EXPR), binary(Operators.GREATER_EQUAL))
                .production(10, COMP_EXPR, List.of(ARITH_EXPR), ExpressionGrammar::identity)
                // Arithmetic
                .production(11, ARITH_EXPR, List.of(ARITH_EXPR, PLUS, TERM), binary(Operators.PLUS))
                .production(12, ARITH_EXPR, List.of(ARITH_EXPR, MINUS, TERM), binary(Operators.MINUS))
                .production(13, ARITH_EXPR, List.of(TERM), ExpressionGrammar::identity)
                .production(14, TERM, List.of(TERM, MULTIPLY, FACTOR), binary(Operators.MULTIPLY))
                .production(15, TERM, List.of(TERM, DIVIDE, FACTOR), binary(Operators.DIVIDE))
                .production(16, TERM, List.of(TERM, MODULO, FACTOR), binary(Operators.MODULO))
                .production(17, TERM, List.of(FACTOR), ExpressionGrammar::identity)
                .production(18, FACTOR, List.of(PRIMARY, POWER, FACTOR), binary(Operators.POWER))
                .production(19, FACTOR, List.of(PRIMARY), ExpressionGrammar::identity)
                // Primary
                .production(20, PRIMARY, List.of(LEFT_PAREN, EXPR, RIGHT_PAREN), (children, factory) -> node(children, 1))
                .production(21, PRIMARY, List.of(MINUS, PRIMARY), unary(Operators.MINUS))
                .production(22, PRIMARY, List.of(NOT, PRIMARY), unary(Operators.NOT))
                .production(23, PRIMARY, List.of(NUMBER),
                        (children, factory) -> factory.number(Double.parseDouble(token(children, 0).text())))
                .production(24, PRIMARY, List.of(VARIABLE),
                        (children, factory) -> factory.variable(token(children, 0).text()))
                .production(25, PRIMARY, List.of(IDENTIFIER),
                        (children, factory) -> factory.variable(token(children, 0).text()))
                .production(26, PRIMARY, List.of(TRUE), (children, factory) -> factory.bool(true))
                .production(27, PRIMARY, List.of(FALSE), (children, factory) -> factory.bool(false))
                .production(28, PRIMARY, List.of(IDENTIFIER, LEFT_PAREN, ARGS, RIGHT_PAREN),
                        (children, factory) -> factory.functionCall(token(children, 0).text(),
                                ((ArgumentsNode) node(children, 2)).arguments()))
                .production(29, PRIMARY, List.of(IDENTIFIER, LEFT_PAREN, RIGHT_PAREN),
                        (children, factory) -> factory.functionCall(token(children, 0).text(), List.of()))
                .production(30, PRIMARY, List.of(IF, LEFT_PAREN, EXPR, COMMA, EXPR, COMMA, EXPR, RIGHT_PAREN),
                        (children, factory) -> factory.conditional(node(children, 2), node(children, 4), node(children, 6)))
                // Arguments
                .production(31, ARGS, List.of(EXPR),
                        (children, factory) -> factory.arguments(List.of(node(children, 0))))
                .production(32, ARGS, List.of(ARGS, COMMA, EXPR),
                        (children, factory) -> factory.arguments(
                                ((ArgumentsNode) node(children, 0)).append(node(children, 2)).arguments()))
                .build();
    }

    private static AstBuilder binary(String operator) {
        return (children, factory) -> factory.binary(node(children, 0), operator, node(children, 2));
    }

    private static AstBuilder unary(String operator) {
        return (children, factory) -> factory.unary(operator, node(children, 1));
    }

    private static ASTNode identity(List<Object> children, NodeFactory factory) {
        return node(children, 0);
    }

    private static ASTNode node(List<Object> children, int index) {
        return (ASTNode) children.get(index);
    }

    private static Token token(List<Object> children, int index) {
        return (Token) children.get(index);
    }
}
