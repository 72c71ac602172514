package com.formula.parser;

import com.formula.ast.ASTNode;
import com.formula.ast.BinaryOpNode;
import com.formula.ast.BooleanNode;
import com.formula.ast.FunctionCallNode;
import com.formula.ast.IfNode;
import com.formula.ast.NodeFactory;
import com.formula.ast.NumberNode;
import com.formula.ast.UnaryOpNode;
import com.formula.ast.VariableNode;
import com.formula.exception.ResourceLimitException;
import com.formula.exception.SyntaxException;
import com.formula.grammar.ExpressionGrammar;
import com.formula.lexer.Lexer;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;
import com.formula.lr.ParsingTable;
import com.formula.lr.ParsingTableCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LRParser.
 */
class LRParserTest {

    private static final ParsingTable TABLE = new ParsingTableCache().get(ExpressionGrammar.get());

    private LRParser parser;

    @BeforeEach
    void setUp() {
        parser = new LRParser(TABLE);
    }

    private ASTNode parse(String formula) {
        return parser.parse(new Lexer(formula).tokenize()).ast();
    }

    private static NumberNode num(double value) {
        return new NumberNode(value);
    }

    // ==================== Structure ====================

    @Test
    @DisplayName("Should give multiplication precedence over addition")
    void shouldRespectPrecedence() {
        assertEquals(new BinaryOpNode(num(3), "+", new BinaryOpNode(num(4), "*", num(2))), parse("3 + 4 * 2"));
    }

    @Test
    @DisplayName("Should associate subtraction left and power right")
    void shouldRespectAssociativity() {
        assertEquals(new BinaryOpNode(new BinaryOpNode(num(10), "-", num(4)), "-", num(3)), parse("10 - 4 - 3"));
        assertEquals(new BinaryOpNode(num(2), "^", new BinaryOpNode(num(3), "^", num(2))), parse("2 ^ 3 ^ 2"));
    }

    @Test
    @DisplayName("Should bind negation to the primary before power")
    void shouldBindNegationToPrimary() {
        assertEquals(new BinaryOpNode(new UnaryOpNode("-", num(2)), "^", num(2)), parse("-2 ^ 2"));
        assertEquals(new UnaryOpNode("-", new UnaryOpNode("-", new VariableNode("x"))), parse("--x"));
    }

    @Test
    @DisplayName("Should layer logical and comparison operators")
    void shouldLayerLogicalOperators() {
        ASTNode expected = new BinaryOpNode(
                new BinaryOpNode(new VariableNode("a"), "&&", new BinaryOpNode(new VariableNode("b"), ">", num(1))),
                "||",
                new UnaryOpNode("!", new VariableNode("c")));

        assertEquals(expected, parse("a && b > 1 || !c"));
        assertEquals(expected, parse("a AND b > 1 OR NOT c"));
    }

    @Test
    @DisplayName("Should build function calls with zero or more arguments")
    void shouldParseFunctionCalls() {
        assertEquals(new FunctionCallNode("PI", List.of()), parse("PI()"));
        assertEquals(new FunctionCallNode("MAX", List.of(num(1), new VariableNode("x"), num(3))), parse("MAX(1, x, 3)"));
        assertEquals(new FunctionCallNode("ABS", List.of(new FunctionCallNode("MIN", List.of(num(1), num(2))))),
                parse("ABS(MIN(1, 2))"));
    }

    @Test
    @DisplayName("Should build conditionals and boolean literals")
    void shouldParseConditionals() {
        ASTNode expected = new IfNode(
                new BinaryOpNode(new VariableNode("score"), ">=", num(90)),
                BooleanNode.TRUE,
                BooleanNode.FALSE);

        assertEquals(expected, parse("IF({score} >= 90, true, false)"));
    }

    @Test
    @DisplayName("Should count shifts, reduces and steps")
    void shouldCollectStatistics() {
        ParseResult result = parser.parse(new Lexer("1 + 2").tokenize());

        assertEquals(3, result.shifts());
        assertEquals(result.steps(), result.shifts() + result.reduces() + 1);
        assertFalse(result.recovered());
        assertTrue(result.durationNanos() >= 0);
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Should report the offending token and what was expected")
    void shouldDescribeSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("3 + + 4"));

        assertEquals("+", e.getActual());
        assertEquals(4, e.getPosition());
        Set<String> expected = e.getExpected();
        assertTrue(expected.containsAll(List.of("NUMBER", "IDENTIFIER", "VARIABLE", "true", "false", "if", "(", "-", "!")));
        assertFalse(expected.contains("+"));
    }

    @Test
    @DisplayName("Should fail at end of input for an unfinished formula")
    void shouldFailAtEndOfInput() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("(1 + 2"));

        assertEquals("$", e.getActual());
        assertEquals(6, e.getPosition());
        assertTrue(e.getExpected().contains(")"));
    }

    @Test
    @DisplayName("Should require the end-of-input token")
    void shouldRequireEndOfInput() {
        List<Token> tokens = List.of(new Token(TokenType.NUMBER, "1", 0));

        assertThrows(SyntaxException.class, () -> parser.parse(tokens));
        assertThrows(SyntaxException.class, () -> parser.parse(List.of()));
    }

    // ==================== Recovery and limits ====================

    @Test
    @DisplayName("Should skip unexpected tokens when recovery is enabled")
    void shouldRecoverBySkipping() {
        LRParser recovering = new LRParser(TABLE, new NodeFactory(), ParserConfig.defaults().withErrorRecovery(true));

        ParseResult result = recovering.parse(new Lexer("3 + + 4").tokenize());

        assertEquals(new BinaryOpNode(num(3), "+", num(4)), result.ast());
        assertTrue(result.recovered());
        assertEquals(List.of("Skipped unexpected '+' at position 4"), result.warnings());
    }

    @Test
    @DisplayName("Should give up after the recovery budget is spent")
    void shouldStopRecoveringAfterBudget() {
        LRParser recovering = new LRParser(TABLE, new NodeFactory(), new ParserConfig(100_000, 1000, true, 2));

        assertThrows(SyntaxException.class, () -> recovering.parse(new Lexer("1 + + + + 2").tokenize()));
    }

    @Test
    @DisplayName("Should never skip the end-of-input token")
    void shouldNotRecoverAtEnd() {
        LRParser recovering = new LRParser(TABLE, new NodeFactory(), ParserConfig.defaults().withErrorRecovery(true));

        assertThrows(SyntaxException.class, () -> recovering.parse(new Lexer("1 +").tokenize()));
    }

    @Test
    @DisplayName("Should enforce the step bound")
    void shouldEnforceStepLimit() {
        LRParser bounded = new LRParser(TABLE, new NodeFactory(), new ParserConfig(5, 1000, false, 0));

        ResourceLimitException e = assertThrows(ResourceLimitException.class,
                () -> bounded.parse(new Lexer("1 + 2").tokenize()));
        assertEquals("parseSteps", e.getLimit());
    }

    @Test
    @DisplayName("Should enforce the stack depth bound")
    void shouldEnforceStackDepth() {
        LRParser shallow = new LRParser(TABLE, new NodeFactory(), new ParserConfig(100_000, 3, false, 0));

        ResourceLimitException e = assertThrows(ResourceLimitException.class,
                () -> shallow.parse(new Lexer("((((1))))").tokenize()));
        assertEquals("parseStackDepth", e.getLimit());
        assertEquals(BinaryOpNode.class, shallow.parse(new Lexer("1 + 2").tokenize()).ast().getClass());
    }

    @Test
    @DisplayName("Should serve concurrent parses from one instance")
    void shouldParseConcurrently() throws InterruptedException {
        List<String> formulas = List.of("1 + 2 * 3", "IF(a > b, a, b)", "MAX(1, 2, 3) ^ 2", "!(x == y)");
        Thread[] threads = new Thread[formulas.size()];
        ASTNode[] results = new ASTNode[formulas.size()];
        for (int i = 0; i < threads.length; i++) {
            int index = i;
            threads[i] = new Thread(() -> {
                for (int round = 0; round < 50; round++) {
                    results[index] = parse(formulas.get(index));
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        for (int i = 0; i < formulas.size(); i++) {
            assertEquals(parse(formulas.get(i)), results[i]);
        }
    }
}
