package com.formula.format;

import com.formula.ast.ArgumentsNode;
import com.formula.ast.NumberNode;
import com.formula.ast.VariableNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.formula.Formulas.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionFormatter.
 */
class ExpressionFormatterTest {

    private ExpressionFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ExpressionFormatter();
    }

    @ParameterizedTest
    @DisplayName("Should print infix with only the parentheses precedence needs")
    @CsvSource(delimiter = ';', value = {
            "3+4*2; 3 + 4 * 2",
            "(3 + 4) * 2; (3 + 4) * 2",
            "((a - b) - c); a - b - c",
            "a - (b - c); a - (b - c)",
            "a / (b * c); a / (b * c)",
            "2 ^ (3 ^ 2); 2 ^ 3 ^ 2",
            "(2 ^ 3) ^ 2; (2 ^ 3) ^ 2",
            "-(a + b); -(a + b)",
            "-x ^ 2; -x ^ 2",
            "!(a && b) || c; !(a && b) || c",
            "a || b && c; a || b && c",
            "(a || b) && c; (a || b) && c",
            "x + 1 > y mod 2; x + 1 > y % 2",
            "IF(x>=5,MAX(1,2.5),PI()); IF(x >= 5, MAX(1, 2.5), PI())",
            "{score} * TRUE; score * true"
    })
    void shouldFormatInfix(String input, String expected) {
        assertEquals(expected, formatter.format(parse(input)));
    }

    @Test
    @DisplayName("Should brace variable names that would not lex as identifiers")
    void shouldBraceSpecialNames() {
        assertEquals("{if} + {1st}", formatter.format(parse("{if} + {1st}")));
        assertEquals("{and}", formatter.format(new VariableNode("and")));
    }

    @ParameterizedTest
    @DisplayName("Should parse its own output back to the same tree")
    @ValueSource(strings = {
            "a - (b - c) - d",
            "2 ^ 3 ^ 2 * -(x % 3)",
            "IF(a < b && !(c == d), SUM(1, 2, x), -y) / 2",
            "(a || b) && (c != d) || e >= f",
            "--x + {if} * COUNT()",
            "1.5e-3 + 2.25 - 123456"
    })
    void shouldRoundTrip(String formula) {
        assertEquals(parse(formula), parse(formatter.format(parse(formula))));
    }

    @Test
    @DisplayName("Should print prefix notation")
    void shouldFormatPrefix() {
        assertEquals("(+ 3 (* 4 2))", formatter.format(parse("3 + 4 * 2"), Notation.PREFIX));
        assertEquals("(if (> x 1) (MAX x 2) (- y))",
                formatter.format(parse("IF(x > 1, MAX(x, 2), -y)"), Notation.PREFIX));
        assertEquals("(PI)", formatter.format(parse("PI()"), Notation.PREFIX));
        assertEquals("(args 1 x)",
                formatter.format(new ArgumentsNode(List.of(NumberNode.ONE, new VariableNode("x"))), Notation.PREFIX));
    }

    @Test
    @DisplayName("Should print an indented tree")
    void shouldFormatTree() {
        String expected = "BinaryOp(+)\n"
                + "  Number(3)\n"
                + "  FunctionCall(MAX/2)\n"
                + "    Variable(x)\n"
                + "    UnaryOp(!)\n"
                + "      Boolean(true)\n";

        assertEquals(expected, formatter.format(parse("3 + MAX(x, !true)"), Notation.TREE));
        assertEquals("If\n  Variable(c)\n  Number(1)\n  Number(2.5)\n",
                formatter.format(parse("IF(c, 1, 2.5)"), Notation.TREE));
    }

    @ParameterizedTest
    @DisplayName("Should print integral numbers without a fraction")
    @CsvSource({
            "14, 14",
            "-3, -3",
            "2.5, 2.5",
            "0.1, 0.1",
            "1e15, 1.0E15",
            "123456789012, 123456789012"
    })
    void shouldFormatNumbers(double value, String expected) {
        assertEquals(expected, ExpressionFormatter.formatNumber(value));
    }
}
