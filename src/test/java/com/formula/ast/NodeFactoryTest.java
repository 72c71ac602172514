package com.formula.ast;

import com.formula.exception.EvaluationException;
import com.formula.exception.ResourceLimitException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NodeFactory and node invariants.
 */
class NodeFactoryTest {

    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        factory = new NodeFactory(new NodeLimits(1000, 3, 7, 2, 2));
    }

    @Test
    @DisplayName("Should reject division and modulo by a literal zero")
    void shouldRejectLiteralZeroDivisor() {
        EvaluationException division = assertThrows(EvaluationException.class,
                () -> new BinaryOpNode(new VariableNode("x"), "/", NumberNode.ZERO));
        assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, division.getKind());

        EvaluationException modulo = assertThrows(EvaluationException.class,
                () -> new BinaryOpNode(new VariableNode("x"), "%", new NumberNode(-0.0)));
        assertEquals(EvaluationException.Kind.MODULO_BY_ZERO, modulo.getKind());

        assertDoesNotThrow(() -> new BinaryOpNode(NumberNode.ZERO, "/", new VariableNode("x")));
    }

    @Test
    @DisplayName("Should reject unknown operators and non-finite literals")
    void shouldRejectMalformedNodes() {
        assertThrows(IllegalArgumentException.class, () -> new BinaryOpNode(NumberNode.ONE, "=", NumberNode.ONE));
        assertThrows(IllegalArgumentException.class, () -> new UnaryOpNode("*", NumberNode.ONE));
        assertThrows(IllegalArgumentException.class, () -> new NumberNode(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new VariableNode(" "));
        assertThrows(IllegalArgumentException.class, () -> new FunctionCallNode("", List.of()));
    }

    @Test
    @DisplayName("Should treat negative and positive zero as the same literal")
    void shouldNormalizeNegativeZero() {
        assertEquals(NumberNode.ZERO, new NumberNode(-0.0));
    }

    @Test
    @DisplayName("Should enforce the literal magnitude bound")
    void shouldEnforceMagnitude() {
        assertEquals(new NumberNode(-1000), factory.number(-1000));

        ResourceLimitException e = assertThrows(ResourceLimitException.class, () -> factory.number(1000.5));
        assertEquals("numberMagnitude", e.getLimit());
    }

    @Test
    @DisplayName("Should enforce the argument count bound")
    void shouldEnforceArgumentCount() {
        List<ASTNode> three = Collections.nCopies(3, NumberNode.ONE);

        assertEquals("functionArguments",
                assertThrows(ResourceLimitException.class, () -> factory.functionCall("MAX", three)).getLimit());
        assertThrows(ResourceLimitException.class, () -> factory.arguments(three));
    }

    @Test
    @DisplayName("Should enforce the depth bound while building")
    void shouldEnforceDepth() {
        ASTNode depthTwo = factory.unary("-", NumberNode.ONE);
        ASTNode depthThree = factory.unary("-", depthTwo);

        ResourceLimitException e = assertThrows(ResourceLimitException.class, () -> factory.unary("-", depthThree));
        assertEquals("treeDepth", e.getLimit());
        assertEquals(4, e.getActual());
    }

    @Test
    @DisplayName("Should check size and variable count of a finished tree")
    void shouldValidateTree() {
        ASTNode wide = new BinaryOpNode(
                new BinaryOpNode(NumberNode.ONE, "+", NumberNode.ONE), "+",
                new BinaryOpNode(NumberNode.ONE, "+", new BinaryOpNode(NumberNode.ONE, "+", NumberNode.ONE)));
        assertEquals("treeSize", assertThrows(ResourceLimitException.class, () -> factory.validateTree(wide)).getLimit());

        ASTNode threeVariables = new FunctionCallNode("MAX",
                List.of(new VariableNode("a"), new VariableNode("b"), new VariableNode("c")));
        assertEquals("treeVariables",
                assertThrows(ResourceLimitException.class, () -> factory.validateTree(threeVariables)).getLimit());

        ASTNode repeated = new BinaryOpNode(new VariableNode("a"), "*", new VariableNode("a"));
        assertSame(repeated, factory.validateTree(repeated));
    }
}
