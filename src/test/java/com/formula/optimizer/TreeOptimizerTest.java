package com.formula.optimizer;

import com.formula.ast.ASTNode;
import com.formula.ast.BinaryOpNode;
import com.formula.ast.BooleanNode;
import com.formula.ast.FunctionCallNode;
import com.formula.ast.NodeFactory;
import com.formula.ast.NodeLimits;
import com.formula.ast.NumberNode;
import com.formula.ast.UnaryOpNode;
import com.formula.ast.VariableNode;
import com.formula.evaluator.ExpressionEvaluator;
import com.formula.evaluator.VariableResolver;
import com.formula.exception.EvaluationException;
import com.formula.exception.ResourceLimitException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static com.formula.Formulas.parse;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TreeOptimizer.
 */
class TreeOptimizerTest {

    private static final VariableNode X = new VariableNode("x");

    private TreeOptimizer optimizer;

    @BeforeEach
    void setUp() {
        optimizer = new TreeOptimizer();
    }

    private ASTNode optimize(String formula) {
        return optimizer.optimize(parse(formula)).tree();
    }

    // ==================== Constant folding ====================

    @Test
    @DisplayName("Should fold a constant expression to one literal")
    void shouldFoldConstants() {
        OptimizationResult result = optimizer.optimize(parse("2 + 3 * 4"));

        assertEquals(new NumberNode(14), result.tree());
        OptimizationMetrics metrics = result.metrics();
        assertEquals(5, metrics.nodesBefore());
        assertEquals(1, metrics.nodesAfter());
        assertEquals(4, metrics.nodesRemoved());
        assertEquals(2, metrics.constantFolds());
        assertEquals(2, metrics.passes());
    }

    @Test
    @DisplayName("Should fold pure functions and comparisons of literals")
    void shouldFoldFunctionsAndComparisons() {
        assertEquals(new BinaryOpNode(new NumberNode(4), "+", X), optimize("SQRT(16) + x"));
        assertEquals(BooleanNode.TRUE, optimize("MAX(1, 2) > 1 && !false"));
    }

    @Test
    @DisplayName("Should never fold impure functions")
    void shouldKeepRandom() {
        ASTNode tree = optimize("RANDOM() * 0");

        assertEquals(new BinaryOpNode(new FunctionCallNode("RANDOM", List.of()), "*", NumberNode.ZERO), tree);
    }

    @Test
    @DisplayName("Should short-circuit on a literal left operand")
    void shouldFoldShortCircuit() {
        assertEquals(BooleanNode.FALSE, optimize("false && x"));
        assertEquals(BooleanNode.TRUE, optimize("true || x"));
    }

    @Test
    @DisplayName("Should propagate errors found while folding")
    void shouldPropagateFoldingErrors() {
        EvaluationException domain = assertThrows(EvaluationException.class, () -> optimize("SQRT(0 - 1)"));
        assertEquals(EvaluationException.Kind.DOMAIN_ERROR, domain.getKind());

        EvaluationException division = assertThrows(EvaluationException.class, () -> optimize("x / (1 - 1)"));
        assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, division.getKind());
    }

    @Test
    @DisplayName("Should bound folded literals like parsed ones")
    void shouldBoundFoldedLiterals() {
        ResourceLimitException e = assertThrows(ResourceLimitException.class, () -> optimize("1e15 * 1e15"));
        assertEquals("numberMagnitude", e.getLimit());

        TreeOptimizer wide = new TreeOptimizer(new ExpressionEvaluator(),
                new NodeFactory(new NodeLimits(1e31, 100, 10_000, 50, 100)), TreeOptimizer.DEFAULT_MAX_PASSES);
        assertEquals(new NumberNode(1e30), wide.optimize(parse("1e15 * 1e15")).tree());
    }

    // ==================== Identities ====================

    @ParameterizedTest
    @DisplayName("Should reduce arithmetic identities to the variable")
    @ValueSource(strings = {"x * 1", "1 * x", "x + 0", "0 + x", "x - 0", "x / 1", "x ^ 1", "(x)"})
    void shouldEliminateIdentities(String formula) {
        assertEquals(optimize("x"), optimize(formula));
    }

    @ParameterizedTest
    @DisplayName("Should apply annihilators")
    @CsvSource(delimiter = ';', value = {
            "x - x; 0",
            "0 * x; 0",
            "x * 0; 0",
            "-x * 0; 0",
            "x ^ 0; 1",
            "1 ^ x; 1",
            "(x - 0) * (3 - 3); 0"
    })
    void shouldApplyAnnihilators(String formula, double expected) {
        assertEquals(new NumberNode(expected), optimize(formula));
    }

    @Test
    @DisplayName("Should drop neutral boolean operands only next to boolean-valued operands")
    void shouldEliminateBooleanIdentities() {
        ASTNode comparison = new BinaryOpNode(X, ">", NumberNode.ONE);

        assertEquals(comparison, optimize("true && x > 1"));
        assertEquals(comparison, optimize("x > 1 || false"));
        assertEquals(new BinaryOpNode(BooleanNode.TRUE, "&&", X), optimize("true && x"));
    }

    @Test
    @DisplayName("Should remove double negation")
    void shouldRemoveDoubleNegation() {
        OptimizationResult result = optimizer.optimize(parse("--x"));

        assertEquals(X, result.tree());
        assertEquals(1, result.metrics().doubleNegations());
        assertEquals(new BinaryOpNode(X, "<", NumberNode.ONE), optimize("!!(x < 1)"));
        // !!x turns a number into a boolean, so it stays
        assertEquals(new UnaryOpNode("!", new UnaryOpNode("!", X)), optimize("!!x"));
    }

    @Test
    @DisplayName("Should remove unary plus around numeric operands")
    void shouldRemoveUnaryPlus() {
        assertEquals(X, optimizer.optimize(new UnaryOpNode("+", X)).tree());
    }

    // ==================== Conditionals ====================

    @Test
    @DisplayName("Should pick the branch of a constant condition")
    void shouldDecideConstantConditionals() {
        assertEquals(new VariableNode("a"), optimize("IF(true, a, b)"));
        assertEquals(new VariableNode("b"), optimize("IF(0, a, b)"));
        assertEquals(new VariableNode("a"), optimize("IF(2 > 1, a, b)"));
    }

    @Test
    @DisplayName("Should collapse a conditional with equal branches")
    void shouldCollapseEqualBranches() {
        OptimizationResult result = optimizer.optimize(parse("IF(x > 1, 2 + 3, 5)"));

        assertEquals(new NumberNode(5), result.tree());
        assertEquals(1, result.metrics().conditionalEliminations());
    }

    // ==================== Sharing and fixed point ====================

    @Test
    @DisplayName("Should share structurally equal subtrees")
    void shouldShareEqualSubtrees() {
        OptimizationResult result = optimizer.optimize(parse("(x + 1) * (x + 1)"));
        BinaryOpNode product = (BinaryOpNode) result.tree();

        assertSame(product.left(), product.right());
        assertTrue(result.metrics().sharedSubtrees() > 0);
        assertEquals(result.metrics().nodesBefore(), result.metrics().nodesAfter());
    }

    @ParameterizedTest
    @DisplayName("Should preserve the value of the formula")
    @ValueSource(strings = {
            "x * 1 + 0 * y",
            "(x + y) * (x + y) - x ^ 1",
            "IF(x > y, x - 0, y / 1) + SQRT(16)",
            "--x + -(-y)",
            "!!(x < y) || false",
            "MAX(x, y, 2 + 3) % 4",
            "IF(true && x >= 3, 10, 20) + 1 ^ y",
            "x - x + y * 1"
    })
    void shouldPreserveSemantics(String formula) {
        VariableResolver variables = VariableResolver.of(Map.of("x", 3, "y", 4));
        ExpressionEvaluator evaluator = new ExpressionEvaluator();
        ASTNode original = parse(formula);

        assertEquals(evaluator.evaluate(original, variables),
                optimizer.optimize(original).evaluate(evaluator, variables));
    }

    @ParameterizedTest
    @DisplayName("Should fail like the original tree when a variable is bound to a boolean")
    @ValueSource(strings = {"x * 1", "1 * x", "x + 0", "x - 0", "x / 1", "x ^ 1", "x * 0", "0 * -x",
            "x - x", "x ^ 0", "1 ^ x", "--x", "x * 1 + y"})
    void shouldPreserveTypeErrors(String formula) {
        VariableResolver variables = VariableResolver.of(Map.of("x", true, "y", 4));
        ExpressionEvaluator evaluator = new ExpressionEvaluator();
        ASTNode original = parse(formula);
        OptimizationResult optimized = optimizer.optimize(original);

        EvaluationException expected = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(original, variables));
        EvaluationException actual = assertThrows(EvaluationException.class,
                () -> optimized.evaluate(evaluator, variables));
        assertEquals(EvaluationException.Kind.TYPE_MISMATCH, actual.getKind());
        assertEquals(expected.getMessage(), actual.getMessage());
    }

    @Test
    @DisplayName("Should record the variables it took to be numbers")
    void shouldRecordNumericVariables() {
        OptimizationResult result = optimizer.optimize(parse("x * 1 + (y - y) + z"));

        assertEquals(new BinaryOpNode(X, "+", new VariableNode("z")), result.tree());
        assertEquals(Map.of("x", "*", "y", "-"), result.numericVariables());
        assertTrue(optimizer.optimize(parse("x + z")).numericVariables().isEmpty());
    }

    @Test
    @DisplayName("Should not assume variables that only some paths evaluate are numbers")
    void shouldLeaveGuardedVariables() {
        ASTNode guarded = parse("IF(c, x * 1, 0)");
        assertEquals(guarded, optimize("IF(c, x * 1, 0)"));
        assertEquals(parse("c && x * 0 > 1"), optimize("c && x * 0 > 1"));

        // unbound x on the untaken branch stays harmless
        VariableResolver variables = VariableResolver.of(Map.of("c", false));
        assertEquals(0.0, optimizer.optimize(guarded).evaluate(new ExpressionEvaluator(), variables));
    }

    @Test
    @DisplayName("Should keep operands that might not be numbers or might fail")
    void shouldKeepUncertainOperands() {
        assertEquals(parse("IF(c, true, 1) * 1"), optimize("IF(c, true, 1) * 1"));
        assertEquals(parse("(1 / x) * 0"), optimize("(1 / x) * 0"));
        assertEquals(parse("0 / x"), optimize("0 / x"));

        EvaluationException division = assertThrows(EvaluationException.class,
                () -> optimizer.optimize(parse("(1 / x) * 0")).evaluate(new ExpressionEvaluator(),
                        VariableResolver.of(Map.of("x", 0))));
        assertEquals(EvaluationException.Kind.DIVISION_BY_ZERO, division.getKind());
    }

    @ParameterizedTest
    @DisplayName("Should reach a fixed point")
    @ValueSource(strings = {
            "x * 1 + 0 * y",
            "IF(x > 1, --y, --y)",
            "(x + 1) * (x + 1) + (x + 1)",
            "1 + 2 + x + 3 + 4"
    })
    void shouldBeIdempotent(String formula) {
        ASTNode once = optimize(formula);

        assertEquals(once, optimizer.optimize(once).tree());
    }

    @Test
    @DisplayName("Should stop at the pass limit")
    void shouldHonorPassLimit() {
        TreeOptimizer single = new TreeOptimizer(new ExpressionEvaluator(), 1);

        OptimizationResult result = single.optimize(parse("IF(x > 1, --y, --y)"));

        assertEquals(1, result.metrics().passes());
        assertEquals(new UnaryOpNode("-", new UnaryOpNode("-", new VariableNode("y"))), result.tree());
    }

    @Test
    @DisplayName("Should leave the input tree untouched")
    void shouldNotMutateInput() {
        ASTNode original = parse("x * 1 + 2 * 3");
        ASTNode copy = parse("x * 1 + 2 * 3");

        optimizer.optimize(original);

        assertEquals(copy, original);
    }
}
