package com.formula.optimizer;

import com.formula.ast.ASTNode;
import com.formula.ast.BinaryOpNode;
import com.formula.ast.BooleanNode;
import com.formula.ast.FunctionCallNode;
import com.formula.ast.IfNode;
import com.formula.ast.NodeFactory;
import com.formula.ast.NumberNode;
import com.formula.ast.Operators;
import com.formula.ast.Trees;
import com.formula.ast.UnaryOpNode;
import com.formula.ast.VariableNode;
import com.formula.evaluator.ExpressionEvaluator;
import com.formula.evaluator.FunctionLibrary;
import com.formula.evaluator.VariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Multi-pass tree rewriter.
 * <p>
 * Each pass runs, in order: constant folding, identity and annihilator elimination (including
 * double negation), redundant conditional elimination and sharing of structurally equal subtrees.
 * Passes repeat until one leaves the node count unchanged or the pass limit is hit. Every rewrite
 * removes nodes, so the result is a fixed point: optimizing it again returns an equal tree.
 * Errors met while folding (division by zero, domain errors, literals beyond the magnitude
 * bound) propagate to the caller.
 * <p>
 * Identities only drop operands known to be numeric. A variable counts as numeric when it is
 * evaluated on every path (outside conditional branches and right operands of {@code &&} and
 * {@code ||}); such variables are reported in {@link OptimizationResult#numericVariables()}
 * and checked by {@link OptimizationResult#evaluate}.
 */
public class TreeOptimizer {

    private static final Logger log = LoggerFactory.getLogger(TreeOptimizer.class);

    public static final int DEFAULT_MAX_PASSES = 10;

    private final ExpressionEvaluator evaluator;
    private final NodeFactory factory;
    private final int maxPasses;

    public TreeOptimizer() {
        this(new ExpressionEvaluator(), new NodeFactory(), DEFAULT_MAX_PASSES);
    }

    public TreeOptimizer(ExpressionEvaluator evaluator, int maxPasses) {
        this(evaluator, new NodeFactory(), maxPasses);
    }

    /**
     * @param factory creates folded literals, enforcing its magnitude bound
     */
    public TreeOptimizer(ExpressionEvaluator evaluator, NodeFactory factory, int maxPasses) {
        this.evaluator = evaluator;
        this.factory = factory;
        this.maxPasses = maxPasses;
    }

    /**
     * Optimize a tree.
     *
     * @param root Tree to optimize; left untouched
     * @return the optimized tree, the run's metrics and the variables it took to be numeric
     */
    public OptimizationResult optimize(ASTNode root) {
        Run run = new Run();
        int before = Trees.size(root);
        int size = before;
        ASTNode current = root;
        int passes = 0;

        while (passes < maxPasses) {
            passes++;
            current = run.pass(current);
            int next = Trees.size(current);
            if (next == size) {
                break;
            }
            size = next;
        }

        OptimizationMetrics metrics = new OptimizationMetrics(passes, before, size, run.constantFolds,
                run.identityEliminations, run.conditionalEliminations, run.doubleNegations, run.sharedSubtrees);
        log.debug("Optimized tree from {} to {} nodes in {} pass(es)", before, size, passes);
        return new OptimizationResult(current, metrics, run.numericVariables);
    }

    private static ASTNode rewrite(ASTNode node, UnaryOperator<ASTNode> rule) {
        return rule.apply(Trees.mapChildren(node, child -> rewrite(child, rule)));
    }

    private static boolean isZero(ASTNode node) {
        return node instanceof NumberNode number && number.isZero();
    }

    private static boolean isOne(ASTNode node) {
        return node instanceof NumberNode number && number.isOne();
    }

    private static boolean isBoolean(ASTNode node, boolean value) {
        return node instanceof BooleanNode bool && bool.value() == value;
    }

    /**
     * Mutable counters and rules of one optimize call.
     */
    private final class Run {
        private int constantFolds;
        private int identityEliminations;
        private int conditionalEliminations;
        private int doubleNegations;
        private int sharedSubtrees;
        private final Map<String, String> numericVariables = new LinkedHashMap<>();

        ASTNode pass(ASTNode tree) {
            ASTNode folded = rewrite(tree, this::foldConstants);
            ASTNode simplified = simplify(folded, false);
            ASTNode decided = rewrite(simplified, this::eliminateConditionals);
            return share(decided, new HashMap<>());
        }

        private ASTNode foldConstants(ASTNode node) {
            if (node instanceof BinaryOpNode binary) {
                if (Trees.isLiteral(binary.left()) && Trees.isLiteral(binary.right())) {
                    return fold(node);
                }
                // short-circuit on a literal left operand
                if (Operators.AND.equals(binary.operator()) && isBoolean(binary.left(), false)) {
                    constantFolds++;
                    return BooleanNode.FALSE;
                }
                if (Operators.OR.equals(binary.operator()) && isBoolean(binary.left(), true)) {
                    constantFolds++;
                    return BooleanNode.TRUE;
                }
            } else if (node instanceof UnaryOpNode unary) {
                if (Trees.isLiteral(unary.operand())) {
                    return fold(node);
                }
            } else if (node instanceof FunctionCallNode call) {
                if (call.args().stream().allMatch(Trees::isLiteral) && isFoldable(call)) {
                    return fold(node);
                }
            }
            return node;
        }

        private boolean isFoldable(FunctionCallNode call) {
            FunctionLibrary functions = evaluator.functions();
            return functions.isPure(call.name()) && functions.lookup(call.name(), call.arity()).isPresent();
        }

        private ASTNode fold(ASTNode node) {
            Object value = evaluator.evaluate(node, VariableResolver.empty());
            constantFolds++;
            if (value instanceof Boolean b) {
                return factory.bool(b);
            }
            return factory.number((Double) value);
        }

        /**
         * Bottom-up identity elimination. {@code guarded} marks subtrees that are not evaluated on
         * every path.
         */
        private ASTNode simplify(ASTNode node, boolean guarded) {
            ASTNode rebuilt;
            if (node instanceof IfNode ifNode) {
                ASTNode condition = simplify(ifNode.condition(), guarded);
                ASTNode trueValue = simplify(ifNode.trueValue(), true);
                ASTNode falseValue = simplify(ifNode.falseValue(), true);
                rebuilt = condition == ifNode.condition() && trueValue == ifNode.trueValue()
                        && falseValue == ifNode.falseValue() ? node : new IfNode(condition, trueValue, falseValue);
            } else if (node instanceof BinaryOpNode binary && binary.isLogical()) {
                ASTNode left = simplify(binary.left(), guarded);
                ASTNode right = simplify(binary.right(), true);
                rebuilt = left == binary.left() && right == binary.right()
                        ? node : new BinaryOpNode(left, binary.operator(), right);
            } else {
                rebuilt = Trees.mapChildren(node, child -> simplify(child, guarded));
            }

            if (rebuilt instanceof UnaryOpNode unary) {
                return eliminateUnary(unary, guarded);
            }
            if (rebuilt instanceof BinaryOpNode binary) {
                ASTNode result = eliminateIdentities(binary, guarded);
                if (result != binary) {
                    identityEliminations++;
                }
                return result;
            }
            return rebuilt;
        }

        private ASTNode eliminateIdentities(BinaryOpNode binary, boolean guarded) {
            ASTNode l = binary.left();
            ASTNode r = binary.right();
            String op = binary.operator();

            return switch (op) {
                case Operators.PLUS -> {
                    if (isZero(r) && isNumeric(l, op, guarded)) {
                        yield l;
                    }
                    yield isZero(l) && isNumeric(r, op, guarded) ? r : binary;
                }
                case Operators.MINUS -> {
                    if (isZero(r) && isNumeric(l, op, guarded)) {
                        yield l;
                    }
                    yield l.equals(r) && isRemovable(l, op, guarded) ? NumberNode.ZERO : binary;
                }
                case Operators.MULTIPLY -> {
                    if ((isZero(l) && isRemovable(r, op, guarded)) || (isZero(r) && isRemovable(l, op, guarded))) {
                        yield NumberNode.ZERO;
                    }
                    if (isOne(r) && isNumeric(l, op, guarded)) {
                        yield l;
                    }
                    yield isOne(l) && isNumeric(r, op, guarded) ? r : binary;
                }
                case Operators.DIVIDE -> isOne(r) && isNumeric(l, op, guarded) ? l : binary;
                case Operators.POWER -> {
                    if ((isZero(r) && isRemovable(l, op, guarded)) || (isOne(l) && isRemovable(r, op, guarded))) {
                        yield NumberNode.ONE;
                    }
                    yield isOne(r) && isNumeric(l, op, guarded) ? l : binary;
                }
                case Operators.AND -> {
                    if (isBoolean(l, true) && Trees.isBooleanValued(r)) {
                        yield r;
                    }
                    yield isBoolean(r, true) && Trees.isBooleanValued(l) ? l : binary;
                }
                case Operators.OR -> {
                    if (isBoolean(l, false) && Trees.isBooleanValued(r)) {
                        yield r;
                    }
                    yield isBoolean(r, false) && Trees.isBooleanValued(l) ? l : binary;
                }
                default -> binary;
            };
        }

        private ASTNode eliminateUnary(UnaryOpNode unary, boolean guarded) {
            ASTNode operand = unary.operand();
            return switch (unary.operator()) {
                case Operators.PLUS -> {
                    if (isNumeric(operand, Operators.PLUS, guarded)) {
                        identityEliminations++;
                        yield operand;
                    }
                    yield unary;
                }
                case Operators.MINUS -> {
                    if (operand instanceof UnaryOpNode inner && Operators.MINUS.equals(inner.operator())
                            && isNumeric(inner.operand(), Operators.MINUS, guarded)) {
                        doubleNegations++;
                        yield inner.operand();
                    }
                    yield unary;
                }
                default -> {
                    if (operand instanceof UnaryOpNode inner && Operators.NOT.equals(inner.operator())
                            && Trees.isBooleanValued(inner.operand())) {
                        doubleNegations++;
                        yield inner.operand();
                    }
                    yield unary;
                }
            };
        }

        private ASTNode eliminateConditionals(ASTNode node) {
            if (!(node instanceof IfNode ifNode)) {
                return node;
            }
            ASTNode condition = ifNode.condition();
            if (condition instanceof BooleanNode bool) {
                conditionalEliminations++;
                return bool.value() ? ifNode.trueValue() : ifNode.falseValue();
            }
            if (condition instanceof NumberNode number) {
                conditionalEliminations++;
                return number.isZero() ? ifNode.falseValue() : ifNode.trueValue();
            }
            if (ifNode.trueValue().equals(ifNode.falseValue()) && isPure(condition)) {
                conditionalEliminations++;
                return ifNode.trueValue();
            }
            return node;
        }

        private ASTNode share(ASTNode node, Map<ASTNode, ASTNode> seen) {
            ASTNode rebuilt = Trees.mapChildren(node, child -> share(child, seen));
            ASTNode existing = seen.putIfAbsent(rebuilt, rebuilt);
            if (existing == null) {
                return rebuilt;
            }
            if (existing != rebuilt) {
                sharedSubtrees++;
            }
            return existing;
        }

        /**
         * Whether an operand that an identity keeps is a number. Must be the last check before
         * the rewrite, since a variable it accepts is recorded.
         */
        private boolean isNumeric(ASTNode node, String operator, boolean guarded) {
            if (Trees.isNumericValued(node)) {
                return true;
            }
            if (node instanceof VariableNode variable && !guarded) {
                numericVariables.putIfAbsent(variable.name(), operator);
                return true;
            }
            return false;
        }

        /**
         * Whether an operand that an annihilator drops is a number whose evaluation cannot fail:
         * literals and unguarded variables, possibly negated.
         */
        private boolean isRemovable(ASTNode node, String operator, boolean guarded) {
            if (node instanceof NumberNode) {
                return true;
            }
            if (node instanceof UnaryOpNode unary && !Operators.NOT.equals(unary.operator())) {
                return isRemovable(unary.operand(), unary.operator(), guarded);
            }
            return node instanceof VariableNode && isNumeric(node, operator, guarded);
        }

        private boolean isPure(ASTNode node) {
            FunctionLibrary functions = evaluator.functions();
            for (ASTNode child : Trees.flatten(node)) {
                if (child instanceof FunctionCallNode call && !functions.isPure(call.name())) {
                    return false;
                }
            }
            return true;
        }
    }
}
