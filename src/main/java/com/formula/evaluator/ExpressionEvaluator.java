package com.formula.evaluator;

import com.formula.ast.ASTNode;
import com.formula.ast.ASTVisitor;
import com.formula.ast.ArgumentsNode;
import com.formula.ast.BinaryOpNode;
import com.formula.ast.BooleanNode;
import com.formula.ast.FunctionCallNode;
import com.formula.ast.IfNode;
import com.formula.ast.NumberNode;
import com.formula.ast.Operators;
import com.formula.ast.UnaryOpNode;
import com.formula.ast.VariableNode;
import com.formula.exception.EvaluationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tree-walking interpreter.
 * <p>
 * Values are {@link Double} or {@link Boolean}. Logical operators short-circuit and accept
 * numbers as truth values (non-zero is true). Stateless apart from the function library,
 * so one instance can serve concurrent evaluations.
 */
public class ExpressionEvaluator {

    /** Tolerance for numeric equality. */
    public static final double EPSILON = 1e-10;

    private final FunctionLibrary functions;

    public ExpressionEvaluator() {
        this(MathFunctions.standard());
    }

    public ExpressionEvaluator(FunctionLibrary functions) {
        this.functions = functions;
    }

    public FunctionLibrary functions() {
        return functions;
    }

    /**
     * Evaluate a tree.
     *
     * @param node      Root of the tree
     * @param variables Variable bindings
     * @return a Double or a Boolean
     * @throws EvaluationException on unbound variables, arithmetic or domain errors and type mismatches
     */
    public Object evaluate(ASTNode node, VariableResolver variables) {
        return node.accept(new Walker(variables));
    }

    /**
     * Resolve variables and require each to be a number, failing the way the operator that
     * consumed it would have.
     *
     * @param operatorsByVariable variable name to the operator applied to it
     * @param variables           Variable bindings
     * @throws EvaluationException on unbound variables and non-numeric bindings
     */
    public void requireNumbers(Map<String, String> operatorsByVariable, VariableResolver variables) {
        Walker walker = new Walker(variables);
        operatorsByVariable.forEach((name, operator) ->
                asNumber(operator, walker.visitVariable(new VariableNode(name))));
    }

    public double evaluateNumber(ASTNode node, VariableResolver variables) {
        return asNumber("result", evaluate(node, variables));
    }

    public boolean evaluateBoolean(ASTNode node, VariableResolver variables) {
        return isTruthy("result", evaluate(node, variables));
    }

    /**
     * Truth value of an evaluated result.
     */
    public static boolean isTruthy(String context, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Double d) {
            return d != 0.0;
        }
        throw EvaluationException.typeMismatch(context, value);
    }

    private static double asNumber(String context, Object value) {
        if (value instanceof Double d) {
            return d;
        }
        throw EvaluationException.typeMismatch(context, value);
    }

    private static double checkFinite(String operation, double value) {
        if (!Double.isFinite(value)) {
            throw new EvaluationException(EvaluationException.Kind.DOMAIN_ERROR,
                    "Result of " + operation + " is not a finite number");
        }
        return value;
    }

    private class Walker implements ASTVisitor<Object> {

        private final VariableResolver variables;

        Walker(VariableResolver variables) {
            this.variables = variables;
        }

        @Override
        public Object visitNumber(NumberNode node) {
            return node.value();
        }

        @Override
        public Object visitBoolean(BooleanNode node) {
            return node.value();
        }

        @Override
        public Object visitVariable(VariableNode node) {
            Optional<Object> raw = variables.resolve(node.name());
            if (raw.isEmpty()) {
                throw EvaluationException.unboundVariable(node.name());
            }
            return variables.resolveValue(node.name())
                    .orElseThrow(() -> new EvaluationException(EvaluationException.Kind.TYPE_MISMATCH,
                            "Variable '" + node.name() + "' is neither a number nor a boolean: " + raw.get()));
        }

        @Override
        public Object visitBinaryOp(BinaryOpNode node) {
            String op = node.operator();

            if (Operators.AND.equals(op)) {
                return isTruthy(op, node.left().accept(this)) && isTruthy(op, node.right().accept(this));
            }
            if (Operators.OR.equals(op)) {
                return isTruthy(op, node.left().accept(this)) || isTruthy(op, node.right().accept(this));
            }

            Object left = node.left().accept(this);
            Object right = node.right().accept(this);

            if (Operators.EQUAL.equals(op)) {
                return valuesEqual(left, right);
            }
            if (Operators.NOT_EQUAL.equals(op)) {
                return !valuesEqual(left, right);
            }

            double l = asNumber(op, left);
            double r = asNumber(op, right);
            return switch (op) {
                case Operators.PLUS -> checkFinite(op, l + r);
                case Operators.MINUS -> checkFinite(op, l - r);
                case Operators.MULTIPLY -> checkFinite(op, l * r);
                case Operators.DIVIDE -> {
                    if (r == 0.0) {
                        throw EvaluationException.divisionByZero();
                    }
                    yield checkFinite(op, l / r);
                }
                case Operators.MODULO -> {
                    if (r == 0.0) {
                        throw EvaluationException.moduloByZero();
                    }
                    yield l % r;
                }
                case Operators.POWER -> checkFinite(op, MathFunctions.power(l, r));
                case Operators.LESS -> l < r;
                case Operators.LESS_EQUAL -> l <= r;
                case Operators.GREATER -> l > r;
                case Operators.GREATER_EQUAL -> l >= r;
                default -> throw new EvaluationException(EvaluationException.Kind.INVALID_NODE, "Unknown operator " + op);
            };
        }

        private boolean valuesEqual(Object left, Object right) {
            if (left instanceof Double l && right instanceof Double r) {
                return Math.abs(l - r) < EPSILON;
            }
            return left.equals(right);
        }

        @Override
        public Object visitUnaryOp(UnaryOpNode node) {
            Object operand = node.operand().accept(this);
            return switch (node.operator()) {
                case Operators.MINUS -> -asNumber("-", operand);
                case Operators.PLUS -> asNumber("+", operand);
                default -> operand instanceof Double d ? d == 0.0 : !isTruthy("!", operand);
            };
        }

        @Override
        public Object visitFunctionCall(FunctionCallNode node) {
            MathFunction function = functions.lookup(node.name(), node.arity())
                    .orElseThrow(() -> functions.isDefined(node.name())
                            ? new EvaluationException(EvaluationException.Kind.ARGUMENT_COUNT,
                                    "Function " + node.name() + " does not accept " + node.arity() + " argument(s)")
                            : new EvaluationException(EvaluationException.Kind.UNKNOWN_FUNCTION,
                                    "Unknown function " + node.name()));

            List<ASTNode> args = node.args();
            double[] values = new double[args.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = asNumber(node.name() + " argument " + (i + 1), args.get(i).accept(this));
            }
            return checkFinite(node.name(), function.apply(values));
        }

        @Override
        public Object visitIf(IfNode node) {
            boolean condition = isTruthy("IF condition", node.condition().accept(this));
            return condition ? node.trueValue().accept(this) : node.falseValue().accept(this);
        }

        @Override
        public Object visitArguments(ArgumentsNode node) {
            throw new EvaluationException(EvaluationException.Kind.INVALID_NODE,
                    "An argument list cannot be evaluated on its own");
        }
    }
}
