package com.formula.format;

import com.formula.ast.ASTNode;
import com.formula.ast.ArgumentsNode;
import com.formula.ast.BinaryOpNode;
import com.formula.ast.BooleanNode;
import com.formula.ast.FunctionCallNode;
import com.formula.ast.IfNode;
import com.formula.ast.NumberNode;
import com.formula.ast.Operators;
import com.formula.ast.Trees;
import com.formula.ast.UnaryOpNode;
import com.formula.ast.VariableNode;
import com.formula.lexer.LexerConfig;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders syntax trees as text. Stateless and thread-safe.
 * <p>
 * Infix output follows the precedence of the default grammar, where all comparison
 * operators share one level and prefix operators bind tighter than {@code ^}.
 */
public class ExpressionFormatter {

    private static final int PRIMARY = 100;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry(Operators.OR, 1),
            Map.entry(Operators.AND, 2),
            Map.entry(Operators.EQUAL, 3),
            Map.entry(Operators.NOT_EQUAL, 3),
            Map.entry(Operators.LESS, 3),
            Map.entry(Operators.LESS_EQUAL, 3),
            Map.entry(Operators.GREATER, 3),
            Map.entry(Operators.GREATER_EQUAL, 3),
            Map.entry(Operators.PLUS, 4),
            Map.entry(Operators.MINUS, 4),
            Map.entry(Operators.MULTIPLY, 5),
            Map.entry(Operators.DIVIDE, 5),
            Map.entry(Operators.MODULO, 5),
            Map.entry(Operators.POWER, 6)
    );

    public String format(ASTNode node) {
        return format(node, Notation.INFIX);
    }

    public String format(ASTNode node, Notation notation) {
        return switch (notation) {
            case PREFIX -> prefix(node);
            case TREE -> {
                StringBuilder out = new StringBuilder();
                tree(node, 0, out);
                yield out.toString();
            }
            default -> infix(node);
        };
    }

    /**
     * Number text without a fractional part when the value is integral.
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    // ---- infix ----

    private String infix(ASTNode node) {
        if (node instanceof NumberNode number) {
            return formatNumber(number.value());
        }
        if (node instanceof BooleanNode bool) {
            return Boolean.toString(bool.value());
        }
        if (node instanceof VariableNode variable) {
            return variableName(variable.name());
        }
        if (node instanceof BinaryOpNode binary) {
            int precedence = precedence(binary);
            boolean rightAssociative = Operators.POWER.equals(binary.operator());
            String left = operand(binary.left(), precedence, rightAssociative);
            String right = operand(binary.right(), precedence, !rightAssociative);
            return left + " " + binary.operator() + " " + right;
        }
        if (node instanceof UnaryOpNode unary) {
            String operand = infix(unary.operand());
            return unary.operator() + (precedence(unary.operand()) == PRIMARY ? operand : "(" + operand + ")");
        }
        if (node instanceof FunctionCallNode call) {
            return call.name() + "(" + join(call.args(), ", ") + ")";
        }
        if (node instanceof IfNode ifNode) {
            return "IF(" + infix(ifNode.condition()) + ", " + infix(ifNode.trueValue()) + ", "
                    + infix(ifNode.falseValue()) + ")";
        }
        return join(((ArgumentsNode) node).arguments(), ", ");
    }

    /**
     * Operand of a binary operator; {@code strict} is set on the side where equal precedence
     * would re-associate differently.
     */
    private String operand(ASTNode child, int parentPrecedence, boolean strict) {
        int childPrecedence = precedence(child);
        String text = infix(child);
        if (childPrecedence < parentPrecedence || (strict && childPrecedence == parentPrecedence)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static int precedence(ASTNode node) {
        if (node instanceof BinaryOpNode binary) {
            return BINARY_PRECEDENCE.get(binary.operator());
        }
        return PRIMARY;
    }

    private static String variableName(String name) {
        boolean plain = Character.isLetter(name.charAt(0)) || name.charAt(0) == '_';
        for (int i = 1; i < name.length() && plain; i++) {
            char c = name.charAt(i);
            plain = Character.isLetterOrDigit(c) || c == '_';
        }
        if (!plain || LexerConfig.KEYWORDS.containsKey(name.toUpperCase(Locale.ROOT))) {
            return "{" + name + "}";
        }
        return name;
    }

    private String join(List<ASTNode> nodes, String separator) {
        return nodes.stream().map(this::infix).collect(Collectors.joining(separator));
    }

    // ---- prefix ----

    private String prefix(ASTNode node) {
        if (node instanceof NumberNode || node instanceof BooleanNode || node instanceof VariableNode) {
            return infix(node);
        }
        if (node instanceof BinaryOpNode binary) {
            return "(" + binary.operator() + " " + prefix(binary.left()) + " " + prefix(binary.right()) + ")";
        }
        if (node instanceof UnaryOpNode unary) {
            return "(" + unary.operator() + " " + prefix(unary.operand()) + ")";
        }
        if (node instanceof FunctionCallNode call) {
            return call.args().isEmpty()
                    ? "(" + call.name() + ")"
                    : "(" + call.name() + " " + prefixAll(call.args()) + ")";
        }
        if (node instanceof IfNode ifNode) {
            return "(if " + prefix(ifNode.condition()) + " " + prefix(ifNode.trueValue()) + " "
                    + prefix(ifNode.falseValue()) + ")";
        }
        return "(args " + prefixAll(((ArgumentsNode) node).arguments()) + ")";
    }

    private String prefixAll(List<ASTNode> nodes) {
        return nodes.stream().map(this::prefix).collect(Collectors.joining(" "));
    }

    // ---- tree ----

    private void tree(ASTNode node, int indent, StringBuilder out) {
        out.append("  ".repeat(indent)).append(label(node)).append('\n');
        for (ASTNode child : Trees.children(node)) {
            tree(child, indent + 1, out);
        }
    }

    private static String label(ASTNode node) {
        if (node instanceof NumberNode number) {
            return "Number(" + formatNumber(number.value()) + ")";
        }
        if (node instanceof BooleanNode bool) {
            return "Boolean(" + bool.value() + ")";
        }
        if (node instanceof VariableNode variable) {
            return "Variable(" + variable.name() + ")";
        }
        if (node instanceof BinaryOpNode binary) {
            return "BinaryOp(" + binary.operator() + ")";
        }
        if (node instanceof UnaryOpNode unary) {
            return "UnaryOp(" + unary.operator() + ")";
        }
        if (node instanceof FunctionCallNode call) {
            return "FunctionCall(" + call.name() + "/" + call.arity() + ")";
        }
        if (node instanceof IfNode) {
            return "If";
        }
        return "Arguments";
    }
}
