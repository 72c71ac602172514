package com.formula.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Structural queries over syntax trees.
 */
public final class Trees {

    private Trees() {
    }

    /**
     * Direct children of a node, left to right.
     */
    public static List<ASTNode> children(ASTNode node) {
        if (node instanceof BinaryOpNode binary) {
            return List.of(binary.left(), binary.right());
        }
        if (node instanceof UnaryOpNode unary) {
            return List.of(unary.operand());
        }
        if (node instanceof FunctionCallNode call) {
            return call.args();
        }
        if (node instanceof IfNode ifNode) {
            return List.of(ifNode.condition(), ifNode.trueValue(), ifNode.falseValue());
        }
        if (node instanceof ArgumentsNode arguments) {
            return arguments.arguments();
        }
        return List.of();
    }

    /**
     * Rebuild a node with every direct child replaced by {@code mapper(child)}.
     * Returns the node itself when no child changed.
     */
    public static ASTNode mapChildren(ASTNode node, UnaryOperator<ASTNode> mapper) {
        if (node instanceof BinaryOpNode binary) {
            ASTNode left = mapper.apply(binary.left());
            ASTNode right = mapper.apply(binary.right());
            return left == binary.left() && right == binary.right()
                    ? node : new BinaryOpNode(left, binary.operator(), right);
        }
        if (node instanceof UnaryOpNode unary) {
            ASTNode operand = mapper.apply(unary.operand());
            return operand == unary.operand() ? node : new UnaryOpNode(unary.operator(), operand);
        }
        if (node instanceof FunctionCallNode call) {
            List<ASTNode> args = mapAll(call.args(), mapper);
            return args == call.args() ? node : new FunctionCallNode(call.name(), args);
        }
        if (node instanceof IfNode ifNode) {
            ASTNode condition = mapper.apply(ifNode.condition());
            ASTNode trueValue = mapper.apply(ifNode.trueValue());
            ASTNode falseValue = mapper.apply(ifNode.falseValue());
            return condition == ifNode.condition() && trueValue == ifNode.trueValue() && falseValue == ifNode.falseValue()
                    ? node : new IfNode(condition, trueValue, falseValue);
        }
        if (node instanceof ArgumentsNode arguments) {
            List<ASTNode> mapped = mapAll(arguments.arguments(), mapper);
            return mapped == arguments.arguments() ? node : new ArgumentsNode(mapped);
        }
        return node;
    }

    private static List<ASTNode> mapAll(List<ASTNode> nodes, UnaryOperator<ASTNode> mapper) {
        List<ASTNode> mapped = new ArrayList<>(nodes.size());
        boolean changed = false;
        for (ASTNode node : nodes) {
            ASTNode result = mapper.apply(node);
            changed |= result != node;
            mapped.add(result);
        }
        return changed ? mapped : nodes;
    }

    /**
     * Number of nodes in the tree.
     */
    public static int size(ASTNode node) {
        int size = 1;
        for (ASTNode child : children(node)) {
            size += size(child);
        }
        return size;
    }

    /**
     * Depth of the tree; a leaf has depth 1.
     */
    public static int depth(ASTNode node) {
        int deepest = 0;
        for (ASTNode child : children(node)) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    /**
     * Names of all referenced variables in first-occurrence order.
     */
    public static Set<String> variables(ASTNode node) {
        Set<String> names = new LinkedHashSet<>();
        collectVariables(node, names);
        return names;
    }

    private static void collectVariables(ASTNode node, Set<String> names) {
        if (node instanceof VariableNode variable) {
            names.add(variable.name());
            return;
        }
        for (ASTNode child : children(node)) {
            collectVariables(child, names);
        }
    }

    public static boolean isLiteral(ASTNode node) {
        return node instanceof NumberNode || node instanceof BooleanNode;
    }

    /**
     * Whether the node always evaluates to a boolean.
     */
    public static boolean isBooleanValued(ASTNode node) {
        if (node instanceof BooleanNode) {
            return true;
        }
        if (node instanceof BinaryOpNode binary) {
            return binary.isComparison() || binary.isLogical();
        }
        if (node instanceof UnaryOpNode unary) {
            return Operators.NOT.equals(unary.operator());
        }
        if (node instanceof IfNode ifNode) {
            return isBooleanValued(ifNode.trueValue()) && isBooleanValued(ifNode.falseValue());
        }
        return false;
    }

    /**
     * True for nodes that evaluate to a number or fail: numeric literals, arithmetic, unary
     * minus and plus, function calls, and conditionals whose branches are both numeric.
     * Variables are not numeric here since they may be bound to booleans.
     */
    public static boolean isNumericValued(ASTNode node) {
        if (node instanceof NumberNode || node instanceof FunctionCallNode) {
            return true;
        }
        if (node instanceof BinaryOpNode binary) {
            return binary.isArithmetic();
        }
        if (node instanceof UnaryOpNode unary) {
            return !Operators.NOT.equals(unary.operator());
        }
        if (node instanceof IfNode ifNode) {
            return isNumericValued(ifNode.trueValue()) && isNumericValued(ifNode.falseValue());
        }
        return false;
    }

    /**
     * Pre-order list of all nodes.
     */
    public static List<ASTNode> flatten(ASTNode node) {
        List<ASTNode> nodes = new ArrayList<>();
        flattenInto(node, nodes);
        return nodes;
    }

    private static void flattenInto(ASTNode node, List<ASTNode> nodes) {
        nodes.add(node);
        for (ASTNode child : children(node)) {
            flattenInto(child, nodes);
        }
    }
}
