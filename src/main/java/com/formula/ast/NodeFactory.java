package com.formula.ast;

import com.formula.exception.ResourceLimitException;

import java.util.List;

/**
 * Creates tree nodes while enforcing {@link NodeLimits}.
 */
public class NodeFactory {

    private final NodeLimits limits;

    public NodeFactory() {
        this(NodeLimits.defaults());
    }

    public NodeFactory(NodeLimits limits) {
        this.limits = limits;
    }

    public NodeLimits limits() {
        return limits;
    }

    public NumberNode number(double value) {
        if (Math.abs(value) > limits.maxNumberMagnitude()) {
            throw new ResourceLimitException("numberMagnitude", (long) limits.maxNumberMagnitude(), (long) Math.abs(value));
        }
        return new NumberNode(value);
    }

    public BooleanNode bool(boolean value) {
        return BooleanNode.of(value);
    }

    public VariableNode variable(String name) {
        return new VariableNode(name);
    }

    public BinaryOpNode binary(ASTNode left, String operator, ASTNode right) {
        return checkDepth(new BinaryOpNode(left, operator, right));
    }

    public UnaryOpNode unary(String operator, ASTNode operand) {
        return checkDepth(new UnaryOpNode(operator, operand));
    }

    public FunctionCallNode functionCall(String name, List<ASTNode> args) {
        if (args.size() > limits.maxArguments()) {
            throw new ResourceLimitException("functionArguments", limits.maxArguments(), args.size());
        }
        return checkDepth(new FunctionCallNode(name, args));
    }

    public IfNode conditional(ASTNode condition, ASTNode trueValue, ASTNode falseValue) {
        return checkDepth(new IfNode(condition, trueValue, falseValue));
    }

    public ArgumentsNode arguments(List<ASTNode> arguments) {
        if (arguments.size() > limits.maxArguments()) {
            throw new ResourceLimitException("functionArguments", limits.maxArguments(), arguments.size());
        }
        return new ArgumentsNode(arguments);
    }

    /**
     * Checks the size and variable-count bounds of a finished tree.
     */
    public ASTNode validateTree(ASTNode root) {
        int size = Trees.size(root);
        if (size > limits.maxNodes()) {
            throw new ResourceLimitException("treeSize", limits.maxNodes(), size);
        }
        int variables = Trees.variables(root).size();
        if (variables > limits.maxVariables()) {
            throw new ResourceLimitException("treeVariables", limits.maxVariables(), variables);
        }
        return root;
    }

    private <T extends ASTNode> T checkDepth(T node) {
        int depth = Trees.depth(node);
        if (depth > limits.maxDepth()) {
            throw new ResourceLimitException("treeDepth", limits.maxDepth(), depth);
        }
        return node;
    }
}
