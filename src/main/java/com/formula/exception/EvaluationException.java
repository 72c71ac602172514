package com.formula.exception;

/**
 * Exception thrown when an expression cannot be evaluated.
 */
public class EvaluationException extends FormulaException {

    public enum Kind {
        UNBOUND_VARIABLE,
        DIVISION_BY_ZERO,
        MODULO_BY_ZERO,
        DOMAIN_ERROR,
        TYPE_MISMATCH,
        UNKNOWN_FUNCTION,
        ARGUMENT_COUNT,
        INVALID_NODE
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvaluationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static EvaluationException unboundVariable(String name) {
        return new EvaluationException(Kind.UNBOUND_VARIABLE, "Unbound variable '" + name + "'");
    }

    public static EvaluationException divisionByZero() {
        return new EvaluationException(Kind.DIVISION_BY_ZERO, "Division by zero");
    }

    public static EvaluationException moduloByZero() {
        return new EvaluationException(Kind.MODULO_BY_ZERO, "Modulo by zero");
    }

    public static EvaluationException domain(String function, double value) {
        return new EvaluationException(Kind.DOMAIN_ERROR,
                "Argument " + value + " is outside the domain of " + function);
    }

    public static EvaluationException typeMismatch(String operator, Object value) {
        return new EvaluationException(Kind.TYPE_MISMATCH,
                "Operator '" + operator + "' cannot be applied to " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    public Kind getKind() {
        return kind;
    }
}
