package com.formula.exception;

/**
 * Exception thrown when a configured bound is exceeded.
 */
public class ResourceLimitException extends FormulaException {

    private final String limit;
    private final long maximum;
    private final long actual;

    public ResourceLimitException(String limit, long maximum, long actual) {
        super("Limit '" + limit + "' exceeded: " + actual + " > " + maximum);
        this.limit = limit;
        this.maximum = maximum;
        this.actual = actual;
    }

    public String getLimit() {
        return limit;
    }

    public long getMaximum() {
        return maximum;
    }

    public long getActual() {
        return actual;
    }
}
