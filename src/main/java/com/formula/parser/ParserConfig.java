package com.formula.parser;

/**
 * Runtime bounds of the shift-reduce automaton.
 *
 * @param maxSteps            most actions executed for one parse
 * @param maxStackDepth       deepest state stack allowed
 * @param errorRecovery       skip offending tokens instead of failing
 * @param maxRecoveryAttempts most tokens skipped for one parse
 */
public record ParserConfig(int maxSteps, int maxStackDepth, boolean errorRecovery, int maxRecoveryAttempts) {

    public static ParserConfig defaults() {
        return new ParserConfig(100_000, 1000, false, 3);
    }

    public ParserConfig withErrorRecovery(boolean enabled) {
        return new ParserConfig(maxSteps, maxStackDepth, enabled, maxRecoveryAttempts);
    }
}
