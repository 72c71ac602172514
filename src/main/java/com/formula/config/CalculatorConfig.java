package com.formula.config;

import com.formula.ast.NodeLimits;
import com.formula.exception.ConfigurationException;
import com.formula.lr.TableOptions;
import com.formula.parser.ParserConfig;

/**
 * Calculator configuration.
 *
 * @param maxFormulaLength  longest formula accepted, in characters
 * @param maxVariables      most variable bindings per request
 * @param maxMultiSteps     most formulas in one multi-step calculation
 * @param optimization      run the tree optimizer unless a request says otherwise
 * @param validation        run the structural pre-checks unless a request says otherwise
 * @param optimizerPasses   pass limit of the tree optimizer
 * @param cacheEnabled      keep a result cache
 * @param cacheCapacity     entries kept before the oldest is evicted
 * @param table             parsing table construction options
 * @param parser            shift-reduce automaton bounds
 * @param limits            tree size bounds
 */
public record CalculatorConfig(
        int maxFormulaLength,
        int maxVariables,
        int maxMultiSteps,
        boolean optimization,
        boolean validation,
        int optimizerPasses,
        boolean cacheEnabled,
        int cacheCapacity,
        TableOptions table,
        ParserConfig parser,
        NodeLimits limits
) {

    public static final int DEFAULT_MAX_FORMULA_LENGTH = 5000;
    public static final int DEFAULT_MAX_VARIABLES = 100;
    public static final int DEFAULT_MAX_MULTI_STEPS = 50;
    public static final int DEFAULT_OPTIMIZER_PASSES = 10;
    public static final int DEFAULT_CACHE_CAPACITY = 1000;

    public CalculatorConfig {
        requirePositive("max-formula-length", maxFormulaLength);
        requirePositive("max-variables", maxVariables);
        requirePositive("max-multi-steps", maxMultiSteps);
        requirePositive("optimizer-passes", optimizerPasses);
        requirePositive("cache.capacity", cacheCapacity);
        if (table == null) {
            table = TableOptions.defaults();
        }
        if (parser == null) {
            parser = ParserConfig.defaults();
        }
        if (limits == null) {
            limits = NodeLimits.defaults();
        }
    }

    public static CalculatorConfig defaults() {
        return new CalculatorConfig(
                DEFAULT_MAX_FORMULA_LENGTH,
                DEFAULT_MAX_VARIABLES,
                DEFAULT_MAX_MULTI_STEPS,
                true,
                true,
                DEFAULT_OPTIMIZER_PASSES,
                true,
                DEFAULT_CACHE_CAPACITY,
                TableOptions.defaults(),
                ParserConfig.defaults(),
                NodeLimits.defaults());
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value);
        }
    }
}
