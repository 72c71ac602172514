package com.formula.calculator;

import com.formula.ast.ASTNode;
import com.formula.ast.NodeFactory;
import com.formula.ast.Trees;
import com.formula.config.CalculatorConfig;
import com.formula.evaluator.ExpressionEvaluator;
import com.formula.evaluator.FunctionLibrary;
import com.formula.evaluator.MathFunctions;
import com.formula.evaluator.VariableResolver;
import com.formula.exception.FormulaException;
import com.formula.exception.LexicalException;
import com.formula.exception.ResourceLimitException;
import com.formula.exception.SyntaxException;
import com.formula.format.ExpressionFormatter;
import com.formula.grammar.ExpressionGrammar;
import com.formula.grammar.Grammar;
import com.formula.lexer.Lexer;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;
import com.formula.lr.ParsingTable;
import com.formula.lr.ParsingTableCache;
import com.formula.optimizer.OptimizationMetrics;
import com.formula.optimizer.OptimizationResult;
import com.formula.optimizer.TreeOptimizer;
import com.formula.parser.LRParser;
import com.formula.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for formula calculation: lexer, parser, optimizer, evaluator and formatter
 * behind one call.
 * <p>
 * Thread-safe. The parsing table comes from a shared {@link ParsingTableCache}; every
 * calculation runs on its own parser context.
 */
public class Calculator {

    private static final Logger log = LoggerFactory.getLogger(Calculator.class);

    /** Name prefix under which multi-step results are bound for later steps. */
    public static final String STEP_VARIABLE_PREFIX = "step";

    private final CalculatorConfig config;
    private final ParsingTableCache tableCache;
    private final ParsingTable table;
    private final LRParser parser;
    private final TreeOptimizer optimizer;
    private final ExpressionEvaluator evaluator;
    private final ExpressionFormatter formatter = new ExpressionFormatter();
    private final ResultCache resultCache;

    private final AtomicLong calculations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public static Calculator createDefault() {
        return new Calculator(CalculatorConfig.defaults());
    }

    public Calculator(CalculatorConfig config) {
        this(config, new ParsingTableCache(config.table()), MathFunctions.standard());
    }

    public Calculator(CalculatorConfig config, ParsingTableCache tableCache, FunctionLibrary functions) {
        this(config, tableCache, functions, ExpressionGrammar.get());
    }

    /**
     * @param grammar grammar whose productions build the trees; defaults to {@link ExpressionGrammar}
     */
    public Calculator(CalculatorConfig config, ParsingTableCache tableCache, FunctionLibrary functions,
                      Grammar grammar) {
        this.config = config;
        this.tableCache = tableCache;
        this.table = tableCache.get(grammar, config.table());
        NodeFactory factory = new NodeFactory(config.limits());
        this.parser = new LRParser(table, factory, config.parser());
        this.evaluator = new ExpressionEvaluator(functions);
        this.optimizer = new TreeOptimizer(evaluator, factory, config.optimizerPasses());
        this.resultCache = config.cacheEnabled() ? new ResultCache(config.cacheCapacity()) : null;
        log.info("Calculator ready: {} parser states, result cache {}",
                table.stateCount(), resultCache != null ? "capacity " + config.cacheCapacity() : "disabled");
    }

    /**
     * Calculate a formula. Errors are reported in the result, never thrown.
     *
     * @param request Formula, bindings and flags
     * @return the result; {@link CalculationResult#isSuccess()} tells whether it holds a value
     */
    public CalculationResult calculate(CalculationRequest request) {
        calculations.incrementAndGet();
        String key = null;
        List<Token> lexed = null;
        if (resultCache != null && request.formula().length() <= config.maxFormulaLength()) {
            try {
                lexed = new Lexer(request.formula()).tokenize();
                key = ResultCache.key(lexed, request);
            } catch (LexicalException e) {
                log.debug("Not caching '{}': {}", request.formula(), e.getMessage());
            }
        }
        if (key != null) {
            CalculationResult cached = resultCache.get(key);
            if (cached != null) {
                log.debug("Result cache hit for '{}'", request.formula());
                return cached.asCacheHit();
            }
        }

        long start = System.nanoTime();
        Trace trace = new Trace();
        CalculationResult result;
        try {
            compute(request, lexed, trace);
            result = trace.toResult(request.formula(), List.of(), elapsedMs(start));
        } catch (FormulaException e) {
            failures.incrementAndGet();
            log.debug("Calculation of '{}' failed: {}", request.formula(), e.getMessage());
            result = trace.toResult(request.formula(), List.of(e.getMessage()), elapsedMs(start));
        }

        if (key != null && result.isSuccess()) {
            resultCache.put(key, result);
        }
        return result;
    }

    /**
     * Calculate a formula, throwing on any error.
     *
     * @param formula   Formula text
     * @param variables Variable bindings
     * @return a Double or a Boolean
     * @throws FormulaException when the formula cannot be lexed, parsed or evaluated
     */
    public Object evaluate(String formula, Map<String, ?> variables) {
        calculations.incrementAndGet();
        Trace trace = new Trace();
        try {
            compute(new CalculationRequest(formula, variables), null, trace);
        } catch (FormulaException e) {
            failures.incrementAndGet();
            throw e;
        }
        return trace.value;
    }

    /**
     * Calculate formulas in order. The value of step {@code i} (1-based) is bound as
     * {@code step<i>} for every later formula. A failed step binds nothing, so formulas
     * referring to it fail as well.
     *
     * @param formulas  Formulas in evaluation order
     * @param variables Bindings shared by all steps
     * @return one result per formula
     * @throws ResourceLimitException when there are more formulas than allowed
     */
    public List<CalculationResult> calculateMultiStep(List<String> formulas, Map<String, ?> variables) {
        if (formulas.size() > config.maxMultiSteps()) {
            throw new ResourceLimitException("multiSteps", config.maxMultiSteps(), formulas.size());
        }
        Map<String, Object> bindings = new HashMap<>(variables == null ? Map.of() : variables);
        List<CalculationResult> results = new ArrayList<>(formulas.size());

        for (int i = 0; i < formulas.size(); i++) {
            CalculationResult result = calculate(new CalculationRequest(formulas.get(i), bindings));
            results.add(result);
            if (result.isSuccess()) {
                bindings.put(STEP_VARIABLE_PREFIX + (i + 1), result.result());
            } else {
                log.warn("Step {} of {} failed: {}", i + 1, formulas.size(), result.errors());
            }
        }
        return results;
    }

    /**
     * @return true if the formula lexes and parses
     */
    public boolean isValidFormula(String formula) {
        try {
            parse(tokenize(formula, null, true), new Trace());
            return true;
        } catch (FormulaException e) {
            log.debug("Formula '{}' is not valid: {}", formula, e.getMessage());
            return false;
        }
    }

    /**
     * Names of the variables a formula references, in first-occurrence order.
     *
     * @throws FormulaException when the formula cannot be parsed
     */
    public Set<String> extractVariables(String formula) {
        return Trees.variables(parse(tokenize(formula, null, true), new Trace()));
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("calculations", calculations.get());
        stats.put("failures", failures.get());
        stats.put("parserStates", table.stateCount());
        stats.put("canonicalStates", table.canonicalStateCount());
        stats.put("tableCacheHits", tableCache.hits());
        stats.put("tableCacheMisses", tableCache.misses());
        if (resultCache != null) {
            stats.put("resultCacheSize", resultCache.size());
            stats.put("resultCacheHits", resultCache.hits());
            stats.put("resultCacheMisses", resultCache.misses());
        }
        return stats;
    }

    public void clearCache() {
        if (resultCache != null) {
            resultCache.clear();
        }
    }

    public CalculatorConfig getConfig() {
        return config;
    }

    /**
     * @param lexed tokens of the formula when already lexed, otherwise null
     */
    private void compute(CalculationRequest request, List<Token> lexed, Trace trace) {
        String formula = request.formula();
        if (formula.length() > config.maxFormulaLength()) {
            throw new ResourceLimitException("formulaLength", config.maxFormulaLength(), formula.length());
        }
        if (request.variables().size() > config.maxVariables()) {
            throw new ResourceLimitException("variables", config.maxVariables(), request.variables().size());
        }

        boolean validate = config.validation() && request.enableValidation();
        trace.tokens = tokenize(formula, lexed, validate);
        ASTNode ast = parse(trace.tokens, trace);
        trace.ast = ast;

        VariableResolver variables = VariableResolver.of(request.variables());
        if (config.optimization() && request.enableOptimization()) {
            OptimizationResult optimized = optimizer.optimize(ast);
            trace.ast = optimized.tree();
            trace.metrics = optimized.metrics();
            trace.formatted = formatter.format(optimized.tree());
            trace.value = optimized.evaluate(evaluator, variables);
        } else {
            trace.formatted = formatter.format(ast);
            trace.value = evaluator.evaluate(ast, variables);
        }
    }

    private List<Token> tokenize(String formula, List<Token> lexed, boolean validate) {
        if (validate && formula.isBlank()) {
            throw new SyntaxException("Formula must not be blank");
        }
        List<Token> tokens = lexed != null ? lexed : new Lexer(formula).tokenize();
        if (validate) {
            checkBalancedParentheses(tokens);
        }
        return tokens;
    }

    private ASTNode parse(List<Token> tokens, Trace trace) {
        ParseResult parsed = parser.parse(tokens);
        trace.parse = parsed;
        return parsed.ast();
    }

    private static void checkBalancedParentheses(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.LEFT_PAREN) {
                open.push(token);
            } else if (token.type() == TokenType.RIGHT_PAREN) {
                if (open.isEmpty()) {
                    throw new SyntaxException("Unmatched ')' at position " + token.position());
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            throw new SyntaxException("Unclosed '(' at position " + open.peek().position());
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * What one calculation produced so far; failures keep the stages that completed.
     */
    private static final class Trace {
        private List<Token> tokens = List.of();
        private ParseResult parse;
        private ASTNode ast;
        private String formatted;
        private OptimizationMetrics metrics;
        private Object value;

        CalculationResult toResult(String formula, List<String> errors, double totalMs) {
            List<String> warnings = parse == null ? List.of() : parse.warnings();
            return new CalculationResult(
                    formula,
                    tokens,
                    ast,
                    errors.isEmpty() ? value : null,
                    formatted,
                    errors,
                    warnings,
                    parse == null ? 0 : parse.steps(),
                    parse == null ? 0 : parse.shifts(),
                    parse == null ? 0 : parse.reduces(),
                    parse == null ? 0.0 : parse.durationNanos() / 1_000_000.0,
                    totalMs,
                    false,
                    metrics);
        }
    }
}
