package com.formula.calculator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.ast.ASTNode;
import com.formula.exception.FormulaException;
import com.formula.lexer.Token;
import com.formula.optimizer.OptimizationMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one calculation. Failures are reported through {@link #errors()} rather than thrown.
 *
 * @param formula      formula as requested
 * @param tokens       lexer output, empty when lexing failed
 * @param ast          final tree (optimized when optimization ran), null when parsing failed
 * @param result       Double or Boolean, null on failure
 * @param formatted    infix rendering of the final tree, null when parsing failed
 * @param errors       error messages, empty on success
 * @param warnings     recovered problems
 * @param steps        automaton steps
 * @param shifts       shift actions
 * @param reduces      reduce actions
 * @param parseTimeMs  time spent in the parser
 * @param totalTimeMs  time spent overall
 * @param cacheHit     served from the result cache
 * @param optimization optimizer metrics, null when the optimizer did not run
 */
public record CalculationResult(
        String formula,
        List<Token> tokens,
        ASTNode ast,
        Object result,
        String formatted,
        List<String> errors,
        List<String> warnings,
        int steps,
        int shifts,
        int reduces,
        double parseTimeMs,
        double totalTimeMs,
        boolean cacheHit,
        OptimizationMetrics optimization
) {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public CalculationResult {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isSuccess() {
        return errors.isEmpty() && result != null;
    }

    public CalculationResult asCacheHit() {
        return new CalculationResult(formula, tokens, ast, result, formatted, errors, warnings,
                steps, shifts, reduces, parseTimeMs, totalTimeMs, true, optimization);
    }

    /**
     * Render as a JSON object. The tree appears in its infix form; tokens as their lexemes.
     */
    public String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("formula", formula);
        json.put("success", isSuccess());
        json.put("result", result);
        json.put("formatted", formatted);
        json.put("tokens", tokens.stream()
                .filter(token -> !token.isEndOfInput())
                .map(Token::text)
                .collect(Collectors.toList()));
        json.put("errors", errors);
        json.put("warnings", warnings);
        json.put("steps", steps);
        json.put("shifts", shifts);
        json.put("reduces", reduces);
        json.put("parseTimeMs", parseTimeMs);
        json.put("totalTimeMs", totalTimeMs);
        json.put("cacheHit", cacheHit);
        if (optimization != null) {
            json.put("nodesBefore", optimization.nodesBefore());
            json.put("nodesAfter", optimization.nodesAfter());
        }
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new FormulaException("Failed to render result of '" + formula + "' as JSON", e);
        }
    }
}
