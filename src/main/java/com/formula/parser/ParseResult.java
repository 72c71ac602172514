package com.formula.parser;

import com.formula.ast.ASTNode;

import java.util.List;

/**
 * Outcome of a successful parse.
 *
 * @param ast            root of the tree
 * @param steps          actions executed
 * @param shifts         shift actions executed
 * @param reduces        reduce actions executed
 * @param warnings       tokens skipped by error recovery
 * @param durationNanos  time spent parsing
 */
public record ParseResult(ASTNode ast, int steps, int shifts, int reduces, List<String> warnings, long durationNanos) {

    public ParseResult {
        warnings = List.copyOf(warnings);
    }

    public boolean recovered() {
        return !warnings.isEmpty();
    }
}
