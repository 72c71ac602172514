package com.formula.exception;

import java.util.List;

/**
 * Exception thrown when strict table construction meets conflicts the resolver could not settle.
 */
public class ConflictException extends FormulaException {

    private final List<String> conflicts;

    public ConflictException(List<String> conflicts) {
        super(conflicts.size() + " unresolved parsing conflict(s): " + conflicts);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<String> getConflicts() {
        return conflicts;
    }
}
