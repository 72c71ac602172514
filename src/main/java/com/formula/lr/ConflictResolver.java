package com.formula.lr;

import com.formula.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settles action-table conflicts with operator precedence and associativity.
 * <p>
 * Shift/reduce: the higher precedence wins; on a tie LEFT reduces, RIGHT shifts and NONE stays
 * unresolved. Without precedence information the shift is kept. Reduce/reduce: the lower production
 * id wins. Every conflict is recorded; unresolved ones keep a deterministic choice so construction
 * never aborts here.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private static final String DEFAULT_SHIFT = "default shift";

    private final List<Conflict> conflicts = new ArrayList<>();

    /**
     * Decide between two actions for the same state and terminal.
     *
     * @return the action to keep
     */
    public LRAction resolve(int state, TokenType terminal, LRAction existing, LRAction incoming) {
        if (existing.equals(incoming)) {
            return existing;
        }

        Conflict conflict;
        if (existing instanceof LRAction.Reduce && incoming instanceof LRAction.Reduce) {
            conflict = resolveReduceReduce(state, terminal, (LRAction.Reduce) existing, (LRAction.Reduce) incoming);
        } else if (existing instanceof LRAction.Shift && incoming instanceof LRAction.Reduce) {
            conflict = resolveShiftReduce(state, terminal, existing, incoming, (LRAction.Reduce) incoming);
        } else if (existing instanceof LRAction.Reduce && incoming instanceof LRAction.Shift) {
            conflict = resolveShiftReduce(state, terminal, existing, incoming, (LRAction.Reduce) existing);
        } else {
            // accept against anything else keeps the accept
            LRAction accept = existing instanceof LRAction.Accept ? existing : incoming;
            conflict = new Conflict(state, terminal, existing, incoming, accept, false,
                    "accept collides with " + (accept == existing ? incoming : existing));
        }

        conflicts.add(conflict);
        if (!conflict.resolved()) {
            log.warn("Unresolved {}", conflict);
        } else if (DEFAULT_SHIFT.equals(conflict.reason())) {
            log.warn("No precedence for {}, shifting", conflict);
        } else {
            log.debug("Resolved {}", conflict);
        }
        return conflict.chosen();
    }

    private Conflict resolveReduceReduce(int state, TokenType terminal, LRAction.Reduce existing, LRAction.Reduce incoming) {
        LRAction.Reduce chosen = existing.production().id() <= incoming.production().id() ? existing : incoming;
        return new Conflict(state, terminal, existing, incoming, chosen, true, "lower production id");
    }

    private Conflict resolveShiftReduce(int state, TokenType terminal, LRAction existing, LRAction incoming,
                                        LRAction.Reduce reduce) {
        LRAction shift = reduce == existing ? incoming : existing;
        OperatorPrecedence.Level shiftLevel = OperatorPrecedence.of(terminal);
        OperatorPrecedence.Level reduceLevel = OperatorPrecedence.of(reduce.production());

        if (shiftLevel == null || reduceLevel == null) {
            return new Conflict(state, terminal, existing, incoming, shift, true, DEFAULT_SHIFT);
        }
        if (shiftLevel.precedence() > reduceLevel.precedence()) {
            return new Conflict(state, terminal, existing, incoming, shift, true, "higher lookahead precedence");
        }
        if (shiftLevel.precedence() < reduceLevel.precedence()) {
            return new Conflict(state, terminal, existing, incoming, reduce, true, "higher production precedence");
        }
        return switch (reduceLevel.associativity()) {
            case LEFT -> new Conflict(state, terminal, existing, incoming, reduce, true, "left associative");
            case RIGHT -> new Conflict(state, terminal, existing, incoming, shift, true, "right associative");
            default -> new Conflict(state, terminal, existing, incoming, shift, false, "non-associative operator");
        };
    }

    public List<Conflict> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public List<Conflict> unresolved() {
        List<Conflict> unresolved = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            if (!conflict.resolved()) {
                unresolved.add(conflict);
            }
        }
        return unresolved;
    }
}
