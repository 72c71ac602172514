package com.formula.lr;

import com.formula.exception.ResourceLimitException;
import com.formula.grammar.FirstFollowSets;
import com.formula.grammar.Grammar;
import com.formula.grammar.Production;
import com.formula.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the canonical LR(1) automaton of a grammar.
 * <p>
 * Single-threaded: all mutable work happens in local drafts and the result is a list of
 * immutable {@link ParsingState}s indexed by id.
 */
public class LRStateBuilder {

    private static final Logger log = LoggerFactory.getLogger(LRStateBuilder.class);

    public static final int DEFAULT_MAX_STATES = 10_000;

    private static final Comparator<LRItem> ITEM_ORDER = Comparator
            .comparingInt((LRItem item) -> item.production().id())
            .thenComparingInt(LRItem::dot)
            .thenComparing(item -> item.lookahead().ordinal());

    private final Grammar grammar;
    private final FirstFollowSets sets;
    private final int maxStates;

    public LRStateBuilder(Grammar grammar, FirstFollowSets sets) {
        this(grammar, sets, DEFAULT_MAX_STATES);
    }

    public LRStateBuilder(Grammar grammar, FirstFollowSets sets, int maxStates) {
        this.grammar = grammar;
        this.sets = sets;
        this.maxStates = maxStates;
    }

    /**
     * Build all states reachable from the augmented start item.
     *
     * @param resolver receives every action conflict met while filling state actions
     * @return states, where the state at index i has id i and state 0 is the start state
     */
    public List<ParsingState> build(ConflictResolver resolver) {
        List<Draft> drafts = new ArrayList<>();
        Map<Set<LRItem>, Integer> stateCache = new HashMap<>();
        Deque<Draft> worklist = new ArrayDeque<>();

        Set<LRItem> startKernel = Set.of(new LRItem(grammar.augmentedProduction(), 0, TokenType.DOLLAR));
        Draft start = new Draft(0, startKernel, closure(startKernel));
        drafts.add(start);
        stateCache.put(startKernel, 0);
        worklist.add(start);

        while (!worklist.isEmpty()) {
            Draft draft = worklist.poll();
            for (Map.Entry<TokenType, Set<LRItem>> entry : computeTransitions(draft.items).entrySet()) {
                Set<LRItem> kernel = entry.getValue();
                Integer target = stateCache.get(kernel);
                if (target == null) {
                    if (drafts.size() >= maxStates) {
                        throw new ResourceLimitException("lrStates", maxStates, drafts.size() + 1L);
                    }
                    Draft successor = new Draft(drafts.size(), kernel, closure(kernel));
                    drafts.add(successor);
                    stateCache.put(kernel, successor.id);
                    worklist.add(successor);
                    target = successor.id;
                }
                draft.transitions.put(entry.getKey(), target);
            }
        }

        List<ParsingState> states = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            Map<TokenType, LRAction> actions = computeActions(draft.id, draft.items, draft.transitions, resolver);
            states.add(new ParsingState(draft.id, draft.kernel, draft.items, draft.transitions, actions));
        }
        log.debug("Built {} canonical LR(1) states for grammar '{}'", states.size(), grammar.name());
        return states;
    }

    /**
     * Expand an item set with every item reachable by non-terminal substitution.
     * Lookaheads of added items are FIRST(β·a) of the item that introduced them.
     */
    public Set<LRItem> closure(Set<LRItem> items) {
        Set<LRItem> result = new LinkedHashSet<>(items);
        Deque<LRItem> queue = new ArrayDeque<>(items);

        while (!queue.isEmpty()) {
            LRItem item = queue.poll();
            TokenType next = item.nextSymbol();
            if (next == null || !grammar.isNonTerminal(next)) {
                continue;
            }
            Set<TokenType> lookaheads = sets.firstOfSequence(item.remainderAfterNext(), item.lookahead());
            for (Production production : grammar.productionsFor(next)) {
                for (TokenType lookahead : lookaheads) {
                    LRItem added = new LRItem(production, 0, lookahead);
                    if (result.add(added)) {
                        queue.add(added);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Group items by the symbol after the dot and advance the dot.
     *
     * @return kernel of the successor state for each symbol
     */
    public Map<TokenType, Set<LRItem>> computeTransitions(Set<LRItem> items) {
        Map<TokenType, Set<LRItem>> transitions = new EnumMap<>(TokenType.class);
        for (LRItem item : items) {
            TokenType next = item.nextSymbol();
            if (next != null) {
                transitions.computeIfAbsent(next, k -> new LinkedHashSet<>()).add(item.advance());
            }
        }
        return transitions;
    }

    /**
     * Shift on terminal transitions, reduce on complete items, accept on the completed augmented item.
     */
    static Map<TokenType, LRAction> computeActions(int stateId, Set<LRItem> items,
                                                   Map<TokenType, Integer> transitions,
                                                   ConflictResolver resolver) {
        Map<TokenType, LRAction> actions = new EnumMap<>(TokenType.class);
        transitions.forEach((symbol, target) -> {
            if (symbol.isTerminal()) {
                register(actions, stateId, symbol, LRAction.shift(target), resolver);
            }
        });

        List<LRItem> complete = new ArrayList<>();
        for (LRItem item : items) {
            if (item.isComplete()) {
                complete.add(item);
            }
        }
        complete.sort(ITEM_ORDER);

        for (LRItem item : complete) {
            if (item.production().id() == Grammar.AUGMENTED_ID) {
                if (item.lookahead() == TokenType.DOLLAR) {
                    register(actions, stateId, TokenType.DOLLAR, LRAction.accept(), resolver);
                }
            } else {
                register(actions, stateId, item.lookahead(), LRAction.reduce(item.production()), resolver);
            }
        }
        return actions;
    }

    private static void register(Map<TokenType, LRAction> actions, int stateId, TokenType terminal,
                                 LRAction incoming, ConflictResolver resolver) {
        LRAction existing = actions.get(terminal);
        actions.put(terminal, existing == null ? incoming : resolver.resolve(stateId, terminal, existing, incoming));
    }

    private static final class Draft {
        private final int id;
        private final Set<LRItem> kernel;
        private final Set<LRItem> items;
        private final Map<TokenType, Integer> transitions = new EnumMap<>(TokenType.class);

        private Draft(int id, Set<LRItem> kernel, Set<LRItem> items) {
            this.id = id;
            this.kernel = kernel;
            this.items = items;
        }
    }
}
