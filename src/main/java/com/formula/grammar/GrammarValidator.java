package com.formula.grammar;

import com.formula.exception.GrammarException;
import com.formula.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a grammar before a parsing table is built from it.
 * <p>
 * Checks run in a fixed order and the first failure raises a {@link GrammarException}:
 * <ol>
 *   <li>production count and length bounds</li>
 *   <li>start symbol is a declared non-terminal</li>
 *   <li>terminals and non-terminals are disjoint</li>
 *   <li>every production uses declared symbols only</li>
 *   <li>no duplicate productions</li>
 *   <li>every non-terminal is reachable from the start symbol</li>
 *   <li>every non-terminal has a production</li>
 *   <li>no indirect left recursion and no derivation cycle</li>
 * </ol>
 * Direct left recursion ({@code A → A α} with non-empty α) is accepted: bottom-up parsing handles it.
 */
public final class GrammarValidator {

    private static final Logger log = LoggerFactory.getLogger(GrammarValidator.class);

    public static final int MIN_PRODUCTIONS = 1;
    public static final int MAX_PRODUCTIONS = 1000;
    public static final int MAX_PRODUCTION_LENGTH = 50;

    private GrammarValidator() {
    }

    /**
     * Validate the grammar.
     *
     * @param grammar Grammar to check
     * @throws GrammarException naming the offending symbols on the first failed check
     */
    public static void validate(Grammar grammar) {
        checkBounds(grammar);
        checkStartSymbol(grammar);
        checkDisjoint(grammar);
        checkSymbols(grammar);
        checkDuplicates(grammar);
        checkReachability(grammar);
        checkCompleteness(grammar);
        checkLeftRecursion(grammar);
        log.debug("Grammar '{}' passed validation with {} productions", grammar.name(), grammar.productions().size());
    }

    private static void checkBounds(Grammar grammar) {
        int count = grammar.productions().size();
        if (count < MIN_PRODUCTIONS || count > MAX_PRODUCTIONS) {
            throw new GrammarException("Production count " + count + " outside ["
                    + MIN_PRODUCTIONS + ", " + MAX_PRODUCTIONS + "]");
        }
        Set<Integer> ids = new HashSet<>();
        for (Production production : grammar.productions()) {
            if (production.id() < 0) {
                throw new GrammarException("Negative production id in '" + production + "'");
            }
            if (!ids.add(production.id())) {
                throw new GrammarException("Duplicate production id " + production.id());
            }
            if (production.length() > MAX_PRODUCTION_LENGTH) {
                throw new GrammarException("Production longer than " + MAX_PRODUCTION_LENGTH + " symbols",
                        List.of(production.left().symbol()));
            }
        }
    }

    private static void checkStartSymbol(Grammar grammar) {
        TokenType start = grammar.startSymbol();
        if (start == null) {
            throw new GrammarException("Grammar has no start symbol");
        }
        if (!grammar.nonTerminals().contains(start)) {
            throw new GrammarException("Start symbol is not a non-terminal", List.of(start.symbol()));
        }
    }

    private static void checkDisjoint(Grammar grammar) {
        Set<TokenType> overlap = EnumSet.noneOf(TokenType.class);
        overlap.addAll(grammar.terminals());
        overlap.retainAll(grammar.nonTerminals());
        if (!overlap.isEmpty()) {
            throw new GrammarException("Symbols declared both terminal and non-terminal", names(overlap));
        }
    }

    private static void checkSymbols(Grammar grammar) {
        Set<TokenType> unknown = EnumSet.noneOf(TokenType.class);
        for (Production production : grammar.productions()) {
            if (!grammar.nonTerminals().contains(production.left())) {
                throw new GrammarException("Left side of '" + production + "' is not a non-terminal",
                        List.of(production.left().symbol()));
            }
            for (TokenType symbol : production.right()) {
                if (!grammar.terminals().contains(symbol) && !grammar.nonTerminals().contains(symbol)) {
                    unknown.add(symbol);
                }
            }
        }
        if (!unknown.isEmpty()) {
            throw new GrammarException("Undefined symbols on right-hand sides", names(unknown));
        }
    }

    private static void checkDuplicates(Grammar grammar) {
        List<Production> productions = grammar.productions();
        for (int i = 0; i < productions.size(); i++) {
            for (int j = i + 1; j < productions.size(); j++) {
                if (productions.get(i).sameShape(productions.get(j))) {
                    throw new GrammarException("Duplicate production '" + productions.get(j) + "'",
                            List.of(productions.get(j).left().symbol()));
                }
            }
        }
    }

    private static void checkReachability(Grammar grammar) {
        Set<TokenType> reached = EnumSet.of(grammar.startSymbol());
        Deque<TokenType> queue = new ArrayDeque<>(reached);
        while (!queue.isEmpty()) {
            TokenType current = queue.poll();
            for (Production production : grammar.productionsFor(current)) {
                for (TokenType symbol : production.right()) {
                    if (grammar.nonTerminals().contains(symbol) && reached.add(symbol)) {
                        queue.add(symbol);
                    }
                }
            }
        }
        Set<TokenType> unreachable = EnumSet.noneOf(TokenType.class);
        unreachable.addAll(grammar.nonTerminals());
        unreachable.removeAll(reached);
        if (!unreachable.isEmpty()) {
            throw new GrammarException("Non-terminals unreachable from " + grammar.startSymbol().symbol(),
                    names(unreachable));
        }
    }

    private static void checkCompleteness(Grammar grammar) {
        Set<TokenType> undefined = EnumSet.noneOf(TokenType.class);
        for (TokenType nonTerminal : grammar.nonTerminals()) {
            if (grammar.productionsFor(nonTerminal).isEmpty()) {
                undefined.add(nonTerminal);
            }
        }
        if (!undefined.isEmpty()) {
            throw new GrammarException("Non-terminals without productions", names(undefined));
        }
    }

    private static void checkLeftRecursion(Grammar grammar) {
        FirstFollowSets sets = FirstFollowSets.compute(grammar);

        // edge A -> B when some A-production starts with B after a nullable prefix
        Map<TokenType, Set<TokenType>> leftCorners = new EnumMap<>(TokenType.class);
        for (Production production : grammar.productions()) {
            Set<TokenType> corners = leftCorners.computeIfAbsent(production.left(), k -> EnumSet.noneOf(TokenType.class));
            List<TokenType> right = production.right();
            for (int i = 0; i < right.size(); i++) {
                TokenType symbol = right.get(i);
                if (grammar.nonTerminals().contains(symbol)) {
                    boolean directWithTail = symbol == production.left()
                            && !sets.isNullable(right.subList(i + 1, right.size()));
                    if (!directWithTail) {
                        corners.add(symbol);
                    }
                }
                if (!sets.isNullable(symbol)) {
                    break;
                }
            }
        }

        for (TokenType origin : leftCorners.keySet()) {
            List<TokenType> cycle = findCycle(origin, leftCorners);
            if (!cycle.isEmpty()) {
                throw new GrammarException("Left recursion through", names(cycle));
            }
        }
    }

    private static List<TokenType> findCycle(TokenType origin, Map<TokenType, Set<TokenType>> edges) {
        Deque<List<TokenType>> paths = new ArrayDeque<>();
        paths.push(List.of(origin));
        Set<TokenType> visited = EnumSet.noneOf(TokenType.class);
        while (!paths.isEmpty()) {
            List<TokenType> path = paths.pop();
            TokenType last = path.get(path.size() - 1);
            for (TokenType next : edges.getOrDefault(last, Set.of())) {
                if (next == origin) {
                    List<TokenType> cycle = new ArrayList<>(path);
                    cycle.add(origin);
                    return cycle;
                }
                if (visited.add(next)) {
                    List<TokenType> extended = new ArrayList<>(path);
                    extended.add(next);
                    paths.push(extended);
                }
            }
        }
        return List.of();
    }

    private static List<String> names(Iterable<TokenType> symbols) {
        List<String> names = new ArrayList<>();
        for (TokenType symbol : symbols) {
            names.add(symbol.symbol());
        }
        return names;
    }
}
