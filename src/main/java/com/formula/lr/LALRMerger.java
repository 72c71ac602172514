package com.formula.lr;

import com.formula.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compresses canonical LR(1) states into LALR(1) states by merging states with equal cores.
 * <p>
 * Two states end up merged only when their kernel cores are identical, the union of their
 * actions maps no terminal to two different actions, and their transitions lead to states
 * that are merged together as well. Candidates failing a condition stay separate.
 */
public class LALRMerger {

    private static final Logger log = LoggerFactory.getLogger(LALRMerger.class);

    /**
     * Outcome of a compression.
     *
     * @param states        states after compression, indexed by id
     * @param mapping       original state id to compressed state id
     * @param originalCount number of canonical states
     * @param rejected      merge candidates kept apart because of action or transition clashes
     */
    public record Result(List<ParsingState> states, int[] mapping, int originalCount, int rejected) {

        public double compressionRatio() {
            return originalCount == 0 ? 1.0 : (double) states.size() / originalCount;
        }
    }

    /**
     * Merge states that share a core.
     * <p>
     * A merged state takes the position of its lowest original id; ids are then renumbered
     * densely in that order, so {@code mapping[i] <= i} and state 0 stays the start state.
     * Use {@link Result#mapping()} to translate original ids.
     *
     * @param original canonical states, state i having id i
     * @return compressed automaton
     */
    public Result compressStatesLALR(List<ParsingState> original) {
        int[] block = partition(original);
        int rejected = countRejected(original, block);

        // merged state keeps the lowest member id, then ids are packed in that order
        Map<Integer, List<ParsingState>> members = new TreeMap<>();
        Map<Integer, Integer> representative = new HashMap<>();
        for (ParsingState state : original) {
            representative.putIfAbsent(block[state.id()], state.id());
        }
        for (ParsingState state : original) {
            members.computeIfAbsent(representative.get(block[state.id()]), k -> new ArrayList<>()).add(state);
        }

        Map<Integer, Integer> packed = new HashMap<>();
        for (Integer lowestId : members.keySet()) {
            packed.put(lowestId, packed.size());
        }
        int[] mapping = new int[original.size()];
        for (ParsingState state : original) {
            mapping[state.id()] = packed.get(representative.get(block[state.id()]));
        }

        List<ParsingState> merged = new ArrayList<>(members.size());
        for (Map.Entry<Integer, List<ParsingState>> entry : members.entrySet()) {
            merged.add(merge(packed.get(entry.getKey()), entry.getValue(), mapping));
        }

        Result result = new Result(List.copyOf(merged), mapping, original.size(), rejected);
        log.debug("LALR compression: {} -> {} states (ratio {}, {} merges rejected)",
                original.size(), merged.size(), String.format("%.3f", result.compressionRatio()), rejected);
        return result;
    }

    /**
     * Check a compression: the kernel items of all states are preserved and every merged
     * state is deterministic with no action the original states did not have.
     *
     * @return problems found, empty when the compression is sound
     */
    public List<String> validateLALRMerging(List<ParsingState> original, Result result) {
        List<String> problems = new ArrayList<>();

        Set<LRItem> originalKernels = new HashSet<>();
        original.forEach(state -> originalKernels.addAll(state.kernel()));
        Set<LRItem> mergedKernels = new HashSet<>();
        result.states().forEach(state -> mergedKernels.addAll(state.kernel()));
        if (!originalKernels.equals(mergedKernels)) {
            problems.add("kernel items changed: " + originalKernels.size() + " before, " + mergedKernels.size() + " after");
        }

        int[] mapping = result.mapping();
        for (ParsingState state : original) {
            ParsingState target = result.states().get(mapping[state.id()]);
            for (Map.Entry<TokenType, LRAction> entry : state.actions().entrySet()) {
                LRAction expected = remap(entry.getValue(), mapping);
                LRAction actual = target.actions().get(entry.getKey());
                if (!expected.equals(actual)) {
                    problems.add("state " + state.id() + " on '" + entry.getKey().symbol() + "': "
                            + expected + " became " + actual);
                }
            }
            for (Map.Entry<TokenType, Integer> entry : state.transitions().entrySet()) {
                Integer actual = target.transitions().get(entry.getKey());
                if (!Objects.equals(mapping[entry.getValue()], actual)) {
                    problems.add("state " + state.id() + " transition on '" + entry.getKey().symbol()
                            + "' lost its target");
                }
            }
        }
        return problems;
    }

    /**
     * Partition refinement: start from core blocks, split on action clashes, then split until
     * every block agrees on the blocks its transitions lead to.
     */
    private int[] partition(List<ParsingState> states) {
        int[] block = new int[states.size()];
        Map<String, List<List<ParsingState>>> byCore = new LinkedHashMap<>();
        int nextBlock = 0;

        for (ParsingState state : states) {
            List<List<ParsingState>> groups = byCore.computeIfAbsent(state.coreSignature(), k -> new ArrayList<>());
            List<ParsingState> home = null;
            for (List<ParsingState> group : groups) {
                if (actionsCompatible(group, state)) {
                    home = group;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                groups.add(home);
            }
            home.add(state);
        }
        for (List<List<ParsingState>> groups : byCore.values()) {
            for (List<ParsingState> group : groups) {
                for (ParsingState state : group) {
                    block[state.id()] = nextBlock;
                }
                nextBlock++;
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            Map<List<Object>, Integer> signatures = new HashMap<>();
            int[] refined = new int[states.size()];
            for (ParsingState state : states) {
                List<Object> signature = new ArrayList<>();
                signature.add(block[state.id()]);
                Map<TokenType, Integer> targets = new EnumMap<>(TokenType.class);
                state.transitions().forEach((symbol, target) -> targets.put(symbol, block[target]));
                signature.add(targets);
                refined[state.id()] = signatures.computeIfAbsent(signature, k -> signatures.size());
            }
            if (signatures.size() != countBlocks(block)) {
                changed = true;
            }
            System.arraycopy(refined, 0, block, 0, block.length);
        }
        return block;
    }

    private static int countBlocks(int[] block) {
        Set<Integer> distinct = new HashSet<>();
        for (int b : block) {
            distinct.add(b);
        }
        return distinct.size();
    }

    private boolean actionsCompatible(List<ParsingState> group, ParsingState candidate) {
        for (ParsingState member : group) {
            for (Map.Entry<TokenType, LRAction> entry : candidate.actions().entrySet()) {
                LRAction other = member.actions().get(entry.getKey());
                if (other != null && !sameKind(other, entry.getValue())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Shift targets differ between unmerged same-core states, so shifts only need to agree in kind.
     */
    private static boolean sameKind(LRAction a, LRAction b) {
        if (a instanceof LRAction.Shift && b instanceof LRAction.Shift) {
            return true;
        }
        return a.equals(b);
    }

    private int countRejected(List<ParsingState> states, int[] block) {
        Map<String, Set<Integer>> blocksPerCore = new HashMap<>();
        for (ParsingState state : states) {
            blocksPerCore.computeIfAbsent(state.coreSignature(), k -> new HashSet<>()).add(block[state.id()]);
        }
        int rejected = 0;
        for (Set<Integer> blocks : blocksPerCore.values()) {
            rejected += blocks.size() - 1;
        }
        return rejected;
    }

    private ParsingState merge(int id, List<ParsingState> group, int[] mapping) {
        Set<LRItem> kernel = new HashSet<>();
        Set<LRItem> items = new HashSet<>();
        Map<TokenType, Integer> transitions = new EnumMap<>(TokenType.class);
        Map<TokenType, LRAction> actions = new EnumMap<>(TokenType.class);

        for (ParsingState state : group) {
            kernel.addAll(state.kernel());
            items.addAll(state.items());
            state.transitions().forEach((symbol, target) -> transitions.put(symbol, mapping[target]));
            state.actions().forEach((terminal, action) -> actions.put(terminal, remap(action, mapping)));
        }
        return new ParsingState(id, kernel, items, transitions, actions);
    }

    private static LRAction remap(LRAction action, int[] mapping) {
        if (action instanceof LRAction.Shift) {
            return LRAction.shift(mapping[((LRAction.Shift) action).state()]);
        }
        return action;
    }
}
