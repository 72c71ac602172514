package com.formula.lr;

import com.formula.grammar.Production;

/**
 * Parser action for a (state, terminal) pair.
 */
public sealed interface LRAction permits LRAction.Shift, LRAction.Reduce, LRAction.Accept {

    static Shift shift(int state) {
        return new Shift(state);
    }

    static Reduce reduce(Production production) {
        return new Reduce(production);
    }

    static Accept accept() {
        return Accept.INSTANCE;
    }

    record Shift(int state) implements LRAction {
        @Override
        public String toString() {
            return "s" + state;
        }
    }

    record Reduce(Production production) implements LRAction {
        @Override
        public String toString() {
            return "r" + production.id();
        }
    }

    final class Accept implements LRAction {
        private static final Accept INSTANCE = new Accept();

        private Accept() {
        }

        @Override
        public String toString() {
            return "acc";
        }
    }
}
