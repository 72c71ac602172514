package com.formula.parser;

import com.formula.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of a single parse. Created per parse and never shared.
 */
final class ParserRuntimeContext {

    private final List<Token> tokens;
    private final int[] stateStack;
    private final List<Object> valueStack = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int top = -1;
    private int cursor;
    private int steps;
    private int shifts;
    private int reduces;
    private int recoveries;

    ParserRuntimeContext(List<Token> tokens, int maxStackDepth) {
        this.tokens = tokens;
        // +1 for the start state, which carries no value
        this.stateStack = new int[maxStackDepth + 1];
    }

    Token lookahead() {
        return tokens.get(Math.min(cursor, tokens.size() - 1));
    }

    void advance() {
        cursor++;
    }

    int currentState() {
        return stateStack[top];
    }

    int depth() {
        return top + 1;
    }

    boolean canPush() {
        return top + 1 < stateStack.length;
    }

    void pushStart(int state) {
        stateStack[++top] = state;
    }

    void push(int state, Object value) {
        stateStack[++top] = state;
        valueStack.add(value);
    }

    /**
     * Pop {@code count} frames from both stacks.
     *
     * @return popped values, bottom-most first
     */
    List<Object> pop(int count) {
        int size = valueStack.size();
        List<Object> popped = new ArrayList<>(valueStack.subList(size - count, size));
        valueStack.subList(size - count, size).clear();
        top -= count;
        return popped;
    }

    Object topValue() {
        return valueStack.get(valueStack.size() - 1);
    }

    int nextStep() {
        return ++steps;
    }

    void countShift() {
        shifts++;
    }

    void countReduce() {
        reduces++;
    }

    int recoveries() {
        return recoveries;
    }

    void recover(String warning) {
        recoveries++;
        warnings.add(warning);
        cursor++;
    }

    int steps() {
        return steps;
    }

    int shifts() {
        return shifts;
    }

    int reduces() {
        return reduces;
    }

    List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
