package com.formula.lexer;

import java.util.Set;

/**
 * Classifies characters for the lexer.
 */
public final class CharacterRecognitionPolicy {

    private static final Set<Character> OPERATOR_START = Set.of('+', '-', '*', '/', '^', '%', '=', '!', '<', '>', '&', '|');

    private final boolean allowUnicodeIdentifiers;

    public CharacterRecognitionPolicy() {
        this(false);
    }

    public CharacterRecognitionPolicy(boolean allowUnicodeIdentifiers) {
        this.allowUnicodeIdentifiers = allowUnicodeIdentifiers;
    }

    public boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    public boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public boolean isIdentifierStart(char c) {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == LexerConfig.Chars.UNDERSCORE) {
            return true;
        }
        return allowUnicodeIdentifiers && Character.isLetter(c);
    }

    public boolean isIdentifierBody(char c) {
        if (isIdentifierStart(c) || isDigit(c)) {
            return true;
        }
        return allowUnicodeIdentifiers && Character.isLetterOrDigit(c);
    }

    public boolean isOperatorStart(char c) {
        return OPERATOR_START.contains(c);
    }

    public boolean isDelimiter(char c) {
        return LexerConfig.DELIMITERS.containsKey(c);
    }

    public boolean isVariableOpen(char c) {
        return c == LexerConfig.Chars.VARIABLE_OPEN;
    }

    public boolean isVariableClose(char c) {
        return c == LexerConfig.Chars.VARIABLE_CLOSE;
    }
}
