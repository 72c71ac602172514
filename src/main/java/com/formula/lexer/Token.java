package com.formula.lexer;

/**
 * Represents a token in a formula.
 *
 * @param type     Token type
 * @param text     Original text (the bare name for {name} variables)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    public static Token endOfInput(int position) {
        return new Token(TokenType.DOLLAR, "$", position);
    }

    public boolean isEndOfInput() {
        return type == TokenType.DOLLAR;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
