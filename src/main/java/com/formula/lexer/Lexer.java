package com.formula.lexer;

import com.formula.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.formula.lexer.LexerConfig.*;

/**
 * Lexer for formulas.
 * Converts an input string into a sequence of tokens terminated by {@link TokenType#DOLLAR}.
 */
public final class Lexer {

    private final String input;
    private final int length;
    private final CharacterRecognitionPolicy policy;
    private int pos;

    public Lexer(String input) {
        this(input, new CharacterRecognitionPolicy());
    }

    public Lexer(String input, CharacterRecognitionPolicy policy) {
        this.input = input;
        this.length = input.length();
        this.policy = policy;
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always ending with the end-of-input token
     * @throws LexicalException on an unexpected character or malformed variable
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (policy.isWhitespace(c)) {
                advance();
                continue;
            }
            if (skipComment()) {
                continue;
            }

            int start = pos;

            if (policy.isDigit(c)) {
                tokens.add(readNumber());
            } else if (policy.isIdentifierStart(c)) {
                tokens.add(readIdentifierOrKeyword());
            } else if (policy.isVariableOpen(c)) {
                tokens.add(readVariable());
            } else if (policy.isDelimiter(c)) {
                advance();
                tokens.add(new Token(DELIMITERS.get(c), String.valueOf(c), start));
            } else if (policy.isOperatorStart(c)) {
                tokens.add(readOperator());
            } else {
                throw LexicalException.unexpectedCharacter(c, start, input);
            }
        }

        tokens.add(Token.endOfInput(pos));
        return tokens;
    }

    private boolean skipComment() {
        char c = peek();
        if (c == Chars.HASH || (c == Chars.SLASH && peekNext() == Chars.SLASH)) {
            while (!isAtEnd() && advance() != Chars.NEWLINE) {
                // consume to end of line
            }
            return true;
        }
        if (c == Chars.SLASH && peekNext() == Chars.STAR) {
            pos += 2;
            while (!isAtEnd()) {
                if (peek() == Chars.STAR && peekNext() == Chars.SLASH) {
                    pos += 2;
                    break;
                }
                advance();
            }
            return true;
        }
        return false;
    }

    private Token readNumber() {
        int start = pos;

        while (!isAtEnd() && policy.isDigit(peek())) {
            advance();
        }

        if (!isAtEnd() && peek() == Chars.DOT) {
            advance();
            while (!isAtEnd() && policy.isDigit(peek())) {
                advance();
            }
        }

        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            int mark = pos;
            advance();
            if (!isAtEnd() && (peek() == '+' || peek() == '-')) {
                advance();
            }
            if (!isAtEnd() && policy.isDigit(peek())) {
                while (!isAtEnd() && policy.isDigit(peek())) {
                    advance();
                }
            } else {
                // not an exponent after all
                pos = mark;
            }
        }

        String text = input.substring(start, pos);
        try {
            double value = Double.parseDouble(text);
            if (Double.isInfinite(value)) {
                throw LexicalException.invalidNumber(text, start, input);
            }
        } catch (NumberFormatException e) {
            throw LexicalException.invalidNumber(text, start, input);
        }
        return new Token(TokenType.NUMBER, text, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && policy.isIdentifierBody(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text.toUpperCase(Locale.ROOT));
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }
        return new Token(TokenType.IDENTIFIER, text, start);
    }

    private Token readVariable() {
        int start = pos;
        advance(); // '{'
        int nameStart = pos;

        while (true) {
            if (isAtEnd()) {
                throw LexicalException.unterminatedVariable(start, input);
            }
            char c = peek();
            if (policy.isVariableClose(c)) {
                break;
            }
            if (!policy.isIdentifierBody(c)) {
                throw LexicalException.unexpectedCharacter(c, pos, input);
            }
            advance();
        }

        String name = input.substring(nameStart, pos);
        advance(); // '}'
        if (name.isEmpty()) {
            throw LexicalException.emptyVariableName(start, input);
        }
        return new Token(TokenType.VARIABLE, name, start);
    }

    private Token readOperator() {
        int start = pos;
        char c = advance();

        if (!isAtEnd()) {
            String twoChar = "" + c + peek();
            TokenType twoCharType = TWO_CHAR_OPERATORS.get(twoChar);
            if (twoCharType != null) {
                advance();
                return new Token(twoCharType, twoChar, start);
            }
        }

        TokenType type = SINGLE_CHAR_OPERATORS.get(c);
        if (type == null) {
            // '=', '&' and '|' only exist as the first half of a two-character operator
            throw LexicalException.unexpectedCharacter(c, start, input);
        }
        return new Token(type, String.valueOf(c), start);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? input.charAt(pos + 1) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
