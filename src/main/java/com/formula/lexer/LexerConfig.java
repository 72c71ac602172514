package com.formula.lexer;

import java.util.Map;

/**
 * Keyword and operator tables shared by the lexer and formatter.
 */
public final class LexerConfig {

    private LexerConfig() {
    }

    /** Keywords are matched case-insensitively against their upper-case form. */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "IF", TokenType.IF,
            "TRUE", TokenType.TRUE,
            "FALSE", TokenType.FALSE,
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "MOD", TokenType.MODULO
    );

    public static final Map<String, TokenType> TWO_CHAR_OPERATORS = Map.of(
            "==", TokenType.EQUAL,
            "!=", TokenType.NOT_EQUAL,
            "<=", TokenType.LESS_EQUAL,
            ">=", TokenType.GREATER_EQUAL,
            "&&", TokenType.AND,
            "||", TokenType.OR
    );

    public static final Map<Character, TokenType> SINGLE_CHAR_OPERATORS = Map.of(
            '+', TokenType.PLUS,
            '-', TokenType.MINUS,
            '*', TokenType.MULTIPLY,
            '/', TokenType.DIVIDE,
            '^', TokenType.POWER,
            '%', TokenType.MODULO,
            '<', TokenType.LESS,
            '>', TokenType.GREATER,
            '!', TokenType.NOT
    );

    public static final Map<Character, TokenType> DELIMITERS = Map.of(
            '(', TokenType.LEFT_PAREN,
            ')', TokenType.RIGHT_PAREN,
            ',', TokenType.COMMA
    );

    /**
     * Character constants.
     */
    public static final class Chars {
        public static final char VARIABLE_OPEN = '{';
        public static final char VARIABLE_CLOSE = '}';
        public static final char SLASH = '/';
        public static final char STAR = '*';
        public static final char HASH = '#';
        public static final char NEWLINE = '\n';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';

        private Chars() {
        }
    }
}
