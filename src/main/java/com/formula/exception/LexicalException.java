package com.formula.exception;

/**
 * Exception thrown when the input cannot be split into tokens.
 */
public class LexicalException extends FormulaException {

    public enum Kind {
        UNEXPECTED_CHARACTER,
        UNTERMINATED_VARIABLE,
        EMPTY_VARIABLE_NAME,
        INVALID_NUMBER
    }

    private final Kind kind;
    private final Character character;
    private final int position;

    public LexicalException(Kind kind, Character character, int position, String message) {
        super(message);
        this.kind = kind;
        this.character = character;
        this.position = position;
    }

    public static LexicalException unexpectedCharacter(char c, int position, String input) {
        return new LexicalException(Kind.UNEXPECTED_CHARACTER, c, position,
                "Unexpected character '" + c + "' at position " + position + " in '" + input + "'");
    }

    public static LexicalException unterminatedVariable(int position, String input) {
        return new LexicalException(Kind.UNTERMINATED_VARIABLE, null, position,
                "Unterminated variable starting at position " + position + " in '" + input + "'");
    }

    public static LexicalException emptyVariableName(int position, String input) {
        return new LexicalException(Kind.EMPTY_VARIABLE_NAME, null, position,
                "Empty variable name at position " + position + " in '" + input + "'");
    }

    public static LexicalException invalidNumber(String text, int position, String input) {
        return new LexicalException(Kind.INVALID_NUMBER, null, position,
                "Invalid number '" + text + "' at position " + position + " in '" + input + "'");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the offending character, or null when the error is not about a single character
     */
    public Character getCharacter() {
        return character;
    }

    public int getPosition() {
        return position;
    }
}
