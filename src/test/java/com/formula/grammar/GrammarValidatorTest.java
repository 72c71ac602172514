package com.formula.grammar;

import com.formula.exception.GrammarException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.formula.lexer.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrammarValidator.
 */
class GrammarValidatorTest {

    private static final AstBuilder NONE = (children, factory) -> null;

    private static Grammar.Builder base() {
        return Grammar.builder()
                .name("test")
                .terminals(NUMBER, PLUS, MINUS)
                .start(EXPR);
    }

    @Test
    @DisplayName("Should accept the built-in formula grammar")
    void shouldAcceptDefaultGrammar() {
        assertDoesNotThrow(() -> GrammarValidator.validate(ExpressionGrammar.get()));
    }

    @Test
    @DisplayName("Should accept direct left recursion")
    void shouldAcceptDirectLeftRecursion() {
        Grammar grammar = base()
                .nonTerminals(EXPR)
                .production(EXPR, List.of(EXPR, PLUS, NUMBER), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .build();

        assertDoesNotThrow(() -> GrammarValidator.validate(grammar));
    }

    @Test
    @DisplayName("Should reject a grammar without productions")
    void shouldRejectEmptyGrammar() {
        Grammar grammar = base().nonTerminals(EXPR).build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertTrue(e.getMessage().startsWith("Production count 0"));
    }

    @Test
    @DisplayName("Should reject a start symbol that is not a non-terminal")
    void shouldRejectTerminalStart() {
        Grammar grammar = base()
                .nonTerminals(EXPR)
                .start(NUMBER)
                .production(EXPR, List.of(NUMBER), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertEquals(List.of("NUMBER"), e.getSymbols());
    }

    @Test
    @DisplayName("Should name undeclared symbols used on right-hand sides")
    void shouldRejectUndefinedSymbols() {
        Grammar grammar = base()
                .nonTerminals(EXPR)
                .production(EXPR, List.of(EXPR, PLUS, TERM), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertTrue(e.getMessage().startsWith("Undefined symbols on right-hand sides"));
        assertEquals(List.of("TERM"), e.getSymbols());
    }

    @Test
    @DisplayName("Should reject duplicate productions")
    void shouldRejectDuplicates() {
        Grammar grammar = base()
                .nonTerminals(EXPR)
                .production(EXPR, List.of(NUMBER), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertTrue(e.getMessage().startsWith("Duplicate production"));
    }

    @Test
    @DisplayName("Should reject non-terminals unreachable from the start symbol")
    void shouldRejectUnreachable() {
        Grammar grammar = base()
                .nonTerminals(EXPR, TERM)
                .production(EXPR, List.of(NUMBER), NONE)
                .production(TERM, List.of(MINUS, NUMBER), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertEquals(List.of("TERM"), e.getSymbols());
    }

    @Test
    @DisplayName("Should reject non-terminals without productions")
    void shouldRejectIncomplete() {
        Grammar grammar = base()
                .nonTerminals(EXPR, TERM)
                .production(EXPR, List.of(TERM, PLUS, NUMBER), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertTrue(e.getMessage().startsWith("Non-terminals without productions"));
        assertEquals(List.of("TERM"), e.getSymbols());
    }

    @Test
    @DisplayName("Should reject indirect left recursion")
    void shouldRejectIndirectLeftRecursion() {
        Grammar grammar = base()
                .nonTerminals(EXPR, TERM)
                .production(EXPR, List.of(TERM, PLUS), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .production(TERM, List.of(EXPR, MINUS), NONE)
                .build();

        GrammarException e = assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
        assertTrue(e.getMessage().startsWith("Left recursion through"));
        assertTrue(e.getSymbols().containsAll(List.of("EXPR", "TERM")));
    }

    @Test
    @DisplayName("Should reject a unit derivation cycle")
    void shouldRejectDerivationCycle() {
        Grammar grammar = base()
                .nonTerminals(EXPR, TERM)
                .production(EXPR, List.of(TERM), NONE)
                .production(EXPR, List.of(NUMBER), NONE)
                .production(TERM, List.of(EXPR), NONE)
                .build();

        assertThrows(GrammarException.class, () -> GrammarValidator.validate(grammar));
    }
}
