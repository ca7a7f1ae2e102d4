package org.pragmatica.cfg.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgExceptionTest {

    @Test
    void message_joinsEveryError() {
        var ex = new CfgException(List.of(new GrammarError.MissingProductions("A"),
                                          new GrammarError.ReservedSymbol("$")));

        assertEquals("Nonterminal 'A' has no productions; Symbol name '$' is reserved", ex.getMessage());
        assertEquals(2, ex.errors().size());
    }

    @Test
    void constructor_noErrors_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CfgException(List.of()));
    }

    @Test
    void format_malformedNotation_showsSourceLine() {
        var text = "A -> a\nB b\n";
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse(text));

        var formatted = ex.format(text);

        assertTrue(formatted.startsWith("error: Expected '->' after 'B'"));
        assertTrue(formatted.contains("--> grammar:2:3"));
        assertTrue(formatted.contains("2 | B b"));
        assertTrue(formatted.contains("^"));
    }

    @Test
    void format_otherErrors_renderAsPlainMessages() {
        var ex = new CfgException(new GrammarError.UndeclaredStart("X"));

        assertEquals("error: Start symbol 'X' is not a declared nonterminal\n", ex.format(""));
    }

    @Test
    void syntaxError_messages_describeExpectation() {
        assertEquals("Unexpected 'id' at position 2, expected one of {+, $}",
                     new SyntaxError.UnexpectedToken(2, "id", List.of("+", "$")).message());
        assertEquals("Unexpected end of input at position 3, expected ')'",
                     new SyntaxError.UnexpectedEnd(3, List.of(")")).message());
        assertEquals("No transition from state 4 on 'E' at position 1",
                     new SyntaxError.MissingTransition(4, Symbol.nonterminal("E"), 1).message());
    }

    @Test
    void depthExceeded_message_namesBound() {
        var error = new DepthExceededError(DepthExceededError.Bound.STEPS, 100, 7);

        assertEquals("Derivation steps exceeded limit of 100 at position 7", error.message());
    }
}
