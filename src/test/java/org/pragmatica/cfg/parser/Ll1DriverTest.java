package org.pragmatica.cfg.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.SampleGrammars;
import org.pragmatica.cfg.analysis.SetSolver;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.SyntaxError;
import org.pragmatica.cfg.error.TableConflictError;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.table.Ll1Table;
import org.pragmatica.cfg.table.Ll1TableBuilder;
import org.pragmatica.cfg.tree.Token;
import org.pragmatica.cfg.transform.GrammarTransformer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Ll1DriverTest {

    @Test
    void parse_sumOfProduct_nestsStarUnderRightOperand() {
        var driver = Ll1Driver.create(expressionTable());

        var tree = driver.parse("id + id * id").unwrap();

        assertEquals("E(T(F(id) T'()) E'(+ T(F(id) T'(* F(id) T'())) E'()))", tree.toString());
        assertFalse(tree.child(0).contains("*"));
        assertTrue(tree.child(1).child(1).contains("*"));
        assertEquals(List.of("id", "+", "id", "*", "id"), tree.leaves());
    }

    @Test
    void parse_parenthesized_succeeds() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = driver.parse("( id + id ) * id");

        assertTrue(outcome.isAccepted());
        assertTrue(outcome.trace().isEmpty());
    }

    @Test
    void parse_lexemes_carriedIntoLeaves() {
        var driver = Ll1Driver.create(expressionTable());
        var tokens = List.of(new Token("id", "x", 0), new Token("+", "+", 2), new Token("id", "y", 4));

        var tree = driver.parse(tokens).unwrap();

        assertEquals(List.of("x", "+", "y"), tree.leaves());
    }

    @Test
    void parse_explicitEndMarker_isAccepted() {
        var driver = Ll1Driver.create(expressionTable());

        assertTrue(driver.parse(Token.sequence("id", "$")).isAccepted());
    }

    @Test
    void parse_emptyCell_reportsRowTerminals() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = driver.parse("id id");

        var error = assertInstanceOf(SyntaxError.UnexpectedToken.class, outcome.failure().orElseThrow());
        assertEquals(2, error.position());
        assertEquals("id", error.found());
        assertEquals(List.of("+", "*", ")", "$"), error.expected());
    }

    @Test
    void parse_failure_keepsPartialTree() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = assertInstanceOf(ParseOutcome.Rejected.class, driver.parse("id id"));

        var partial = outcome.partialTree().orElseThrow();
        assertEquals("E", partial.name());
        assertEquals(List.of("id"), partial.leaves());
    }

    @Test
    void parse_prematureEnd_reportsUnexpectedEnd() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = driver.parse("id +");

        var error = assertInstanceOf(SyntaxError.UnexpectedEnd.class, outcome.failure().orElseThrow());
        assertEquals(3, error.position());
        assertEquals(List.of("(", "id"), error.expected());
    }

    @Test
    void parse_unclosedParenthesis_reportsExpectedTerminal() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = driver.parse("( id");

        var error = assertInstanceOf(SyntaxError.UnexpectedEnd.class, outcome.failure().orElseThrow());
        assertEquals(3, error.position());
        assertEquals(List.of(")"), error.expected());
    }

    @Test
    void parse_emptyInput_rejected() {
        var driver = Ll1Driver.create(expressionTable());

        var outcome = driver.parse(List.of());

        var error = assertInstanceOf(SyntaxError.UnexpectedEnd.class, outcome.failure().orElseThrow());
        assertEquals(0, error.position());
        assertThrows(CfgException.class, outcome::unwrap);
    }

    @Test
    void parse_withTrace_recordsEveryStep() {
        var driver = Ll1Driver.create(expressionTable(), ParserConfig.DEFAULT.withTrace(true));

        var trace = driver.parse("id").trace();

        assertEquals(List.of("Apply E -> T E'",
                             "Apply T -> F T'",
                             "Apply F -> id",
                             "Match id",
                             "Apply T' -> ε",
                             "Apply E' -> ε",
                             "Accept"),
                     trace.stream().map(TraceStep::action).toList());
        assertEquals(List.of("$", "E"), trace.get(0).stack());
        assertEquals(List.of("id", "$"), trace.get(0).input());
        assertEquals(List.of("$"), trace.get(trace.size() - 1).input());
    }

    @Test
    void create_conflictedTable_throws() {
        var prepared = GrammarTransformer.prepareForLl1(GrammarParser.parse(SampleGrammars.DANGLING_ELSE));
        var table = Ll1TableBuilder.build(prepared, SetSolver.solve(prepared));

        var ex = assertThrows(CfgException.class, () -> Ll1Driver.create(table));

        assertInstanceOf(TableConflictError.class, ex.error());
    }

    @Test
    void parse_reservedTokenType_isRejected() {
        var driver = Ll1Driver.create(expressionTable());

        assertThrows(IllegalArgumentException.class, () -> driver.parse(Token.sequence("$", "id")));
    }

    private static Ll1Table expressionTable() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1);
        return Ll1TableBuilder.build(grammar, SetSolver.solve(grammar));
    }
}
