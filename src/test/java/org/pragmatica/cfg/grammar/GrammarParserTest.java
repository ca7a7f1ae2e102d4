package org.pragmatica.cfg.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.SampleGrammars;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.GrammarError;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarParserTest {

    @Test
    void parse_expressionGrammar_classifiesSymbols() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS);

        assertEquals(List.of("E", "T", "F"), names(grammar.nonterminals()));
        assertEquals(List.of("+", "*", "(", ")", "id"), names(grammar.terminals()));
        assertEquals(Symbol.nonterminal("E"), grammar.start());
        assertEquals(6, grammar.productions().size());
    }

    @Test
    void parse_alternatives_keepDeclarationOrder() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS);

        var alternatives = grammar.productionsOf(Symbol.nonterminal("F"));
        assertEquals(2, alternatives.size());
        assertEquals("F -> ( E )", alternatives.get(0).toString());
        assertEquals("F -> id", alternatives.get(1).toString());
    }

    @Test
    void parse_epsilonSpellings_produceEmptyBody() {
        var grammar = GrammarParser.parse("""
            L -> x L | ε
            M -> y | epsilon
            """);

        assertTrue(grammar.productionsOf(Symbol.nonterminal("L")).get(1).isEpsilon());
        assertTrue(grammar.productionsOf(Symbol.nonterminal("M")).get(1).isEpsilon());
    }

    @Test
    void parse_repeatedLhs_appendsAlternatives() {
        var grammar = GrammarParser.parse("""
            A -> a
            A -> b
            """);

        assertEquals(2, grammar.productionsOf(Symbol.nonterminal("A")).size());
    }

    @Test
    void parse_startDirective_overridesFirstLhs() {
        var grammar = GrammarParser.parse("""
            %start B
            A -> a
            B -> A b
            """);

        assertEquals(Symbol.nonterminal("B"), grammar.start());
    }

    @Test
    void parse_quotedName_isTerminal() {
        var grammar = GrammarParser.parse("""
            S -> 'if' C 'then' S | x
            C -> c
            """);

        assertEquals(List.of("if", "then", "x", "c"), names(grammar.terminals()));
    }

    @Test
    void parse_quotedNameOfNonterminal_reportsClashAtQuote() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("E -> 'E' x | y"));

        var error = assertInstanceOf(GrammarError.MalformedNotation.class, ex.error());
        assertEquals(1, error.span().start().line());
        assertEquals(6, error.span().start().column());
        assertTrue(error.reason().contains("'E'"));
    }

    @Test
    void parse_quotedAndBareTerminal_shareOneSymbol() {
        var grammar = GrammarParser.parse("S -> 'x' S | x");

        assertEquals(List.of("x"), names(grammar.terminals()));
    }

    @Test
    void parse_commentsAndBlankLines_areIgnored() {
        var grammar = GrammarParser.parse("""
            # statements

            S -> a   # the only one
            """);

        assertEquals(1, grammar.productions().size());
    }

    @Test
    void parse_printedGrammar_readsBackEqual() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1);

        assertEquals(grammar, GrammarParser.parse(grammar.toString()));
    }

    @Test
    void parse_missingArrow_reportsLineAndColumn() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("""
            A -> a
            T b
            """));

        var error = assertInstanceOf(GrammarError.MalformedNotation.class, ex.error());
        assertEquals(2, error.span().start().line());
        assertEquals(3, error.span().start().column());
        assertTrue(error.reason().contains("'->'"));
    }

    @Test
    void parse_severalBadLines_reportsEveryOne() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("""
            A a
            B b
            """));

        assertEquals(2, ex.errors().size());
    }

    @Test
    void parse_emptyText_fails() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("# nothing here\n"));

        var error = assertInstanceOf(GrammarError.MalformedNotation.class, ex.error());
        assertEquals("Grammar contains no productions", error.reason());
    }

    @Test
    void parse_epsilonWithSymbols_fails() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("A -> a ε"));

        assertInstanceOf(GrammarError.MalformedNotation.class, ex.error());
    }

    @Test
    void parse_unknownStart_failsWithUndeclaredStart() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("""
            %start X
            A -> a
            """));

        assertInstanceOf(GrammarError.UndeclaredStart.class, ex.error());
    }

    @Test
    void parse_reservedName_failsWithReservedSymbol() {
        var ex = assertThrows(CfgException.class, () -> GrammarParser.parse("A -> a $"));

        assertInstanceOf(GrammarError.ReservedSymbol.class, ex.error());
    }

    private static List<String> names(List<Symbol> symbols) {
        return symbols.stream().map(Symbol::name).toList();
    }
}
