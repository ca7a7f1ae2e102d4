package org.pragmatica.cfg.table;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.SampleGrammars;
import org.pragmatica.cfg.analysis.SetSolver;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.transform.GrammarTransformer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Ll1TableBuilderTest {
    private static final Symbol E = Symbol.nonterminal("E");
    private static final Symbol E1 = Symbol.nonterminal("E'");
    private static final Symbol T1 = Symbol.nonterminal("T'");
    private static final Symbol F = Symbol.nonterminal("F");

    @Test
    void build_expressionGrammar_isConflictFree() {
        var table = build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        assertTrue(table.isDeterministic());
        assertTrue(table.conflicts().isEmpty());
    }

    @Test
    void build_expressionGrammar_placesProductions() {
        var table = build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        assertEquals("E -> T E'", table.cell(E, Symbol.terminal("id")).orElseThrow().toString());
        assertEquals("E -> T E'", table.cell(E, Symbol.terminal("(")).orElseThrow().toString());
        assertEquals("E' -> + T E'", table.cell(E1, Symbol.terminal("+")).orElseThrow().toString());
        assertEquals("F -> id", table.cell(F, Symbol.terminal("id")).orElseThrow().toString());
        assertTrue(table.cell(E, Symbol.terminal("+")).isEmpty());
    }

    @Test
    void build_nullableAlternative_fillsFollowColumns() {
        var table = build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        assertTrue(table.cell(E1, Symbol.END).orElseThrow().isEpsilon());
        assertTrue(table.cell(E1, Symbol.terminal(")")).orElseThrow().isEpsilon());
        assertTrue(table.cell(T1, Symbol.terminal("+")).orElseThrow().isEpsilon());
    }

    @Test
    void expected_listsRowInColumnOrder() {
        var table = build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        assertEquals(List.of(Symbol.terminal("+"), Symbol.terminal("*"), Symbol.terminal(")"), Symbol.END),
                     table.expected(T1));
    }

    @Test
    void columns_endWithEndMarker() {
        var table = build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        var columns = table.columns();
        assertEquals(Symbol.END, columns.get(columns.size() - 1));
        assertEquals(6, columns.size());
        assertEquals(5, table.rows().size());
    }

    @Test
    void build_danglingElse_reportsCellConflict() {
        var prepared = GrammarTransformer.prepareForLl1(GrammarParser.parse(SampleGrammars.DANGLING_ELSE));

        var table = build(prepared);

        assertFalse(table.isDeterministic());
        assertEquals(1, table.conflicts().size());
        var conflict = assertInstanceOf(Conflict.Ll1Cell.class, table.conflicts().get(0));
        assertEquals("S'", conflict.nonterminal().name());
        assertEquals("e", conflict.lookahead().name());
        assertEquals(2, conflict.productions().size());
        assertEquals(conflict.productions().get(0), table.cell(conflict.nonterminal(), conflict.lookahead()).orElseThrow());
    }

    @Test
    void build_commonPrefixWithoutFactoring_conflicts() {
        var table = build(GrammarParser.parse("S -> a b | a c"));

        assertEquals(1, table.conflicts().size());
        assertTrue(table.conflicts().get(0).describe().startsWith("LL(1) conflict at [S, a]"));
    }

    private static Ll1Table build(Grammar grammar) {
        return Ll1TableBuilder.build(grammar, SetSolver.solve(grammar));
    }
}
