package org.pragmatica.cfg.transform;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.SampleGrammars;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.TransformError;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GrammarTransformerTest {

    @Test
    void eliminateLeftRecursion_expressionGrammar_yieldsClassicForm() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS);

        var result = GrammarTransformer.eliminateLeftRecursion(grammar);

        assertEquals(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1), result);
    }

    @Test
    void eliminateLeftRecursion_noRecursion_returnsInput() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1);

        assertSame(grammar, GrammarTransformer.eliminateLeftRecursion(grammar));
    }

    @Test
    void eliminateLeftRecursion_indirectRecursion_isRemoved() {
        var grammar = GrammarParser.parse("""
            S -> A a | b
            A -> S c | d
            """);

        var result = GrammarTransformer.eliminateLeftRecursion(grammar);

        assertTrue(GrammarTransformer.leftRecursive(result).isEmpty());
        assertEquals("""
                     S -> A a | b
                     A -> b c A' | d A'
                     A' -> a c A' | ε""", result.toString());
    }

    @Test
    void eliminateLeftRecursion_onlyRecursiveAlternatives_introducesPrimeOnly() {
        var grammar = GrammarParser.parse("""
            S -> x A
            A -> A a
            """);

        var result = GrammarTransformer.eliminateLeftRecursion(grammar);

        assertEquals("""
                     S -> x A
                     A -> A'
                     A' -> a A' | ε""", result.toString());
    }

    @Test
    void eliminateLeftRecursion_selfLoopAlternative_isDropped() {
        var grammar = GrammarParser.parse("A -> A | A b | c");

        var result = GrammarTransformer.eliminateLeftRecursion(grammar);

        assertEquals("""
                     A -> c A'
                     A' -> b A' | ε""", result.toString());
    }

    @Test
    void eliminateLeftRecursion_primeAlreadyTaken_picksNextName() {
        var grammar = GrammarParser.parse("""
            E -> E + E' | E'
            E' -> id
            """);

        var result = GrammarTransformer.eliminateLeftRecursion(grammar);

        assertTrue(result.symbol("E''").isPresent());
    }

    @Test
    void eliminateLeftRecursion_recursionThroughNullablePrefix_diverges() {
        var grammar = GrammarParser.parse("""
            A -> B A x | y
            B -> b | ε
            """);

        var ex = assertThrows(CfgException.class, () -> GrammarTransformer.eliminateLeftRecursion(grammar));

        var error = assertInstanceOf(TransformError.EliminationDiverged.class, ex.error());
        assertTrue(error.remaining().contains("A"));
    }

    @Test
    void leftRecursive_nullablePrefix_isDetected() {
        var grammar = GrammarParser.parse("""
            A -> B A x | y
            B -> b | ε
            """);

        assertEquals(Set.of(Symbol.nonterminal("A")), GrammarTransformer.leftRecursive(grammar));
    }

    @Test
    void leftFactor_danglingElse_factorsLongestPrefix() {
        var grammar = GrammarParser.parse(SampleGrammars.DANGLING_ELSE);

        var result = GrammarTransformer.leftFactor(grammar);

        assertEquals("""
                     S -> i E t S S' | a
                     S' -> ε | e S
                     E -> b""", result.toString());
    }

    @Test
    void leftFactor_nestedPrefixes_reachesFixpoint() {
        var grammar = GrammarParser.parse("A -> a b c | a b d | a e");

        var result = GrammarTransformer.leftFactor(grammar);

        assertEquals("""
                     A -> a A''
                     A'' -> b A' | e
                     A' -> c | d""", result.toString());
    }

    @Test
    void leftFactor_appliedTwice_isIdempotent() {
        var grammar = GrammarParser.parse("A -> a b c | a b d | a e | f");

        var once = GrammarTransformer.leftFactor(grammar);
        var twice = GrammarTransformer.leftFactor(once);

        assertEquals(once, twice);
    }

    @Test
    void sharedPrefix_tie_goesToEarliestPair() {
        var a = Symbol.terminal("a");
        var b = Symbol.terminal("b");
        var x = Symbol.terminal("x");
        var y = Symbol.terminal("y");

        var prefix = GrammarTransformer.sharedPrefix(List.of(List.of(a, x), List.of(b, y), List.of(a, y), List.of(b, x)));

        assertEquals(Optional.of(List.of(a)), prefix);
    }

    @Test
    void prepareForLl1_expressionGrammar_needsNoFurtherPreparation() {
        var grammar = GrammarParser.parse(SampleGrammars.EXPRESSIONS);

        assertTrue(GrammarTransformer.needsLl1Preparation(grammar));
        var prepared = GrammarTransformer.prepareForLl1(grammar);
        assertFalse(GrammarTransformer.needsLl1Preparation(prepared));
    }
}
