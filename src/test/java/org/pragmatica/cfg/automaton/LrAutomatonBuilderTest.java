package org.pragmatica.cfg.automaton;

import org.junit.jupiter.api.Test;
import org.pragmatica.cfg.SampleGrammars;
import org.pragmatica.cfg.grammar.GrammarParser;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

class LrAutomatonBuilderTest {

    @Test
    void build_expressionGrammar_hasTwelveStates() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.EXPRESSIONS));

        assertEquals(12, automaton.size());
    }

    @Test
    void build_listGrammar_hasNineStates() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.LISTS));

        assertEquals(9, automaton.size());
    }

    @Test
    void build_augmentsWithFreshStart() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.EXPRESSIONS));

        assertEquals("E' -> E", automaton.augmentation().toString());
        assertEquals(Symbol.nonterminal("E'"), automaton.grammar().start());
        assertEquals(Symbol.nonterminal("E"), automaton.originalStart());
    }

    @Test
    void build_primedStartTaken_skipsToNextPrime() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.EXPRESSIONS_LL1));

        assertEquals("E''", automaton.grammar().start().name());
    }

    @Test
    void build_initialState_isClosureOfAugmentation() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.LISTS));

        var initial = automaton.state(0);
        assertEquals(3, initial.items().size());
        assertEquals("S' -> · S", initial.kernel().get(0).toString());
        assertEquals(3, initial.transitions().size());
    }

    @Test
    void build_itemSets_arePairwiseDistinct() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.EXPRESSIONS));

        var seen = new HashSet<>();
        for (var state : automaton.states()) {
            assertTrue(seen.add(state.items()), "duplicate item set in state " + state.id());
        }
    }

    @Test
    void build_transitions_advanceTheDot() {
        var automaton = LrAutomatonBuilder.build(GrammarParser.parse(SampleGrammars.EXPRESSIONS));

        for (var transition : automaton.transitions()) {
            var source = automaton.state(transition.from());
            var target = automaton.state(transition.to());
            for (var item : source.items()) {
                if (item.next().filter(transition.symbol()::equals).isPresent()) {
                    assertTrue(target.items().contains(item.advance()));
                }
            }
        }
    }

    @Test
    void build_sameGrammar_yieldsIdenticalAutomaton() {
        var grammar = GrammarParser.parse(SampleGrammars.DANGLING_ELSE);

        var first = LrAutomatonBuilder.build(grammar);
        var second = LrAutomatonBuilder.build(grammar);

        assertEquals(first.transitions(), second.transitions());
        assertEquals(first.states(), second.states());
    }

    @Test
    void item_dotOutOfRange_isRejected() {
        var grammar = GrammarParser.parse("S -> a");
        var production = grammar.productions().get(0);

        assertThrows(IllegalArgumentException.class, () -> new Item(production, 2));
        assertEquals("S -> a ·", new Item(production, 1).toString());
    }
}
