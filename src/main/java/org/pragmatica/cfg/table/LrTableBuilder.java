package org.pragmatica.cfg.table;

import org.pragmatica.cfg.analysis.GrammarSets;
import org.pragmatica.cfg.automaton.LrAutomaton;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fills ACTION/GOTO from an automaton. Shifts and gotos come from the transitions, reductions from
 * complete items: on every terminal and the end marker in {@link LrMode#LR0}, on FOLLOW of the item's
 * LHS in {@link LrMode#SLR1}. The complete augmentation item installs accept on the end marker.
 *
 * <p>FOLLOW must be computed on the augmented grammar, see {@link LrAutomaton#grammar()}.
 */
public final class LrTableBuilder {
    private LrTableBuilder() {}

    public static LrTable build(LrAutomaton automaton, GrammarSets sets, LrMode mode) {
        var grammar = automaton.grammar();
        var everyLookahead = new ArrayList<>(grammar.terminals());
        everyLookahead.add(Symbol.END);

        var actions = new ArrayList<Map<Symbol, LrAction>>();
        var gotos = new ArrayList<Map<Symbol, Integer>>();
        var conflicts = new ArrayList<Conflict>();

        for (var state : automaton.states()) {
            var claims = new LinkedHashMap<Symbol, Set<LrAction>>();
            var gotoRow = new LinkedHashMap<Symbol, Integer>();
            state.transitions()
                 .forEach((symbol, target) -> {
                     if (symbol.isTerminal()) {
                         claim(claims, symbol, new LrAction.Shift(target));
                     } else {
                         gotoRow.put(symbol, target);
                     }
                 });
            for (var item : state.completeItems()) {
                var production = item.production();
                if (production.equals(automaton.augmentation())) {
                    claim(claims, Symbol.END, new LrAction.Accept());
                    continue;
                }
                Collection<Symbol> lookaheads = mode == LrMode.LR0
                                                ? everyLookahead
                                                : sets.follow(production.lhs());
                for (var lookahead : lookaheads) {
                    claim(claims, lookahead, new LrAction.Reduce(production));
                }
            }

            var actionRow = new LinkedHashMap<Symbol, LrAction>();
            claims.forEach((lookahead, candidates) -> {
                actionRow.put(lookahead,
                              candidates.iterator()
                                        .next());
                if (candidates.size() > 1) {
                    conflicts.add(conflict(state.id(), lookahead, candidates));
                }
            });
            actions.add(actionRow);
            gotos.add(gotoRow);
        }
        return new LrTable(automaton, sets, mode, actions, gotos, conflicts);
    }

    private static void claim(Map<Symbol, Set<LrAction>> claims, Symbol lookahead, LrAction action) {
        claims.computeIfAbsent(lookahead, k -> new LinkedHashSet<>())
              .add(action);
    }

    // Accept counts as a reduce when classifying.
    private static Conflict conflict(int state, Symbol lookahead, Set<LrAction> candidates) {
        var kind = candidates.stream()
                             .anyMatch(action -> action instanceof LrAction.Shift)
                   ? Conflict.Kind.SHIFT_REDUCE
                   : Conflict.Kind.REDUCE_REDUCE;
        return new Conflict.LrCell(state, lookahead, kind, List.copyOf(candidates));
    }
}
