package org.pragmatica.cfg.table;

import org.pragmatica.cfg.analysis.GrammarSets;
import org.pragmatica.cfg.automaton.LrAutomaton;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LR(0) or SLR(1) ACTION/GOTO table over an {@link LrAutomaton}.
 * A conflicting cell holds its first action for display; every competing action is in {@link #conflicts()}.
 */
public final class LrTable implements ParseTable {
    private final LrAutomaton automaton;
    private final GrammarSets sets;
    private final LrMode mode;
    private final List<Map<Symbol, LrAction>> actions;
    private final List<Map<Symbol, Integer>> gotos;
    private final List<Conflict> conflicts;

    LrTable(LrAutomaton automaton,
            GrammarSets sets,
            LrMode mode,
            List<Map<Symbol, LrAction>> actions,
            List<Map<Symbol, Integer>> gotos,
            List<Conflict> conflicts) {
        this.automaton = automaton;
        this.sets = sets;
        this.mode = mode;
        this.actions = freeze(actions);
        this.gotos = freeze(gotos);
        this.conflicts = List.copyOf(conflicts);
    }

    /**
     * The augmented grammar.
     */
    @Override
    public Grammar grammar() {
        return automaton.grammar();
    }

    public LrAutomaton automaton() {
        return automaton;
    }

    public GrammarSets sets() {
        return sets;
    }

    public LrMode mode() {
        return mode;
    }

    @Override
    public List<Conflict> conflicts() {
        return conflicts;
    }

    public int stateCount() {
        return actions.size();
    }

    public Optional<LrAction> action(int state, Symbol lookahead) {
        return Optional.ofNullable(actions.get(state)
                                          .get(lookahead));
    }

    public Optional<Integer> goTo(int state, Symbol nonterminal) {
        return Optional.ofNullable(gotos.get(state)
                                        .get(nonterminal));
    }

    /**
     * Lookaheads with an action in the given state, in column order.
     */
    public List<Symbol> expected(int state) {
        var row = actions.get(state);
        return actionColumns().stream()
                              .filter(row::containsKey)
                              .toList();
    }

    /**
     * Terminals of the grammar followed by the end marker.
     */
    public List<Symbol> actionColumns() {
        var columns = new ArrayList<>(grammar().terminals());
        columns.add(Symbol.END);
        return columns;
    }

    /**
     * Nonterminals of the original grammar; the augmented start never appears in GOTO.
     */
    public List<Symbol> gotoColumns() {
        var augmented = grammar().start();
        return grammar().nonterminals()
                        .stream()
                        .filter(nonterminal -> !nonterminal.equals(augmented))
                        .toList();
    }

    /**
     * ACTION rows indexed by state id.
     */
    public List<Map<Symbol, LrAction>> actionRows() {
        return actions;
    }

    /**
     * GOTO rows indexed by state id.
     */
    public List<Map<Symbol, Integer>> gotoRows() {
        return gotos;
    }

    /**
     * Ids of states holding a complete item other than the accepting one.
     */
    public List<Integer> reductionStates() {
        var augmentation = automaton.augmentation();
        return automaton.states()
                        .stream()
                        .filter(state -> state.completeItems()
                                              .stream()
                                              .anyMatch(item -> !item.production()
                                                                     .equals(augmentation)))
                        .map(state -> state.id())
                        .toList();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (int state = 0; state < actions.size(); state++) {
            sb.append(state)
              .append(':');
            var actionRow = actions.get(state);
            for (var column : actionColumns()) {
                var action = actionRow.get(column);
                if (action != null) {
                    sb.append("  ")
                      .append(column)
                      .append('=')
                      .append(action);
                }
            }
            gotos.get(state)
                 .forEach((nonterminal, target) -> sb.append("  ")
                                                     .append(nonterminal)
                                                     .append("=g")
                                                     .append(target));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static <V> List<Map<Symbol, V>> freeze(List<Map<Symbol, V>> rows) {
        var result = new ArrayList<Map<Symbol, V>>(rows.size());
        for (var row : rows) {
            result.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(result);
    }
}
