package org.pragmatica.cfg.automaton;

import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical collection of LR(0) item sets over an augmented grammar.
 *
 * @param grammar      augmented grammar; its start symbol is the fresh {@code S'}
 * @param augmentation the production {@code S' -> S}
 * @param states       states indexed by id; state 0 is the closure of {@code [S' -> · S]}
 */
public record LrAutomaton(Grammar grammar, Production augmentation, List<LrState> states) {

    public LrAutomaton {
        states = List.copyOf(states);
    }

    /**
     * Start symbol of the grammar before augmentation.
     */
    public Symbol originalStart() {
        return augmentation.rhs()
                           .get(0);
    }

    public LrState state(int id) {
        return states.get(id);
    }

    public int size() {
        return states.size();
    }

    /**
     * All edges, by source state id then discovery order.
     */
    public List<Transition> transitions() {
        var result = new ArrayList<Transition>();
        for (var state : states) {
            state.transitions()
                 .forEach((symbol, target) -> result.add(new Transition(state.id(), symbol, target)));
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var state : states) {
            sb.append(state)
              .append('\n');
        }
        for (var transition : transitions()) {
            sb.append(transition)
              .append('\n');
        }
        return sb.toString();
    }
}
