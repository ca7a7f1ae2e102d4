package org.pragmatica.cfg.automaton;

import org.pragmatica.cfg.grammar.Symbol;

/**
 * Edge of the automaton graph.
 */
public record Transition(int from, Symbol symbol, int to) {
    @Override
    public String toString() {
        return from + " --" + symbol + "--> " + to;
    }
}
