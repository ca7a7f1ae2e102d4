package org.pragmatica.cfg.table;

import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A table cell claimed by more than one action.
 */
public sealed interface Conflict {

    String describe();

    enum Kind {
        SHIFT_REDUCE,
        REDUCE_REDUCE
    }

    /**
     * LL(1) cell with every production competing for it, in declaration order.
     */
    record Ll1Cell(Symbol nonterminal, Symbol lookahead, List<Production> productions) implements Conflict {
        public Ll1Cell {
            productions = List.copyOf(productions);
        }

        @Override
        public String describe() {
            return "LL(1) conflict at [" + nonterminal + ", " + lookahead + "]: " + productions.stream()
                                                                                           .map(Production::toString)
                                                                                           .collect(Collectors.joining(" | "));
        }
    }

    /**
     * LR cell with every action competing for it; shift first, then reductions in item order.
     */
    record LrCell(int state, Symbol lookahead, Kind kind, List<LrAction> actions) implements Conflict {
        public LrCell {
            actions = List.copyOf(actions);
        }

        @Override
        public String describe() {
            var label = kind == Kind.SHIFT_REDUCE
                        ? "shift-reduce"
                        : "reduce-reduce";
            return label + " conflict in state " + state + " on '" + lookahead + "': " + actions.stream()
                                                                                          .map(LrAction::toString)
                                                                                          .collect(Collectors.joining(", "));
        }
    }
}
