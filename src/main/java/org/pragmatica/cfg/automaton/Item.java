package org.pragmatica.cfg.automaton;

import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.Optional;

/**
 * LR(0) item: a production with a dot position in {@code 0..|rhs|}. Items carry no lookahead.
 */
public record Item(Production production, int dot) {

    public Item {
        if (dot < 0 || dot > production.length()) {
            throw new IllegalArgumentException("Dot " + dot + " outside of " + production);
        }
    }

    public static Item initial(Production production) {
        return new Item(production, 0);
    }

    public Symbol lhs() {
        return production.lhs();
    }

    public boolean isComplete() {
        return dot == production.length();
    }

    /**
     * Symbol immediately after the dot, empty for a complete item.
     */
    public Optional<Symbol> next() {
        return isComplete()
               ? Optional.empty()
               : Optional.of(production.rhs()
                                       .get(dot));
    }

    public Item advance() {
        return new Item(production, dot + 1);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(production.lhs()
                                             .name()).append(" ->");
        var rhs = production.rhs();
        for (int i = 0; i <= rhs.size(); i++) {
            if (i == dot) {
                sb.append(" ·");
            }
            if (i < rhs.size()) {
                sb.append(' ')
                  .append(rhs.get(i)
                             .name());
            }
        }
        return sb.toString();
    }
}
