package org.pragmatica.cfg.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A production {@code lhs -> rhs}. An empty RHS is the epsilon production.
 */
public record Production(Symbol lhs, List<Symbol> rhs) {

    public Production {
        Objects.requireNonNull(lhs, "lhs");
        if (!lhs.isNonterminal()) {
            throw new IllegalArgumentException("Production LHS must be a nonterminal: " + lhs);
        }
        rhs = List.copyOf(rhs);
    }

    public static Production of(Symbol lhs, Symbol... rhs) {
        return new Production(lhs, List.of(rhs));
    }

    public boolean isEpsilon() {
        return rhs.isEmpty();
    }

    public int length() {
        return rhs.size();
    }

    public boolean startsWith(Symbol symbol) {
        return !rhs.isEmpty() && rhs.get(0).equals(symbol);
    }

    /**
     * RHS from {@code index} to the end.
     */
    public List<Symbol> suffix(int index) {
        return rhs.subList(Math.min(index, rhs.size()), rhs.size());
    }

    /**
     * RHS rendered in grammar notation, {@code ε} when empty.
     */
    public String body() {
        return rhs.isEmpty()
               ? Symbol.EPSILON.name()
               : rhs.stream()
                    .map(Symbol::name)
                    .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return lhs.name() + " -> " + body();
    }
}
