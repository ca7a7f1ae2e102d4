package org.pragmatica.cfg.automaton;

import org.pragmatica.cfg.grammar.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of the canonical LR(0) collection: a closure-complete item set with a stable id
 * and its transition function.
 *
 * <p>Two states are equal iff their item sets are equal; ids and transitions do not take part.
 * Items keep their discovery order (kernel first, then closure) for display only.
 */
public final class LrState {
    private final int id;
    private final Set<Item> items;
    private final Map<Symbol, Integer> transitions;

    LrState(int id, Set<Item> items, Map<Symbol, Integer> transitions) {
        this.id = id;
        this.items = Collections.unmodifiableSet(new LinkedHashSet<>(items));
        this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    public int id() {
        return id;
    }

    public Set<Item> items() {
        return items;
    }

    /**
     * Successor state ids keyed by symbol, in the order the transitions were discovered.
     */
    public Map<Symbol, Integer> transitions() {
        return transitions;
    }

    public Optional<Integer> successor(Symbol symbol) {
        return Optional.ofNullable(transitions.get(symbol));
    }

    public List<Item> completeItems() {
        return items.stream()
                    .filter(Item::isComplete)
                    .toList();
    }

    /**
     * Items whose dot is past position zero; for the initial state, the augmented start item.
     */
    public List<Item> kernel() {
        if (id == 0) {
            return List.of(items.iterator()
                                .next());
        }
        return items.stream()
                    .filter(item -> item.dot() > 0)
                    .toList();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LrState other && items.equals(other.items));
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("I").append(id)
                                       .append(':');
        for (var item : items) {
            sb.append("\n  ")
              .append(item);
        }
        return sb.toString();
    }
}
