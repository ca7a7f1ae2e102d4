package org.pragmatica.cfg.analysis;

import org.pragmatica.cfg.grammar.Symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable Nullable/FIRST/FOLLOW snapshot of one grammar, as produced by {@link SetSolver}.
 *
 * <p>FIRST sets may contain {@link Symbol#EPSILON}; FOLLOW sets may contain {@link Symbol#END}.
 * Terminals (and the end marker) have FIRST equal to themselves and are never nullable.
 */
public record GrammarSets(
 Set<Symbol> nullable,
 Map<Symbol, Set<Symbol>> first,
 Map<Symbol, Set<Symbol>> follow) {

    public GrammarSets {
        nullable = Collections.unmodifiableSet(new LinkedHashSet<>(nullable));
        first = freeze(first);
        follow = freeze(follow);
    }

    public static GrammarSets empty() {
        return new GrammarSets(Set.of(), Map.of(), Map.of());
    }

    public boolean nullable(Symbol symbol) {
        return nullable.contains(symbol);
    }

    /**
     * True if every symbol of the sequence is nullable (vacuously true when empty).
     */
    public boolean nullable(List<Symbol> symbols) {
        return symbols.stream()
                      .allMatch(nullable::contains);
    }

    public Set<Symbol> first(Symbol symbol) {
        if (symbol.isTerminal()) {
            return Set.of(symbol);
        }
        return first.getOrDefault(symbol, Set.of());
    }

    /**
     * FIRST of a symbol sequence; contains epsilon iff the whole sequence is nullable.
     */
    public Set<Symbol> firstOf(List<Symbol> symbols) {
        var result = new LinkedHashSet<Symbol>();
        for (var symbol : symbols) {
            for (var terminal : first(symbol)) {
                if (!terminal.equals(Symbol.EPSILON)) {
                    result.add(terminal);
                }
            }
            if (!nullable(symbol)) {
                return result;
            }
        }
        result.add(Symbol.EPSILON);
        return result;
    }

    public Set<Symbol> follow(Symbol nonterminal) {
        return follow.getOrDefault(nonterminal, Set.of());
    }

    private static Map<Symbol, Set<Symbol>> freeze(Map<Symbol, Set<Symbol>> sets) {
        var copy = new LinkedHashMap<Symbol, Set<Symbol>>();
        sets.forEach((symbol, set) -> copy.put(symbol, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
        return Collections.unmodifiableMap(copy);
    }
}
