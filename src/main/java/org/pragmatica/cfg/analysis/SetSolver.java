package org.pragmatica.cfg.analysis;

import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Nullable, FIRST and FOLLOW by fixed-point iteration.
 *
 * <p>Each fixpoint is monotone over finite sets, so it stabilises within
 * {@code productions * symbols} passes; the pass guard only protects against a broken invariant.
 */
public final class SetSolver {
    private final Grammar grammar;
    private final int passLimit;
    private final Set<Symbol> nullable;
    private final Map<Symbol, Set<Symbol>> first;
    private final Map<Symbol, Set<Symbol>> follow;

    private SetSolver(Grammar grammar, GrammarSets seed) {
        this.grammar = grammar;
        this.passLimit = grammar.productions()
                                .size() * (grammar.terminals()
                                                  .size() + grammar.nonterminals()
                                                                   .size() + 1) + 2;
        this.nullable = new LinkedHashSet<>(seed.nullable());
        this.first = new LinkedHashMap<>();
        this.follow = new LinkedHashMap<>();
        for (var nonterminal : grammar.nonterminals()) {
            first.put(nonterminal, new LinkedHashSet<>(seed.first(nonterminal)));
            follow.put(nonterminal, new LinkedHashSet<>(seed.follow(nonterminal)));
        }
    }

    /**
     * Compute all three sets from scratch.
     */
    public static GrammarSets solve(Grammar grammar) {
        return resume(grammar, GrammarSets.empty());
    }

    /**
     * Continue iterating from a snapshot previously computed for the same grammar.
     * Resuming from a stable snapshot returns an equal snapshot.
     */
    public static GrammarSets resume(Grammar grammar, GrammarSets seed) {
        var solver = new SetSolver(grammar, seed);
        solver.solveNullable();
        solver.solveFirst();
        solver.solveFollow();
        return new GrammarSets(solver.nullable, solver.first, solver.follow);
    }

    /**
     * Nullable nonterminals only, without FIRST/FOLLOW.
     */
    public static Set<Symbol> nullableOf(Grammar grammar) {
        var solver = new SetSolver(grammar, GrammarSets.empty());
        solver.solveNullable();
        return Set.copyOf(solver.nullable);
    }

    private void solveNullable() {
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            guard(++passes, "Nullable");
            for (var production : grammar.productions()) {
                if (!nullable.contains(production.lhs()) && production.rhs()
                                                                      .stream()
                                                                      .allMatch(nullable::contains)) {
                    nullable.add(production.lhs());
                    changed = true;
                }
            }
        }
    }

    private void solveFirst() {
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            guard(++passes, "FIRST");
            var current = snapshot();
            for (var production : grammar.productions()) {
                var target = first.get(production.lhs());
                if (target.addAll(current.firstOf(production.rhs()))) {
                    changed = true;
                }
            }
        }
    }

    private void solveFollow() {
        follow.get(grammar.start())
              .add(Symbol.END);
        var sets = snapshot();
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            guard(++passes, "FOLLOW");
            for (var production : grammar.productions()) {
                var rhs = production.rhs();
                for (int i = 0; i < rhs.size(); i++) {
                    var symbol = rhs.get(i);
                    if (!symbol.isNonterminal()) {
                        continue;
                    }
                    var target = follow.get(symbol);
                    var rest = production.suffix(i + 1);
                    for (var terminal : sets.firstOf(rest)) {
                        if (!terminal.equals(Symbol.EPSILON) && target.add(terminal)) {
                            changed = true;
                        }
                    }
                    if (sets.nullable(rest) && target.addAll(follow.get(production.lhs()))) {
                        changed = true;
                    }
                }
            }
        }
    }

    // Immutable copy of the current approximation for FIRST-of-sequence lookups.
    private GrammarSets snapshot() {
        return new GrammarSets(nullable, first, Map.of());
    }

    private void guard(int passes, String what) {
        if (passes > passLimit) {
            throw new IllegalStateException(what + " computation did not stabilise within " + passLimit + " passes");
        }
    }
}
