package org.pragmatica.cfg.table;

import org.pragmatica.cfg.analysis.GrammarSets;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the LL(1) table: {@code A -> α} goes to every cell {@code [A, a]} with {@code a ∈ FIRST(α)}, and,
 * when α is nullable, to every {@code [A, b]} with {@code b ∈ FOLLOW(A)} (end marker included).
 * A cell claimed twice is reported, never overwritten.
 */
public final class Ll1TableBuilder {
    private Ll1TableBuilder() {}

    public static Ll1Table build(Grammar grammar, GrammarSets sets) {
        var claims = new LinkedHashMap<Symbol, Map<Symbol, Set<Production>>>();
        for (var nonterminal : grammar.nonterminals()) {
            claims.put(nonterminal, new LinkedHashMap<>());
        }
        for (var production : grammar.productions()) {
            var row = claims.get(production.lhs());
            var first = sets.firstOf(production.rhs());
            for (var terminal : first) {
                if (!terminal.equals(Symbol.EPSILON)) {
                    claim(row, terminal, production);
                }
            }
            if (first.contains(Symbol.EPSILON)) {
                for (var terminal : sets.follow(production.lhs())) {
                    claim(row, terminal, production);
                }
            }
        }

        var rows = new LinkedHashMap<Symbol, Map<Symbol, Production>>();
        var conflicts = new ArrayList<Conflict>();
        claims.forEach((nonterminal, row) -> {
            var cells = new LinkedHashMap<Symbol, Production>();
            row.forEach((lookahead, productions) -> {
                cells.put(lookahead,
                          productions.iterator()
                                     .next());
                if (productions.size() > 1) {
                    conflicts.add(new Conflict.Ll1Cell(nonterminal, lookahead, new ArrayList<>(productions)));
                }
            });
            rows.put(nonterminal, cells);
        });
        return new Ll1Table(grammar, sets, rows, conflicts);
    }

    private static void claim(Map<Symbol, Set<Production>> row, Symbol lookahead, Production production) {
        row.computeIfAbsent(lookahead, k -> new LinkedHashSet<>())
           .add(production);
    }
}
