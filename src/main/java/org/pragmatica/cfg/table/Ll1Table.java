package org.pragmatica.cfg.table;

import org.pragmatica.cfg.analysis.GrammarSets;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Predictive parse table mapping (nonterminal, lookahead terminal) to a production.
 * A conflicting cell holds its first claimant for display; the claim list is in {@link #conflicts()}.
 */
public final class Ll1Table implements ParseTable {
    private final Grammar grammar;
    private final GrammarSets sets;
    private final Map<Symbol, Map<Symbol, Production>> rows;
    private final List<Conflict> conflicts;

    Ll1Table(Grammar grammar, GrammarSets sets, Map<Symbol, Map<Symbol, Production>> rows, List<Conflict> conflicts) {
        this.grammar = grammar;
        this.sets = sets;
        var copy = new LinkedHashMap<Symbol, Map<Symbol, Production>>();
        rows.forEach((nonterminal, row) -> copy.put(nonterminal, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        this.rows = Collections.unmodifiableMap(copy);
        this.conflicts = List.copyOf(conflicts);
    }

    @Override
    public Grammar grammar() {
        return grammar;
    }

    public GrammarSets sets() {
        return sets;
    }

    @Override
    public List<Conflict> conflicts() {
        return conflicts;
    }

    public Optional<Production> cell(Symbol nonterminal, Symbol lookahead) {
        return Optional.ofNullable(rows.getOrDefault(nonterminal, Map.of())
                                       .get(lookahead));
    }

    /**
     * Lookaheads with an entry in the nonterminal's row, in column order.
     */
    public List<Symbol> expected(Symbol nonterminal) {
        var row = rows.getOrDefault(nonterminal, Map.of());
        return columns().stream()
                        .filter(row::containsKey)
                        .toList();
    }

    /**
     * Terminals in declaration order followed by the end marker.
     */
    public List<Symbol> columns() {
        var columns = new ArrayList<>(grammar.terminals());
        columns.add(Symbol.END);
        return columns;
    }

    /**
     * Grid view keyed by nonterminal, then lookahead; rows in declaration order.
     */
    public Map<Symbol, Map<Symbol, Production>> rows() {
        return rows;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        rows.forEach((nonterminal, row) -> {
            sb.append(nonterminal)
              .append(':');
            for (var column : columns()) {
                var production = row.get(column);
                if (production != null) {
                    sb.append("  [")
                      .append(column)
                      .append("] ")
                      .append(production.body());
                }
            }
            sb.append('\n');
        });
        return sb.toString();
    }
}
