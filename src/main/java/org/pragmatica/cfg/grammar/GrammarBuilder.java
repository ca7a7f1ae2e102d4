package org.pragmatica.cfg.grammar;

import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.GrammarError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for grammars with explicitly declared symbols.
 *
 * <pre>{@code
 * var grammar = Grammar.builder()
 *     .nonterminal("E", "T")
 *     .terminal("+", "id")
 *     .production("E", "E", "+", "T")
 *     .production("E", "T")
 *     .production("T", "id")
 *     .build();
 * }</pre>
 *
 * <p>The first declared nonterminal is the start symbol unless {@link #start(String)} is called.
 * A name used in a production but never declared is reported as {@link GrammarError.UndeclaredSymbol}.
 */
public final class GrammarBuilder {
    private final Set<String> terminals = new LinkedHashSet<>();
    private final Set<String> nonterminals = new LinkedHashSet<>();
    private final List<PendingProduction> productions = new ArrayList<>();
    private String start;

    private record PendingProduction(String lhs, List<String> rhs) {}

    GrammarBuilder() {}

    public GrammarBuilder terminal(String... names) {
        terminals.addAll(List.of(names));
        return this;
    }

    public GrammarBuilder nonterminal(String... names) {
        nonterminals.addAll(List.of(names));
        return this;
    }

    public GrammarBuilder start(String name) {
        this.start = name;
        return this;
    }

    /**
     * Add {@code lhs -> rhs}. No RHS symbols means an epsilon production.
     */
    public GrammarBuilder production(String lhs, String... rhs) {
        return production(lhs, List.of(rhs));
    }

    public GrammarBuilder production(String lhs, List<String> rhs) {
        productions.add(new PendingProduction(lhs, List.copyOf(rhs)));
        return this;
    }

    /**
     * Build and validate the grammar.
     *
     * @throws CfgException listing every {@link GrammarError} found
     */
    public Grammar build() {
        var errors = new ArrayList<GrammarError>();
        for (var name : terminals) {
            if (nonterminals.contains(name)) {
                errors.add(new GrammarError.DuplicateDeclaration(name));
            }
        }
        var resolved = new ArrayList<Production>(productions.size());
        for (var pending : productions) {
            var text = pending.lhs() + " -> " + (pending.rhs()
                                                        .isEmpty()
                                                 ? Symbol.EPSILON.name()
                                                 : String.join(" ", pending.rhs()));
            if (!nonterminals.contains(pending.lhs())) {
                errors.add(new GrammarError.UndeclaredSymbol(pending.lhs(), text));
                continue;
            }
            var rhs = new ArrayList<Symbol>(pending.rhs()
                                                   .size());
            for (var name : pending.rhs()) {
                if (nonterminals.contains(name)) {
                    rhs.add(Symbol.nonterminal(name));
                } else if (terminals.contains(name)) {
                    rhs.add(Symbol.terminal(name));
                } else {
                    errors.add(new GrammarError.UndeclaredSymbol(name, text));
                }
            }
            resolved.add(new Production(Symbol.nonterminal(pending.lhs()), rhs));
        }
        if (nonterminals.isEmpty()) {
            errors.add(new GrammarError.UndeclaredStart(start == null
                                                        ? "<none>"
                                                        : start));
        }
        if (!errors.isEmpty()) {
            throw new CfgException(errors);
        }
        var startName = start == null
                        ? nonterminals.iterator()
                                      .next()
                        : start;
        return new Grammar(terminals.stream()
                                    .map(Symbol::terminal)
                                    .toList(),
                           nonterminals.stream()
                                       .map(Symbol::nonterminal)
                                       .toList(),
                           resolved,
                           Symbol.nonterminal(startName));
    }
}
