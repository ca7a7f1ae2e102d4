package org.pragmatica.cfg.grammar;

import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.GrammarError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A context-free grammar: ordered terminals, ordered nonterminals, ordered productions and a start symbol.
 *
 * <p>Construction validates the grammar and fails with a {@link CfgException} listing every
 * {@link GrammarError} found. Identical productions are kept once, in the position of their first occurrence.
 * Instances are immutable; transformations return new grammars.
 */
public record Grammar(
 List<Symbol> terminals,
 List<Symbol> nonterminals,
 List<Production> productions,
 Symbol start) {

    public Grammar {
        terminals = List.copyOf(new LinkedHashSet<>(terminals));
        nonterminals = List.copyOf(new LinkedHashSet<>(nonterminals));
        productions = List.copyOf(new LinkedHashSet<>(productions));
        var errors = check(terminals, nonterminals, productions, start);
        if (!errors.isEmpty()) {
            throw new CfgException(errors);
        }
    }

    public static GrammarBuilder builder() {
        return new GrammarBuilder();
    }

    // === Lookup ===

    /**
     * Productions of the given nonterminal in declaration order.
     */
    public List<Production> productionsOf(Symbol nonterminal) {
        return productions.stream()
                          .filter(p -> p.lhs()
                                        .equals(nonterminal))
                          .toList();
    }

    /**
     * All productions grouped by LHS, nonterminals in declaration order.
     */
    public Map<Symbol, List<Production>> productionsByLhs() {
        var result = new LinkedHashMap<Symbol, List<Production>>();
        for (var nonterminal : nonterminals) {
            result.put(nonterminal, new ArrayList<>());
        }
        for (var production : productions) {
            result.get(production.lhs())
                  .add(production);
        }
        result.replaceAll((k, v) -> List.copyOf(v));
        return result;
    }

    public Optional<Symbol> symbol(String name) {
        return nonterminals.stream()
                           .filter(s -> s.name()
                                         .equals(name))
                           .findFirst()
                           .or(() -> terminals.stream()
                                              .filter(s -> s.name()
                                                            .equals(name))
                                              .findFirst());
    }

    /**
     * Names of all declared symbols.
     */
    public Set<String> names() {
        var names = new HashSet<String>();
        terminals.forEach(t -> names.add(t.name()));
        nonterminals.forEach(n -> names.add(n.name()));
        return names;
    }

    /**
     * Deterministic fresh nonterminal name derived from {@code base}: {@code base'}, {@code base''}, ...
     */
    public String freshName(String base) {
        var taken = names();
        var candidate = base + "'";
        while (taken.contains(candidate)) {
            candidate += "'";
        }
        return candidate;
    }

    // === Analysis ===

    /**
     * Nonterminals reachable from the start symbol, in discovery order.
     */
    public Set<Symbol> reachable() {
        var byLhs = productionsByLhs();
        var reached = new LinkedHashSet<Symbol>();
        var queue = new ArrayDeque<Symbol>();
        reached.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            for (var production : byLhs.get(queue.poll())) {
                for (var symbol : production.rhs()) {
                    if (symbol.isNonterminal() && reached.add(symbol)) {
                        queue.add(symbol);
                    }
                }
            }
        }
        return reached;
    }

    /**
     * Non-fatal findings on an otherwise valid grammar. Currently reports unreachable nonterminals.
     */
    public List<GrammarError> validate() {
        var reached = reachable();
        return nonterminals.stream()
                           .filter(n -> !reached.contains(n))
                           .<GrammarError>map(n -> new GrammarError.UnreachableNonterminal(n.name()))
                           .toList();
    }

    /**
     * True if some production of a nonterminal starts with that same nonterminal.
     */
    public boolean hasImmediateLeftRecursion() {
        return productions.stream()
                          .anyMatch(p -> p.startsWith(p.lhs()));
    }

    private static List<GrammarError> check(List<Symbol> terminals,
                                            List<Symbol> nonterminals,
                                            List<Production> productions,
                                            Symbol start) {
        var errors = new ArrayList<GrammarError>();
        var terminalNames = terminals.stream()
                                     .map(Symbol::name)
                                     .collect(Collectors.toSet());
        for (var symbol : terminals) {
            if (!symbol.isTerminal()) {
                errors.add(new GrammarError.DuplicateDeclaration(symbol.name()));
            }
        }
        for (var symbol : nonterminals) {
            if (!symbol.isNonterminal() || terminalNames.contains(symbol.name())) {
                errors.add(new GrammarError.DuplicateDeclaration(symbol.name()));
            }
        }
        for (var symbol : terminals) {
            if (symbol.isReserved()) {
                errors.add(new GrammarError.ReservedSymbol(symbol.name()));
            }
        }
        for (var symbol : nonterminals) {
            if (symbol.isReserved()) {
                errors.add(new GrammarError.ReservedSymbol(symbol.name()));
            }
        }
        if (start == null || !nonterminals.contains(start)) {
            errors.add(new GrammarError.UndeclaredStart(start == null
                                                        ? "<none>"
                                                        : start.name()));
        }
        var withProductions = new HashSet<Symbol>();
        for (var production : productions) {
            if (!nonterminals.contains(production.lhs())) {
                errors.add(new GrammarError.UndeclaredSymbol(production.lhs()
                                                                       .name(),
                                                             production.toString()));
            }
            withProductions.add(production.lhs());
            for (var symbol : production.rhs()) {
                var declared = symbol.isTerminal()
                               ? terminals.contains(symbol)
                               : nonterminals.contains(symbol);
                if (!declared) {
                    errors.add(new GrammarError.UndeclaredSymbol(symbol.name(), production.toString()));
                }
            }
        }
        for (var nonterminal : nonterminals) {
            if (!withProductions.contains(nonterminal)) {
                errors.add(new GrammarError.MissingProductions(nonterminal.name()));
            }
        }
        return errors;
    }

    /**
     * Grammar in notation form, one line per nonterminal: {@code A -> x y | z | ε}.
     */
    @Override
    public String toString() {
        var lines = new ArrayList<String>();
        productionsByLhs().forEach((lhs, alternatives) -> lines.add(lhs.name() + " -> " + alternatives.stream()
                                                                                                     .map(Production::body)
                                                                                                     .collect(Collectors.joining(" | "))));
        return String.join("\n", lines);
    }
}
