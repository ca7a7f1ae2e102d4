package org.pragmatica.cfg.transform;

import org.pragmatica.cfg.analysis.SetSolver;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.TransformError;
import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Grammar rewrites needed before LL(1) table construction.
 *
 * <p>Both rewrites return a new grammar and leave their input untouched. Fresh nonterminals are named
 * {@code A'}, {@code A''}, ... after the nonterminal they split from, skipping names already in use,
 * and are declared right after it, so identical input always yields identical output.
 */
public final class GrammarTransformer {
    private GrammarTransformer() {}

    /**
     * Left-recursion elimination followed by left factoring.
     */
    public static Grammar prepareForLl1(Grammar grammar) {
        return leftFactor(eliminateLeftRecursion(grammar));
    }

    /**
     * True if {@link #prepareForLl1(Grammar)} would change the grammar.
     */
    public static boolean needsLl1Preparation(Grammar grammar) {
        if (!leftRecursive(grammar).isEmpty()) {
            return true;
        }
        return grammar.productionsByLhs()
                      .values()
                      .stream()
                      .anyMatch(alternatives -> sharedPrefix(bodies(alternatives)).isPresent());
    }

    // === Left recursion ===

    /**
     * Remove direct and indirect left recursion.
     *
     * <p>Each pass orders the nonterminals A1..An, substitutes into every Ai the alternatives of each Aj (j &lt; i)
     * that begins one of its alternatives, then rewrites immediate recursion {@code Ai -> Ai α | β} into
     * {@code Ai -> β Ai'} and {@code Ai' -> α Ai' | ε}. Passes repeat while any nonterminal is still
     * left-recursive, including through a nullable prefix, up to {@code nonterminals + 1} passes.
     *
     * @throws CfgException with {@link TransformError.EliminationDiverged} when recursion survives the pass bound,
     *                      or a pass makes no progress
     */
    public static Grammar eliminateLeftRecursion(Grammar grammar) {
        int maxPasses = grammar.nonterminals()
                               .size() + 1;
        var current = grammar;
        for (int pass = 0; ; pass++) {
            var remaining = leftRecursive(current);
            if (remaining.isEmpty()) {
                return current;
            }
            if (pass == maxPasses) {
                throw diverged(pass, remaining);
            }
            var next = eliminationPass(current);
            if (next.equals(current)) {
                throw diverged(pass + 1, remaining);
            }
            current = next;
        }
    }

    /**
     * Nonterminals A with {@code A =>+ A γ}, where the leading symbols before the recursive A are nullable.
     */
    public static Set<Symbol> leftRecursive(Grammar grammar) {
        var nullable = SetSolver.nullableOf(grammar);
        var corners = new LinkedHashMap<Symbol, Set<Symbol>>();
        for (var nonterminal : grammar.nonterminals()) {
            corners.put(nonterminal, new LinkedHashSet<>());
        }
        for (var production : grammar.productions()) {
            for (var symbol : production.rhs()) {
                if (symbol.isNonterminal()) {
                    corners.get(production.lhs())
                           .add(symbol);
                }
                if (!nullable.contains(symbol)) {
                    break;
                }
            }
        }
        var result = new LinkedHashSet<Symbol>();
        for (var nonterminal : grammar.nonterminals()) {
            if (reaches(corners, nonterminal, nonterminal)) {
                result.add(nonterminal);
            }
        }
        return result;
    }

    private static boolean reaches(Map<Symbol, Set<Symbol>> edges, Symbol from, Symbol target) {
        var seen = new HashSet<Symbol>();
        var queue = new ArrayDeque<>(edges.get(from));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (next.equals(target)) {
                return true;
            }
            if (seen.add(next)) {
                queue.addAll(edges.get(next));
            }
        }
        return false;
    }

    private static Grammar eliminationPass(Grammar grammar) {
        var rewrite = Rewrite.of(grammar);
        var ordered = List.copyOf(rewrite.order);
        for (int i = 0; i < ordered.size(); i++) {
            var ai = ordered.get(i);
            for (int j = 0; j < i; j++) {
                rewrite.substitute(ai, ordered.get(j));
            }
            rewrite.removeImmediateRecursion(ai);
        }
        return rewrite.toGrammar();
    }

    private static CfgException diverged(int passes, Set<Symbol> remaining) {
        return new CfgException(new TransformError.EliminationDiverged(passes,
                                                                       remaining.stream()
                                                                                .map(Symbol::name)
                                                                                .toList()));
    }

    // === Left factoring ===

    /**
     * Factor common prefixes until no nonterminal has two alternatives sharing a nonempty prefix.
     * Each step picks, in declaration order, the first nonterminal with a shared prefix and factors its longest one:
     * {@code A -> prefix A'} takes the place of the first affected alternative and {@code A' -> rest1 | rest2 ...}.
     *
     * @throws CfgException with {@link TransformError.FactoringDiverged} when the fixpoint is not reached within
     *                      the grammar's total symbol count plus its production count
     */
    public static Grammar leftFactor(Grammar grammar) {
        int limit = grammar.productions()
                           .stream()
                           .mapToInt(Production::length)
                           .sum() + grammar.productions()
                                           .size();
        var rewrite = Rewrite.of(grammar);
        int passes = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var nonterminal : List.copyOf(rewrite.order)) {
                var prefix = sharedPrefix(rewrite.alternatives.get(nonterminal));
                if (prefix.isPresent()) {
                    if (++passes > limit) {
                        throw new CfgException(new TransformError.FactoringDiverged(limit));
                    }
                    rewrite.factor(nonterminal, prefix.get());
                    changed = true;
                    break;
                }
            }
        }
        return passes == 0
               ? grammar
               : rewrite.toGrammar();
    }

    /**
     * Longest nonempty prefix shared by at least two alternatives; ties go to the earliest pair.
     */
    static Optional<List<Symbol>> sharedPrefix(List<List<Symbol>> alternatives) {
        List<Symbol> best = List.of();
        for (int i = 0; i < alternatives.size(); i++) {
            for (int j = i + 1; j < alternatives.size(); j++) {
                var a = alternatives.get(i);
                var b = alternatives.get(j);
                int k = 0;
                while (k < a.size() && k < b.size() && a.get(k)
                                                        .equals(b.get(k))) {
                    k++;
                }
                if (k > best.size()) {
                    best = a.subList(0, k);
                }
            }
        }
        return best.isEmpty()
               ? Optional.empty()
               : Optional.of(List.copyOf(best));
    }

    private static List<List<Symbol>> bodies(List<Production> productions) {
        return productions.stream()
                          .map(Production::rhs)
                          .toList();
    }

    /**
     * Mutable working copy of a grammar's alternatives used by both rewrites.
     */
    private static final class Rewrite {
        private final Grammar base;
        private final List<Symbol> order;
        private final Map<Symbol, List<List<Symbol>>> alternatives;
        private final Set<String> taken;

        private Rewrite(Grammar base) {
            this.base = base;
            this.order = new ArrayList<>(base.nonterminals());
            this.alternatives = new LinkedHashMap<>();
            base.productionsByLhs()
                .forEach((lhs, productions) -> alternatives.put(lhs, new ArrayList<>(bodies(productions))));
            this.taken = new HashSet<>(base.names());
        }

        static Rewrite of(Grammar grammar) {
            return new Rewrite(grammar);
        }

        // Replace a leading `target` in the alternatives of `into` by each alternative of `target`.
        void substitute(Symbol into, Symbol target) {
            var result = new ArrayList<List<Symbol>>();
            for (var alternative : alternatives.get(into)) {
                if (!alternative.isEmpty() && alternative.get(0)
                                                         .equals(target)) {
                    var tail = alternative.subList(1, alternative.size());
                    for (var replacement : alternatives.get(target)) {
                        result.add(concat(replacement, tail));
                    }
                } else {
                    result.add(alternative);
                }
            }
            alternatives.put(into, distinct(result));
        }

        void removeImmediateRecursion(Symbol nonterminal) {
            var recursive = new ArrayList<List<Symbol>>();
            var others = new ArrayList<List<Symbol>>();
            for (var alternative : alternatives.get(nonterminal)) {
                if (!alternative.isEmpty() && alternative.get(0)
                                                         .equals(nonterminal)) {
                    // A -> A derives nothing new
                    if (alternative.size() > 1) {
                        recursive.add(alternative.subList(1, alternative.size()));
                    }
                } else {
                    others.add(alternative);
                }
            }
            if (recursive.isEmpty()) {
                alternatives.put(nonterminal, others);
                return;
            }
            var fresh = introduce(nonterminal);
            var rewritten = new ArrayList<List<Symbol>>();
            for (var beta : others) {
                rewritten.add(concat(beta, List.of(fresh)));
            }
            if (rewritten.isEmpty()) {
                rewritten.add(List.of(fresh));
            }
            var tails = new ArrayList<List<Symbol>>();
            for (var alpha : recursive) {
                tails.add(concat(alpha, List.of(fresh)));
            }
            tails.add(List.of());
            alternatives.put(nonterminal, distinct(rewritten));
            alternatives.put(fresh, distinct(tails));
        }

        void factor(Symbol nonterminal, List<Symbol> prefix) {
            var fresh = introduce(nonterminal);
            var result = new ArrayList<List<Symbol>>();
            var rests = new ArrayList<List<Symbol>>();
            for (var alternative : alternatives.get(nonterminal)) {
                if (startsWith(alternative, prefix)) {
                    if (rests.isEmpty()) {
                        result.add(concat(prefix, List.of(fresh)));
                    }
                    rests.add(List.copyOf(alternative.subList(prefix.size(), alternative.size())));
                } else {
                    result.add(alternative);
                }
            }
            alternatives.put(nonterminal, result);
            alternatives.put(fresh, distinct(rests));
        }

        // Declares a fresh nonterminal right after `origin`.
        private Symbol introduce(Symbol origin) {
            var name = freshName(origin.name());
            taken.add(name);
            var fresh = Symbol.nonterminal(name);
            order.add(order.indexOf(origin) + 1, fresh);
            return fresh;
        }

        private String freshName(String base) {
            var candidate = base + "'";
            while (taken.contains(candidate)) {
                candidate += "'";
            }
            return candidate;
        }

        Grammar toGrammar() {
            var productions = new ArrayList<Production>();
            for (var nonterminal : order) {
                for (var alternative : alternatives.get(nonterminal)) {
                    productions.add(new Production(nonterminal, alternative));
                }
            }
            return new Grammar(base.terminals(), order, productions, base.start());
        }

        private static boolean startsWith(List<Symbol> alternative, List<Symbol> prefix) {
            return alternative.size() >= prefix.size() && alternative.subList(0, prefix.size())
                                                                     .equals(prefix);
        }

        private static List<Symbol> concat(List<Symbol> head, List<Symbol> tail) {
            var result = new ArrayList<Symbol>(head.size() + tail.size());
            result.addAll(head);
            result.addAll(tail);
            return List.copyOf(result);
        }

        private static List<List<Symbol>> distinct(List<List<Symbol>> alternatives) {
            return new ArrayList<>(new LinkedHashSet<>(alternatives));
        }
    }
}
