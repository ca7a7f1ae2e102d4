package org.pragmatica.cfg.automaton;

import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the canonical LR(0) collection.
 *
 * <p>States are discovered breadth-first in id order; within a state, successors are computed for symbols
 * in order of their first appearance after a dot. A goto result equal (as a set) to an existing state
 * reuses that state's id, otherwise it receives the next id. The result is therefore fully determined by
 * the grammar and its production order.
 */
public final class LrAutomatonBuilder {
    private final Grammar grammar;
    private final Production augmentation;
    private final Map<Symbol, List<Production>> productions;

    private LrAutomatonBuilder(Grammar original) {
        var augmentedStart = Symbol.nonterminal(original.freshName(original.start()
                                                                           .name()));
        this.augmentation = Production.of(augmentedStart, original.start());
        var nonterminals = new ArrayList<Symbol>();
        nonterminals.add(augmentedStart);
        nonterminals.addAll(original.nonterminals());
        var all = new ArrayList<Production>();
        all.add(augmentation);
        all.addAll(original.productions());
        this.grammar = new Grammar(original.terminals(), nonterminals, all, augmentedStart);
        this.productions = grammar.productionsByLhs();
    }

    public static LrAutomaton build(Grammar grammar) {
        return new LrAutomatonBuilder(grammar).buildCollection();
    }

    private LrAutomaton buildCollection() {
        var itemSets = new ArrayList<Set<Item>>();
        var transitions = new ArrayList<Map<Symbol, Integer>>();
        var ids = new HashMap<Set<Item>, Integer>();

        var initial = closure(Set.of(Item.initial(augmentation)));
        itemSets.add(initial);
        transitions.add(new LinkedHashMap<>());
        ids.put(initial, 0);

        var pending = new ArrayDeque<Integer>();
        pending.add(0);
        while (!pending.isEmpty()) {
            int id = pending.poll();
            var items = itemSets.get(id);
            for (var symbol : symbolsAfterDot(items)) {
                var target = goTo(items, symbol);
                var targetId = ids.get(target);
                if (targetId == null) {
                    targetId = itemSets.size();
                    itemSets.add(target);
                    transitions.add(new LinkedHashMap<>());
                    ids.put(target, targetId);
                    pending.add(targetId);
                }
                transitions.get(id)
                           .put(symbol, targetId);
            }
        }

        var states = new ArrayList<LrState>(itemSets.size());
        for (int i = 0; i < itemSets.size(); i++) {
            states.add(new LrState(i, itemSets.get(i), transitions.get(i)));
        }
        return new LrAutomaton(grammar, augmentation, states);
    }

    /**
     * Add {@code [B -> · γ]} for every item {@code [A -> α · B β]} until nothing changes.
     */
    Set<Item> closure(Set<Item> kernel) {
        var result = new LinkedHashSet<>(kernel);
        var work = new ArrayDeque<>(kernel);
        while (!work.isEmpty()) {
            var item = work.poll();
            var next = item.next();
            if (next.isEmpty() || !next.get()
                                       .isNonterminal()) {
                continue;
            }
            for (var production : productions.get(next.get())) {
                var initial = Item.initial(production);
                if (result.add(initial)) {
                    work.add(initial);
                }
            }
        }
        return result;
    }

    /**
     * Advance the dot over {@code symbol} in every item expecting it, then close.
     */
    Set<Item> goTo(Set<Item> items, Symbol symbol) {
        var moved = new LinkedHashSet<Item>();
        for (var item : items) {
            if (item.next()
                    .filter(symbol::equals)
                    .isPresent()) {
                moved.add(item.advance());
            }
        }
        return closure(moved);
    }

    private static Set<Symbol> symbolsAfterDot(Set<Item> items) {
        var symbols = new LinkedHashSet<Symbol>();
        for (var item : items) {
            item.next()
                .ifPresent(symbols::add);
        }
        return symbols;
    }
}
