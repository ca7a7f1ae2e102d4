package org.pragmatica.cfg.tree;

import org.pragmatica.cfg.grammar.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Parse tree node - common output of all drivers.
 * Terminal nodes are leaves carrying the matched token; nonterminal nodes carry children in RHS order.
 * A nonterminal expanded by an epsilon production has no children.
 */
public record ParseTreeNode(Symbol symbol, Optional<Token> token, List<ParseTreeNode> children) {

    public ParseTreeNode {
        children = List.copyOf(children);
    }

    public static ParseTreeNode leaf(Symbol symbol, Token token) {
        return new ParseTreeNode(symbol, Optional.of(token), List.of());
    }

    public static ParseTreeNode node(Symbol symbol, List<ParseTreeNode> children) {
        return new ParseTreeNode(symbol, Optional.empty(), children);
    }

    public boolean isLeaf() {
        return symbol.isTerminal();
    }

    public String name() {
        return symbol.name();
    }

    public ParseTreeNode child(int index) {
        return children.get(index);
    }

    /**
     * Lexemes of all leaves, left to right.
     */
    public List<String> leaves() {
        var result = new ArrayList<String>();
        collectLeaves(this, result);
        return result;
    }

    private static void collectLeaves(ParseTreeNode node, List<String> result) {
        if (node.token.isPresent()) {
            result.add(node.token.get().lexeme());
            return;
        }
        for (var child : node.children) {
            collectLeaves(child, result);
        }
    }

    /**
     * First node in pre-order (this node included) that satisfies the predicate.
     */
    public Optional<ParseTreeNode> find(Predicate<ParseTreeNode> predicate) {
        if (predicate.test(this)) {
            return Optional.of(this);
        }
        for (var child : children) {
            var found = child.find(predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public boolean contains(String symbolName) {
        return find(node -> node.name().equals(symbolName)).isPresent();
    }

    /**
     * Indented multi-line rendering, one node per line.
     */
    public String format() {
        var sb = new StringBuilder();
        format(sb, 0);
        return sb.toString();
    }

    private void format(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(symbol.name());
        token.filter(t -> !t.lexeme().equals(symbol.name()))
             .ifPresent(t -> sb.append(" '").append(t.lexeme()).append("'"));
        if (symbol.isNonterminal() && children.isEmpty()) {
            sb.append(" -> ").append(Symbol.EPSILON.name());
        }
        sb.append('\n');
        for (var child : children) {
            child.format(sb, depth + 1);
        }
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return symbol.name();
        }
        var sb = new StringBuilder(symbol.name()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
