package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.grammar.Grammar;
import org.pragmatica.cfg.grammar.Production;
import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.tree.ParseTreeNode;
import org.pragmatica.cfg.tree.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent with full backtracking over an untransformed grammar.
 *
 * <p>Alternatives are tried in declaration order. Success of a symbol hands control to the rest of
 * the enclosing sequence, so a failure further right resumes the next untried alternative of any
 * nonterminal to the left. The search is bounded by {@link ParserConfig#backtrackDepthLimit()} and
 * {@link ParserConfig#backtrackStepLimit()}; left-recursive grammars hit the depth bound.
 *
 * <p>The search runs on explicit goal and choice-point stacks kept on the heap, so neither input length
 * nor derivation depth consumes Java call stack.
 *
 * <p>Trace steps carry the chain of nonterminals being expanded, outermost first, in place of a stack.
 */
public final class BacktrackingParser implements Parser {
    private final Grammar grammar;
    private final Map<Symbol, List<Production>> alternatives;
    private final ParserConfig config;

    private BacktrackingParser(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.alternatives = grammar.productionsByLhs();
        this.config = config;
    }

    public static BacktrackingParser create(Grammar grammar, ParserConfig config) {
        return new BacktrackingParser(grammar, config);
    }

    public static BacktrackingParser create(Grammar grammar) {
        return create(grammar, ParserConfig.DEFAULT);
    }

    public Grammar grammar() {
        return grammar;
    }

    @Override
    public ParseOutcome parse(List<Token> tokens) {
        var context = new BacktrackContext(tokens, config);
        try {
            var accepted = new Search(context).run();
            if (accepted != null) {
                context.record(List.of(), "Accept");
                return new ParseOutcome.Accepted(accepted, context.trace());
            }
        } catch (BacktrackContext.BoundExceeded e) {
            context.record(List.of(), "Abort: " + e.error()
                                                   .message());
            return new ParseOutcome.Rejected(e.error(), context.bestPartial(), context.trace());
        }
        return new ParseOutcome.Rejected(context.furthestError(), context.bestPartial(), context.trace());
    }

    // === Search State ===

    /**
     * Immutable singly linked list; choice points share tails instead of copying.
     */
    private record Link<T>(T head, Link<T> tail) {
        static <T> Link<T> push(T head, Link<T> tail) {
            return new Link<>(head, tail);
        }
    }

    /**
     * Link of the chain of nonterminals currently being expanded.
     */
    private record Frame(Symbol symbol, Frame parent, int depth) {
        List<String> chain() {
            var names = new LinkedList<String>();
            for (var frame = this; frame != null; frame = frame.parent) {
                names.addFirst(frame.symbol.name());
            }
            return names;
        }
    }

    private sealed interface Goal {}

    /**
     * Derive a symbol inside the production being expanded by {@code parent}.
     */
    private record Expand(Symbol symbol, Frame parent) implements Goal {}

    /**
     * All symbols of the current production are derived; fold them into a node.
     */
    private record Close(Symbol symbol) implements Goal {}

    /**
     * Node under construction; children are held newest first.
     */
    private record Open(Symbol symbol, Link<ParseTreeNode> children) {
        Open add(ParseTreeNode child) {
            return new Open(symbol, Link.push(child, children));
        }

        ParseTreeNode close() {
            var ordered = new LinkedList<ParseTreeNode>();
            for (var link = children; link != null; link = link.tail) {
                ordered.addFirst(link.head);
            }
            return ParseTreeNode.node(symbol, ordered);
        }
    }

    /**
     * Untried alternatives of one nonterminal expansion, with the state to restore before trying them.
     */
    private static final class Choice {
        private final Frame frame;
        private final List<Production> productions;
        private final Link<Goal> goals;
        private final Link<Open> open;
        private final int mark;
        private int current;

        private Choice(Frame frame, List<Production> productions, Link<Goal> goals, Link<Open> open, int mark) {
            this.frame = frame;
            this.productions = productions;
            this.goals = goals;
            this.open = open;
            this.mark = mark;
        }
    }

    // === Search ===

    private final class Search {
        private final BacktrackContext context;
        private final Deque<Choice> choices = new ArrayDeque<>();
        private Link<Goal> goals;
        private Link<Open> open;

        private Search(BacktrackContext context) {
            this.context = context;
            this.goals = Link.push(new Expand(grammar.start(), null), null);
            this.open = Link.push(new Open(grammar.start(), null), null);
        }

        /**
         * Runs until the first derivation that consumes the whole input; null when none exists.
         */
        ParseTreeNode run() {
            while (true) {
                if (goals == null) {
                    var tree = open.head.children.head;
                    if (context.isAtEnd()) {
                        return tree;
                    }
                    context.offerPartial(tree);
                    if (!backtrack()) {
                        return null;
                    }
                    continue;
                }
                var goal = goals.head;
                goals = goals.tail;
                if (!step(goal) && !backtrack()) {
                    return null;
                }
            }
        }

        private boolean step(Goal goal) {
            if (goal instanceof Close close) {
                var node = open.head.close();
                open = open.tail;
                open = Link.push(open.head.add(node), open.tail);
                return true;
            }
            var expand = (Expand) goal;
            var symbol = expand.symbol();
            if (symbol.isTerminal()) {
                var token = context.match(symbol);
                if (token.isEmpty()) {
                    return false;
                }
                if (context.tracing()) {
                    context.record(expand.parent()
                                         .chain(), "Match " + symbol);
                }
                open = Link.push(open.head.add(ParseTreeNode.leaf(symbol, token.get())), open.tail);
                return true;
            }
            var parent = expand.parent();
            var frame = new Frame(symbol,
                                  parent,
                                  parent == null
                                  ? 1
                                  : parent.depth + 1);
            context.enter(frame.depth);
            var productions = alternatives.getOrDefault(symbol, List.of());
            if (productions.isEmpty()) {
                return false;
            }
            var choice = new Choice(frame, productions, goals, open, context.mark());
            choices.push(choice);
            attempt(choice);
            return true;
        }

        private void attempt(Choice choice) {
            var production = choice.productions.get(choice.current);
            if (context.tracing()) {
                context.record(choice.frame.chain(), "Try " + production);
            }
            var rhs = production.rhs();
            var next = Link.<Goal>push(new Close(production.lhs()), choice.goals);
            for (int i = rhs.size() - 1; i >= 0; i--) {
                next = Link.push(new Expand(rhs.get(i), choice.frame), next);
            }
            goals = next;
            open = Link.push(new Open(production.lhs(), null), choice.open);
        }

        /**
         * Resume the most recent expansion that still has an untried alternative; false when none is left.
         */
        private boolean backtrack() {
            while (!choices.isEmpty()) {
                var choice = choices.peek();
                context.reset(choice.mark);
                if (context.tracing()) {
                    context.record(choice.frame.chain(), "Backtrack " + choice.productions.get(choice.current));
                }
                choice.current++;
                if (choice.current < choice.productions.size()) {
                    attempt(choice);
                    return true;
                }
                choices.pop();
            }
            return false;
        }
    }
}
