package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.error.CfgError;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.SyntaxError;
import org.pragmatica.cfg.error.TableConflictError;
import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.table.LrAction;
import org.pragmatica.cfg.table.LrTable;
import org.pragmatica.cfg.tree.ParseTreeNode;
import org.pragmatica.cfg.tree.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shift-reduce driver over an LR(0) or SLR(1) {@link LrTable}.
 *
 * <p>Keeps a state stack and a parallel node stack. On rejection the partial tree is the node stack
 * gathered under a node labelled with the grammar's start symbol.
 */
public final class LrDriver implements Parser {
    private final LrTable table;
    private final ParserConfig config;

    private LrDriver(LrTable table, ParserConfig config) {
        this.table = table;
        this.config = config;
    }

    /**
     * @throws CfgException with a {@link TableConflictError} if the table has conflicts
     */
    public static LrDriver create(LrTable table, ParserConfig config) {
        if (!table.isDeterministic()) {
            throw new CfgException(new TableConflictError(table.conflicts()));
        }
        return new LrDriver(table, config);
    }

    public static LrDriver create(LrTable table) {
        return create(table, ParserConfig.DEFAULT);
    }

    public LrTable table() {
        return table;
    }

    @Override
    public ParseOutcome parse(List<Token> tokens) {
        var cursor = new TokenCursor(tokens);
        var trace = new ArrayList<TraceStep>();
        var states = new ArrayList<Integer>();
        var nodes = new ArrayList<ParseTreeNode>();
        states.add(0);

        while (true) {
            int state = states.get(states.size() - 1);
            var lookahead = cursor.lookaheadSymbol();
            var action = table.action(state, lookahead);
            if (action.isEmpty()) {
                var expected = table.expected(state)
                                    .stream()
                                    .map(Symbol::name)
                                    .toList();
                record(trace, states, nodes, cursor, "Error: no action for state " + state + ", symbol " + lookahead);
                return rejected(unexpected(cursor, expected), nodes, trace);
            }
            if (action.get() instanceof LrAction.Shift shift) {
                record(trace, states, nodes, cursor, "Shift " + shift.state());
                nodes.add(ParseTreeNode.leaf(lookahead, cursor.advance()));
                states.add(shift.state());
            } else if (action.get() instanceof LrAction.Reduce reduce) {
                var production = reduce.production();
                record(trace, states, nodes, cursor, "Reduce by " + production);
                int from = nodes.size() - production.length();
                var children = new ArrayList<>(nodes.subList(from, nodes.size()));
                nodes.subList(from, nodes.size())
                     .clear();
                states.subList(states.size() - production.length(), states.size())
                      .clear();
                nodes.add(ParseTreeNode.node(production.lhs(), children));
                int exposed = states.get(states.size() - 1);
                var target = table.goTo(exposed, production.lhs());
                if (target.isEmpty()) {
                    var error = new SyntaxError.MissingTransition(exposed, production.lhs(), cursor.position());
                    record(trace, states, nodes, cursor, "Error: no goto for (" + exposed + ", " + production.lhs() + ")");
                    return rejected(error, nodes, trace);
                }
                states.add(target.get());
            } else {
                record(trace, states, nodes, cursor, "Accept");
                return new ParseOutcome.Accepted(nodes.get(0), trace);
            }
        }
    }

    private ParseOutcome rejected(CfgError error, List<ParseTreeNode> nodes, List<TraceStep> trace) {
        var partial = ParseTreeNode.node(table.automaton()
                                              .originalStart(), nodes);
        return new ParseOutcome.Rejected(error, Optional.of(partial), trace);
    }

    private static SyntaxError unexpected(TokenCursor cursor, List<String> expected) {
        return cursor.current()
                     .<SyntaxError>map(token -> new SyntaxError.UnexpectedToken(token.position(),
                                                                                token.type(),
                                                                                expected))
                     .orElseGet(() -> new SyntaxError.UnexpectedEnd(cursor.position(), expected));
    }

    // Stack rendered bottom first, states interleaved with the symbols between them.
    private void record(List<TraceStep> trace,
                        List<Integer> states,
                        List<ParseTreeNode> nodes,
                        TokenCursor cursor,
                        String action) {
        if (!config.traceEnabled()) {
            return;
        }
        var stack = new ArrayList<String>();
        stack.add(String.valueOf(states.get(0)));
        for (int i = 0; i < nodes.size() && i + 1 < states.size(); i++) {
            stack.add(nodes.get(i)
                           .name());
            stack.add(String.valueOf(states.get(i + 1)));
        }
        trace.add(new TraceStep(stack, cursor.remaining(), action));
    }
}
