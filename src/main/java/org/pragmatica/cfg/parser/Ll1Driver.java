package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.error.CfgError;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.SyntaxError;
import org.pragmatica.cfg.error.TableConflictError;
import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.table.Ll1Table;
import org.pragmatica.cfg.tree.ParseTreeNode;
import org.pragmatica.cfg.tree.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Table-driven predictive parser over an {@link Ll1Table}.
 *
 * <p>The stack starts as {@code [$, S]}. A terminal on top must match the current token, a nonterminal
 * on top is replaced by the RHS of the table entry for the current token, and the parse accepts when
 * the end marker meets the end of input.
 */
public final class Ll1Driver implements Parser {
    private final Ll1Table table;
    private final ParserConfig config;

    private Ll1Driver(Ll1Table table, ParserConfig config) {
        this.table = table;
        this.config = config;
    }

    /**
     * @throws CfgException with a {@link TableConflictError} if the table is not LL(1)
     */
    public static Ll1Driver create(Ll1Table table, ParserConfig config) {
        if (!table.isDeterministic()) {
            throw new CfgException(new TableConflictError(table.conflicts()));
        }
        return new Ll1Driver(table, config);
    }

    public static Ll1Driver create(Ll1Table table) {
        return create(table, ParserConfig.DEFAULT);
    }

    public Ll1Table table() {
        return table;
    }

    @Override
    public ParseOutcome parse(List<Token> tokens) {
        var cursor = new TokenCursor(tokens);
        var trace = new ArrayList<TraceStep>();
        var root = new PendingNode(table.grammar()
                                        .start());
        var stack = new ArrayDeque<PendingNode>();
        stack.push(new PendingNode(Symbol.END));
        stack.push(root);

        while (true) {
            var top = stack.peek();
            var lookahead = cursor.lookaheadSymbol();
            if (top.symbol.equals(Symbol.END)) {
                if (cursor.atEnd()) {
                    record(trace, stack, cursor, "Accept");
                    return new ParseOutcome.Accepted(root.toTree()
                                                         .orElseThrow(), trace);
                }
                var error = unexpected(cursor, List.of(Symbol.END.name()));
                record(trace, stack, cursor, "Error: expected end of input, got " + lookahead);
                return rejected(error, root, trace);
            }
            if (top.symbol.isTerminal()) {
                if (!top.symbol.equals(lookahead)) {
                    var error = unexpected(cursor, List.of(top.symbol.name()));
                    record(trace, stack, cursor, "Error: expected " + top.symbol + ", got " + lookahead);
                    return rejected(error, root, trace);
                }
                record(trace, stack, cursor, "Match " + top.symbol);
                stack.pop();
                top.token = cursor.advance();
                continue;
            }
            var entry = table.cell(top.symbol, lookahead);
            if (entry.isEmpty()) {
                var expected = table.expected(top.symbol)
                                    .stream()
                                    .map(Symbol::name)
                                    .toList();
                record(trace, stack, cursor, "Error: no entry for (" + top.symbol + ", " + lookahead + ")");
                return rejected(unexpected(cursor, expected), root, trace);
            }
            var production = entry.get();
            record(trace, stack, cursor, "Apply " + production);
            stack.pop();
            for (var symbol : production.rhs()) {
                top.children.add(new PendingNode(symbol));
            }
            for (int i = top.children.size() - 1; i >= 0; i--) {
                stack.push(top.children.get(i));
            }
        }
    }

    private static SyntaxError unexpected(TokenCursor cursor, List<String> expected) {
        return cursor.current()
                     .<SyntaxError>map(token -> new SyntaxError.UnexpectedToken(token.position(),
                                                                                token.type(),
                                                                                expected))
                     .orElseGet(() -> new SyntaxError.UnexpectedEnd(cursor.position(), expected));
    }

    private static ParseOutcome rejected(CfgError error, PendingNode root, List<TraceStep> trace) {
        return new ParseOutcome.Rejected(error, root.toTree(), trace);
    }

    private void record(List<TraceStep> trace, Deque<PendingNode> stack, TokenCursor cursor, String action) {
        if (!config.traceEnabled()) {
            return;
        }
        var symbols = new ArrayList<String>();
        stack.descendingIterator()
             .forEachRemaining(node -> symbols.add(node.symbol.name()));
        trace.add(new TraceStep(symbols, cursor.remaining(), action));
    }

    /**
     * Tree node under construction; children are created when the nonterminal is expanded
     * and terminals receive their token when matched.
     */
    private static final class PendingNode {
        private final Symbol symbol;
        private final List<PendingNode> children = new ArrayList<>();
        private Token token;

        private PendingNode(Symbol symbol) {
            this.symbol = symbol;
        }

        // Unmatched terminals are left out; unexpanded nonterminals appear without children.
        private Optional<ParseTreeNode> toTree() {
            if (symbol.isTerminal()) {
                return Optional.ofNullable(token)
                               .map(matched -> ParseTreeNode.leaf(symbol, matched));
            }
            var built = new ArrayList<ParseTreeNode>();
            for (var child : children) {
                child.toTree()
                     .ifPresent(built::add);
            }
            return Optional.of(ParseTreeNode.node(symbol, built));
        }
    }
}
