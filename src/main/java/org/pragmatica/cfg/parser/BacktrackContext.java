package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.error.DepthExceededError;
import org.pragmatica.cfg.error.SyntaxError;
import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.tree.ParseTreeNode;
import org.pragmatica.cfg.tree.Token;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one backtracking parse: bounds, furthest failure, best partial tree and trace.
 */
final class BacktrackContext {
    private final TokenCursor cursor;
    private final ParserConfig config;
    private final List<TraceStep> trace = new ArrayList<>();

    private int steps;
    private int furthestIndex = -1;
    private final Set<String> furthestExpected = new LinkedHashSet<>();
    private int bestEnd = -1;
    private ParseTreeNode bestPartial;

    BacktrackContext(List<Token> tokens, ParserConfig config) {
        this.cursor = new TokenCursor(tokens);
        this.config = config;
    }

    // === Position Management ===

    /**
     * Checkpoint of the read position.
     */
    int mark() {
        return cursor.index();
    }

    void reset(int mark) {
        cursor.reset(mark);
    }

    boolean isAtEnd() {
        return cursor.atEnd();
    }

    /**
     * Consume the current token if it matches the terminal.
     */
    Optional<Token> match(Symbol terminal) {
        if (!cursor.atEnd() && cursor.lookahead()
                                     .equals(terminal.name())) {
            return Optional.of(cursor.advance());
        }
        updateFurthest(terminal.name());
        return Optional.empty();
    }

    // === Bounds ===

    /**
     * Count one expansion attempt at the given nesting depth.
     */
    void enter(int depth) {
        if (depth > config.backtrackDepthLimit()) {
            throw new BoundExceeded(new DepthExceededError(DepthExceededError.Bound.DEPTH,
                                                           config.backtrackDepthLimit(),
                                                           cursor.position()));
        }
        if (++steps > config.backtrackStepLimit()) {
            throw new BoundExceeded(new DepthExceededError(DepthExceededError.Bound.STEPS,
                                                           config.backtrackStepLimit(),
                                                           cursor.position()));
        }
    }

    // === Error Tracking ===

    void updateFurthest(String expected) {
        int index = cursor.index();
        if (index > furthestIndex) {
            furthestIndex = index;
            furthestExpected.clear();
        }
        if (index == furthestIndex) {
            furthestExpected.add(expected);
        }
    }

    /**
     * Offer a complete derivation of the start symbol that stopped before the end of input.
     */
    void offerPartial(ParseTreeNode tree) {
        if (cursor.index() > bestEnd) {
            bestEnd = cursor.index();
            bestPartial = tree;
        }
        updateFurthest(Symbol.END.name());
    }

    Optional<ParseTreeNode> bestPartial() {
        return Optional.ofNullable(bestPartial);
    }

    SyntaxError furthestError() {
        int saved = cursor.index();
        cursor.reset(Math.max(furthestIndex, 0));
        var expected = List.copyOf(furthestExpected);
        var error = cursor.current()
                          .<SyntaxError>map(token -> new SyntaxError.UnexpectedToken(token.position(),
                                                                                     token.type(),
                                                                                     expected))
                          .orElseGet(() -> new SyntaxError.UnexpectedEnd(cursor.position(), expected));
        cursor.reset(saved);
        return error;
    }

    // === Trace ===

    boolean tracing() {
        return config.traceEnabled();
    }

    void record(List<String> derivation, String action) {
        if (config.traceEnabled()) {
            trace.add(new TraceStep(derivation, cursor.remaining(), action));
        }
    }

    List<TraceStep> trace() {
        return trace;
    }

    /**
     * Unwinds the search when a configured bound is hit.
     */
    static final class BoundExceeded extends RuntimeException {
        private final DepthExceededError error;

        BoundExceeded(DepthExceededError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }

        DepthExceededError error() {
            return error;
        }
    }
}
