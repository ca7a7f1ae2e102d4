package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.error.CfgError;
import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.tree.ParseTreeNode;

import java.util.List;
import java.util.Optional;

/**
 * Result of running a driver over a token stream - either an accepted tree or a rejection.
 * The trace is empty unless tracing was enabled.
 */
public sealed interface ParseOutcome {

    List<TraceStep> trace();

    boolean isAccepted();

    /**
     * Tree of an accepted parse; throws {@link CfgException} carrying the error of a rejected one.
     */
    ParseTreeNode unwrap();

    /**
     * Error of a rejected parse.
     */
    Optional<CfgError> failure();

    record Accepted(ParseTreeNode tree, List<TraceStep> trace) implements ParseOutcome {
        public Accepted {
            trace = List.copyOf(trace);
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public ParseTreeNode unwrap() {
            return tree;
        }

        @Override
        public Optional<CfgError> failure() {
            return Optional.empty();
        }
    }

    /**
     * Rejected parse. The partial tree, when present, holds everything derived before the failure.
     */
    record Rejected(CfgError error, Optional<ParseTreeNode> partialTree, List<TraceStep> trace) implements ParseOutcome {
        public Rejected {
            trace = List.copyOf(trace);
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public ParseTreeNode unwrap() {
            throw new CfgException(error);
        }

        @Override
        public Optional<CfgError> failure() {
            return Optional.of(error);
        }
    }
}
