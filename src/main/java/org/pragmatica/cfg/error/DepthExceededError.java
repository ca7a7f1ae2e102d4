package org.pragmatica.cfg.error;

/**
 * Backtracking search hit one of its configured bounds.
 */
public record DepthExceededError(Bound bound, int limit, int position) implements CfgError {

    public enum Bound {
        DEPTH,
        STEPS
    }

    @Override
    public String message() {
        return switch (bound) {
            case DEPTH -> "Derivation depth exceeded limit of " + limit + " at position " + position;
            case STEPS -> "Derivation steps exceeded limit of " + limit + " at position " + position;
        };
    }
}
