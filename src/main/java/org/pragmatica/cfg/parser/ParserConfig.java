package org.pragmatica.cfg.parser;

/**
 * Parser configuration options.
 *
 * @param backtrackDepthLimit maximum nesting of nonterminal expansions in the backtracking parser
 * @param backtrackStepLimit  maximum number of expansion attempts in one backtracking parse
 * @param traceEnabled        record every driver step in the outcome
 */
public record ParserConfig(
    int backtrackDepthLimit,
    int backtrackStepLimit,
    boolean traceEnabled
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        256,
        200_000,
        false
    );

    public ParserConfig {
        if (backtrackDepthLimit < 1) {
            throw new IllegalArgumentException("Depth limit must be positive: " + backtrackDepthLimit);
        }
        if (backtrackStepLimit < 1) {
            throw new IllegalArgumentException("Step limit must be positive: " + backtrackStepLimit);
        }
    }

    public ParserConfig withTrace(boolean enabled) {
        return new ParserConfig(backtrackDepthLimit, backtrackStepLimit, enabled);
    }

    public ParserConfig withDepthLimit(int limit) {
        return new ParserConfig(limit, backtrackStepLimit, traceEnabled);
    }

    public ParserConfig withStepLimit(int limit) {
        return new ParserConfig(backtrackDepthLimit, limit, traceEnabled);
    }
}
