package org.pragmatica.cfg.error;

/**
 * Every failure the library reports. Builder-time errors are thrown inside a {@link CfgException};
 * driver-time errors are returned inside a rejected parse outcome.
 */
public sealed interface CfgError permits GrammarError, TransformError, TableConflictError, SyntaxError, DepthExceededError {
    String message();
}
