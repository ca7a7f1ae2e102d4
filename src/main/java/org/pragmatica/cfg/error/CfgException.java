package org.pragmatica.cfg.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when building a grammar, a transformed grammar or a parser fails.
 * Carries every error found, not just the first.
 */
public final class CfgException extends RuntimeException {
    private final List<CfgError> errors;

    public CfgException(CfgError error) {
        this(List.of(error));
    }

    public CfgException(List<? extends CfgError> errors) {
        super(errors.stream()
                    .map(CfgError::message)
                    .collect(Collectors.joining("; ")));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("CfgException requires at least one error");
        }
        this.errors = List.copyOf(errors);
    }

    public List<CfgError> errors() {
        return errors;
    }

    public CfgError error() {
        return errors.get(0);
    }

    /**
     * Render errors against the grammar text they came from. Notation errors are shown with source context,
     * the rest as plain messages.
     */
    public String format(String grammarText) {
        var sb = new StringBuilder();
        for (var error : errors) {
            if (error instanceof GrammarError.MalformedNotation malformed) {
                sb.append(Diagnostic.from(malformed)
                                    .format(grammarText, "grammar"));
            } else {
                sb.append("error: ")
                  .append(error.message())
                  .append('\n');
            }
        }
        return sb.toString();
    }
}
