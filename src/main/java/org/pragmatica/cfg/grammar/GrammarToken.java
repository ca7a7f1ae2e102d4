package org.pragmatica.cfg.grammar;

import org.pragmatica.cfg.tree.SourceSpan;

/**
 * Token types of the production notation.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // Symbols
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    /**
     * Quoted name, always a terminal: {@code "=="} or {@code '->'}.
     */
    record Quoted(SourceSpan span, String name) implements GrammarToken {}

    /**
     * Single punctuation character used as a terminal: {@code +}, {@code (}, ...
     */
    record Punctuation(SourceSpan span, String name) implements GrammarToken {}

    // ε or epsilon
    record Epsilon(SourceSpan span) implements GrammarToken {}

    // Operators
    record Arrow(SourceSpan span) implements GrammarToken {}

    // -> or →
    record Pipe(SourceSpan span) implements GrammarToken {}

    // |
    // Structure
    record Directive(SourceSpan span, String name) implements GrammarToken {}

    // %name
    record Newline(SourceSpan span) implements GrammarToken {}

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}
