package org.pragmatica.cfg.grammar;

import org.pragmatica.cfg.tree.SourceLocation;
import org.pragmatica.cfg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the production notation. Line breaks are significant and emitted as {@link GrammarToken.Newline}.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final String EPSILON_KEYWORD = "epsilon";

    private final String input;
    private SourceLocation location;

    private GrammarLexer(String input) {
        this.input = input;
        this.location = SourceLocation.START;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            skipBlanksAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(location)));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = location;
        char c = peek();
        if (c == '\n') {
            advance();
            return new GrammarToken.Newline(span(start));
        }
        if (c == 'ε') {
            advance();
            return new GrammarToken.Epsilon(span(start));
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '%') {
            return scanDirective(start);
        }
        if (c == '\'' || c == '"') {
            return scanQuoted(start);
        }
        if (c == '-' && peekNext() == '>') {
            advance();
            advance();
            return new GrammarToken.Arrow(span(start));
        }
        if (c == '→') {
            advance();
            return new GrammarToken.Arrow(span(start));
        }
        if (c == '|') {
            advance();
            return new GrammarToken.Pipe(span(start));
        }
        advance();
        return new GrammarToken.Punctuation(span(start), String.valueOf(c));
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        // trailing primes, as produced by the transformations: E', T''
        while (!isAtEnd() && peek() == '\'') {
            sb.append(advance());
        }
        var name = sb.toString();
        return name.equals(EPSILON_KEYWORD)
               ? new GrammarToken.Epsilon(span(start))
               : new GrammarToken.Identifier(span(start), name);
    }

    private GrammarToken scanDirective(SourceLocation start) {
        advance();
        // skip %
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        if (sb.length() == 0) {
            return new GrammarToken.Error(span(start), "Directive name expected after '%'");
        }
        return new GrammarToken.Directive(span(start), sb.toString());
    }

    private GrammarToken scanQuoted(SourceLocation start) {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\' && peekNext() == quote) {
                advance();
            }
            sb.append(advance());
        }
        if (isAtEnd() || peek() != quote) {
            return new GrammarToken.Error(span(start), "Unterminated quoted terminal");
        }
        advance();
        // skip closing quote
        if (sb.length() == 0) {
            return new GrammarToken.Error(span(start), "Empty quoted terminal");
        }
        return new GrammarToken.Quoted(span(start), sb.toString());
    }

    private void skipBlanksAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return (Character.isLetterOrDigit(c) || c == '_') && c != 'ε';
    }

    private boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(location.offset());
    }

    private char peekNext() {
        int next = location.offset() + 1;
        return next < input.length()
               ? input.charAt(next)
               : '\0';
    }

    private char advance() {
        char c = peek();
        location = location.next(c);
        return c;
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }
}
