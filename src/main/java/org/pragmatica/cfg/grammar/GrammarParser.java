package org.pragmatica.cfg.grammar;

import org.pragmatica.cfg.error.CfgException;
import org.pragmatica.cfg.error.GrammarError;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Parser for the production notation. Converts grammar text into a {@link Grammar}.
 *
 * <pre>
 * # comment
 * %start E
 * E -> E + T | T
 * T -> T * F | F
 * F -> ( E ) | id
 * L -> x L | ε
 * </pre>
 *
 * <p>Every name appearing on some left-hand side is a nonterminal; every other name is a terminal.
 * Quoting forces a name to be a terminal, so a quoted name may not also appear on a left-hand side. Repeated left-hand sides append alternatives. The start symbol is the first
 * left-hand side unless a {@code %start} directive names another.
 */
public final class GrammarParser {

    private final List<GrammarToken> tokens;
    private final List<GrammarError> errors = new ArrayList<>();
    private final List<Line> lines = new ArrayList<>();
    private final List<GrammarToken.Quoted> quoted = new ArrayList<>();
    private Optional<String> startName = Optional.empty();
    private int pos;

    private record Line(String lhs, List<List<String>> alternatives) {}

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text.
     *
     * @throws CfgException listing every malformed line, or every validation error of the resulting grammar
     */
    public static Grammar parse(String grammarText) {
        return new GrammarParser(GrammarLexer.tokenize(grammarText)).parseGrammar();
    }

    private Grammar parseGrammar() {
        while (!(peek() instanceof GrammarToken.Eof)) {
            var token = peek();
            if (token instanceof GrammarToken.Newline) {
                advance();
            } else if (token instanceof GrammarToken.Directive directive) {
                advance();
                parseDirective(directive);
            } else if (token instanceof GrammarToken.Identifier) {
                parseLine();
            } else {
                fail(token, "Expected nonterminal at start of production, found " + describe(token));
            }
        }
        checkQuotedNames();
        if (errors.isEmpty() && lines.isEmpty()) {
            errors.add(new GrammarError.MalformedNotation(peek().span(), "Grammar contains no productions"));
        }
        if (!errors.isEmpty()) {
            throw new CfgException(errors);
        }
        return assemble();
    }

    private void parseDirective(GrammarToken.Directive directive) {
        if (!directive.name()
                      .equals("start")) {
            fail(directive, "Unknown directive '%" + directive.name() + "'");
            return;
        }
        if (peek() instanceof GrammarToken.Identifier id) {
            advance();
            startName = Optional.of(id.name());
            expectLineEnd();
        } else {
            fail(peek(), "Expected nonterminal name after %start, found " + describe(peek()));
        }
    }

    private void parseLine() {
        var lhs = (GrammarToken.Identifier) advance();
        if (!(peek() instanceof GrammarToken.Arrow)) {
            fail(peek(), "Expected '->' after '" + lhs.name() + "', found " + describe(peek()));
            return;
        }
        advance();
        var alternatives = new ArrayList<List<String>>();
        while (true) {
            var alternative = parseAlternative();
            if (alternative.isEmpty()) {
                return;
            }
            alternatives.add(alternative.get());
            if (peek() instanceof GrammarToken.Pipe) {
                advance();
                continue;
            }
            break;
        }
        if (expectLineEnd()) {
            lines.add(new Line(lhs.name(), alternatives));
        }
    }

    /**
     * One alternative; empty list for epsilon. Returns empty on error (already recorded).
     */
    private Optional<List<String>> parseAlternative() {
        var symbols = new ArrayList<String>();
        GrammarToken epsilon = null;
        while (true) {
            var token = peek();
            if (token instanceof GrammarToken.Identifier id) {
                symbols.add(id.name());
            } else if (token instanceof GrammarToken.Punctuation punctuation) {
                symbols.add(punctuation.name());
            } else if (token instanceof GrammarToken.Quoted q) {
                quoted.add(q);
                symbols.add(q.name());
            } else if (token instanceof GrammarToken.Epsilon) {
                epsilon = token;
            } else if (token instanceof GrammarToken.Arrow) {
                fail(token, "Unexpected '->' inside alternative; put each nonterminal on its own line");
                return Optional.empty();
            } else if (token instanceof GrammarToken.Error error) {
                fail(error, error.message());
                return Optional.empty();
            } else {
                break;
            }
            advance();
        }
        if (epsilon != null && !symbols.isEmpty()) {
            fail(epsilon, "Epsilon must be the only symbol of its alternative");
            return Optional.empty();
        }
        return Optional.of(symbols);
    }

    private void checkQuotedNames() {
        var lhsNames = new LinkedHashSet<String>();
        for (var line : lines) {
            lhsNames.add(line.lhs());
        }
        for (var q : quoted) {
            if (lhsNames.contains(q.name())) {
                errors.add(new GrammarError.MalformedNotation(q.span(),
                                                              "Quoted terminal '" + q.name()
                                                              + "' clashes with nonterminal '" + q.name() + "'"));
            }
        }
    }

    private boolean expectLineEnd() {
        var token = peek();
        if (token instanceof GrammarToken.Newline) {
            advance();
            return true;
        }
        if (token instanceof GrammarToken.Eof) {
            return true;
        }
        fail(token, "Expected end of line, found " + describe(token));
        return false;
    }

    private Grammar assemble() {
        var builder = Grammar.builder();
        var nonterminals = new LinkedHashSet<String>();
        for (var line : lines) {
            nonterminals.add(line.lhs());
        }
        var terminals = new LinkedHashSet<String>();
        for (var line : lines) {
            for (var alternative : line.alternatives()) {
                for (var name : alternative) {
                    if (!nonterminals.contains(name)) {
                        terminals.add(name);
                    }
                }
            }
        }
        builder.nonterminal(nonterminals.toArray(String[]::new))
               .terminal(terminals.toArray(String[]::new));
        startName.ifPresent(builder::start);
        for (var line : lines) {
            for (var alternative : line.alternatives()) {
                builder.production(line.lhs(), alternative);
            }
        }
        return builder.build();
    }

    // Records the error and skips to the next line.
    private void fail(GrammarToken at, String reason) {
        errors.add(new GrammarError.MalformedNotation(at.span(), reason));
        while (!(peek() instanceof GrammarToken.Newline) && !(peek() instanceof GrammarToken.Eof)) {
            advance();
        }
    }

    private static String describe(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "'" + id.name() + "'";
        }
        if (token instanceof GrammarToken.Punctuation p) {
            return "'" + p.name() + "'";
        }
        if (token instanceof GrammarToken.Quoted q) {
            return "'" + q.name() + "'";
        }
        if (token instanceof GrammarToken.Arrow) {
            return "'->'";
        }
        if (token instanceof GrammarToken.Pipe) {
            return "'|'";
        }
        if (token instanceof GrammarToken.Epsilon) {
            return "'ε'";
        }
        if (token instanceof GrammarToken.Directive d) {
            return "'%" + d.name() + "'";
        }
        if (token instanceof GrammarToken.Newline) {
            return "end of line";
        }
        return token instanceof GrammarToken.Eof
               ? "end of input"
               : "invalid input";
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private GrammarToken advance() {
        var token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }
}
