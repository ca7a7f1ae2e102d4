package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.tree.Token;

import java.util.List;

/**
 * Parser interface - recognizes a token stream and builds its parse tree.
 * Implementations keep no per-parse state and may be shared between threads.
 */
public interface Parser {

    ParseOutcome parse(List<Token> tokens);

    /**
     * Parse whitespace separated token types, e.g. {@code "id + id * id"}.
     */
    default ParseOutcome parse(String tokenTypes) {
        return parse(Token.split(tokenTypes));
    }
}
