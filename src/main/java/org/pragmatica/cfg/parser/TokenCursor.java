package org.pragmatica.cfg.parser;

import org.pragmatica.cfg.grammar.Symbol;
import org.pragmatica.cfg.tree.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read position over a token stream, with the end marker past the last token.
 * A trailing token of type {@code $} is taken as an explicit end marker and dropped.
 */
final class TokenCursor {
    private final List<Token> tokens;
    private int index;

    TokenCursor(List<Token> tokens) {
        var body = !tokens.isEmpty() && tokens.get(tokens.size() - 1)
                                              .type()
                                              .equals(Symbol.END.name())
                   ? tokens.subList(0, tokens.size() - 1)
                   : tokens;
        for (var token : body) {
            if (Symbol.terminal(token.type())
                      .isReserved()) {
                throw new IllegalArgumentException("Reserved token type '" + token.type() + "' at position "
                                                   + token.position());
            }
        }
        this.tokens = List.copyOf(body);
    }

    int index() {
        return index;
    }

    void reset(int index) {
        this.index = index;
    }

    boolean atEnd() {
        return index >= tokens.size();
    }

    Optional<Token> current() {
        return atEnd()
               ? Optional.empty()
               : Optional.of(tokens.get(index));
    }

    Token advance() {
        return tokens.get(index++);
    }

    /**
     * Current token type, or the end marker name.
     */
    String lookahead() {
        return atEnd()
               ? Symbol.END.name()
               : tokens.get(index)
                       .type();
    }

    Symbol lookaheadSymbol() {
        return atEnd()
               ? Symbol.END
               : Symbol.terminal(tokens.get(index)
                                       .type());
    }

    int position() {
        return positionAt(index);
    }

    /**
     * Token position at the index; one past the last token position beyond the end.
     */
    int positionAt(int at) {
        if (at < tokens.size()) {
            return tokens.get(at)
                         .position();
        }
        return tokens.isEmpty()
               ? 0
               : tokens.get(tokens.size() - 1)
                       .position() + 1;
    }

    /**
     * Remaining token types followed by the end marker, for traces.
     */
    List<String> remaining() {
        var result = new ArrayList<String>();
        for (int i = index; i < tokens.size(); i++) {
            result.add(tokens.get(i)
                             .type());
        }
        result.add(Symbol.END.name());
        return result;
    }
}
