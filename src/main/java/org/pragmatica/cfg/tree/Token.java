package org.pragmatica.cfg.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A token delivered by the external lexer. The type is matched against terminal names,
 * the lexeme is carried into parse tree leaves and the position is used in diagnostics.
 */
public record Token(String type, String lexeme, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexeme, "lexeme");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Token type must not be blank");
        }
    }

    /**
     * Token whose lexeme equals its type.
     */
    public static Token of(String type, int position) {
        return new Token(type, type, position);
    }

    /**
     * Token stream with positions 1, 2, 3...
     */
    public static List<Token> sequence(String... types) {
        return sequence(List.of(types));
    }

    public static List<Token> sequence(List<String> types) {
        var tokens = new ArrayList<Token>(types.size());
        for (int i = 0; i < types.size(); i++) {
            tokens.add(of(types.get(i), i + 1));
        }
        return List.copyOf(tokens);
    }

    /**
     * Token stream from whitespace separated token types, e.g. {@code "id + id * id"}.
     */
    public static List<Token> split(String types) {
        var trimmed = types.trim();
        return trimmed.isEmpty()
               ? List.of()
               : sequence(List.of(trimmed.split("\\s+")));
    }

    @Override
    public String toString() {
        return type.equals(lexeme)
               ? type + "@" + position
               : type + "('" + lexeme + "')@" + position;
    }
}
