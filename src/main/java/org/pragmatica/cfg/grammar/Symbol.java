package org.pragmatica.cfg.grammar;

import java.util.Objects;

/**
 * Grammar symbol - a terminal or a nonterminal identified by name.
 *
 * <p>Two pseudo-terminals are reserved and may not be declared by a grammar:
 * {@link #EPSILON}, which only ever appears inside FIRST sets, and {@link #END}, the end-of-input marker.
 */
public record Symbol(Kind kind, String name) {

    public enum Kind {
        TERMINAL,
        NONTERMINAL
    }

    public static final Symbol EPSILON = new Symbol(Kind.TERMINAL, "ε");
    public static final Symbol END = new Symbol(Kind.TERMINAL, "$");

    public Symbol {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Symbol name must not be blank");
        }
    }

    public static Symbol terminal(String name) {
        return new Symbol(Kind.TERMINAL, name);
    }

    public static Symbol nonterminal(String name) {
        return new Symbol(Kind.NONTERMINAL, name);
    }

    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }

    public boolean isNonterminal() {
        return kind == Kind.NONTERMINAL;
    }

    /**
     * True for {@link #EPSILON} and {@link #END}, and for any symbol reusing their names.
     */
    public boolean isReserved() {
        return name.equals(EPSILON.name) || name.equals(END.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
