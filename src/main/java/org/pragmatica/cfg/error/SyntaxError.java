package org.pragmatica.cfg.error;

import org.pragmatica.cfg.grammar.Symbol;

import java.util.List;

/**
 * Token stream rejected by a driver. Positions are the lexer-supplied token positions;
 * at end of input the position is one past the last token.
 */
public sealed interface SyntaxError extends CfgError {
    int position();

    record UnexpectedToken(int position, String found, List<String> expected) implements SyntaxError {
        public UnexpectedToken {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected '" + found + "' at position " + position + ", expected " + SyntaxError.describe(expected);
        }
    }

    record UnexpectedEnd(int position, List<String> expected) implements SyntaxError {
        public UnexpectedEnd {
            expected = List.copyOf(expected);
        }

        @Override
        public String message() {
            return "Unexpected end of input at position " + position + ", expected " + SyntaxError.describe(expected);
        }
    }

    /**
     * LR goto table has no entry for the reduced nonterminal.
     */
    record MissingTransition(int state, Symbol symbol, int position) implements SyntaxError {
        @Override
        public String message() {
            return "No transition from state " + state + " on '" + symbol + "' at position " + position;
        }
    }

    private static String describe(List<String> expected) {
        if (expected.isEmpty()) {
            return "nothing";
        }
        return expected.size() == 1
               ? "'" + expected.get(0) + "'"
               : "one of {" + String.join(", ", expected) + "}";
    }
}
