package org.pragmatica.cfg.error;

import org.pragmatica.cfg.tree.SourceSpan;

/**
 * Problems with the grammar itself.
 */
public sealed interface GrammarError extends CfgError {

    /**
     * Symbol referenced by a production but never declared.
     */
    record UndeclaredSymbol(String name, String production) implements GrammarError {
        @Override
        public String message() {
            return "Undeclared symbol '" + name + "' in " + production;
        }
    }

    record UndeclaredStart(String name) implements GrammarError {
        @Override
        public String message() {
            return "Start symbol '" + name + "' is not a declared nonterminal";
        }
    }

    /**
     * Declared nonterminal with no alternatives.
     */
    record MissingProductions(String name) implements GrammarError {
        @Override
        public String message() {
            return "Nonterminal '" + name + "' has no productions";
        }
    }

    /**
     * Name declared both as terminal and nonterminal.
     */
    record DuplicateDeclaration(String name) implements GrammarError {
        @Override
        public String message() {
            return "Symbol '" + name + "' is declared as both terminal and nonterminal";
        }
    }

    /**
     * Grammar declares one of the reserved names (epsilon or end marker).
     */
    record ReservedSymbol(String name) implements GrammarError {
        @Override
        public String message() {
            return "Symbol name '" + name + "' is reserved";
        }
    }

    record UnreachableNonterminal(String name) implements GrammarError {
        @Override
        public String message() {
            return "Nonterminal '" + name + "' is unreachable from the start symbol";
        }
    }

    /**
     * Grammar notation text that could not be read.
     */
    record MalformedNotation(SourceSpan span, String reason) implements GrammarError {
        @Override
        public String message() {
            return reason + " at " + span.start();
        }
    }
}
