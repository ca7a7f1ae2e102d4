package org.pragmatica.cfg.table;

import org.pragmatica.cfg.grammar.Production;

/**
 * ACTION table entry.
 */
public sealed interface LrAction {

    record Shift(int state) implements LrAction {
        @Override
        public String toString() {
            return "s" + state;
        }
    }

    record Reduce(Production production) implements LrAction {
        @Override
        public String toString() {
            return "r(" + production + ")";
        }
    }

    record Accept() implements LrAction {
        @Override
        public String toString() {
            return "acc";
        }
    }
}
