package org.pragmatica.cfg.table;

import org.pragmatica.cfg.grammar.Grammar;

import java.util.List;

/**
 * A built parse table. Tables are immutable and may drive any number of concurrent parses.
 */
public sealed interface ParseTable permits Ll1Table, LrTable {

    /**
     * Grammar the table was built over (LL(1): transformed grammar; LR: augmented grammar).
     */
    Grammar grammar();

    /**
     * Every conflicting cell; empty for a deterministic table.
     */
    List<Conflict> conflicts();

    default boolean isDeterministic() {
        return conflicts().isEmpty();
    }
}
