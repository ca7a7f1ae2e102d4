package org.pragmatica.cfg.table;

/**
 * Reduce placement policy of an LR table.
 */
public enum LrMode {
    /**
     * Reduce on every terminal.
     */
    LR0,
    /**
     * Reduce only on FOLLOW of the production's LHS.
     */
    SLR1
}
