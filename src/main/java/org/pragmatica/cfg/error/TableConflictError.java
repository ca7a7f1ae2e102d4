package org.pragmatica.cfg.error;

import org.pragmatica.cfg.table.Conflict;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every conflicting cell found while building a parse table.
 */
public record TableConflictError(List<Conflict> conflicts) implements CfgError {

    public TableConflictError {
        conflicts = List.copyOf(conflicts);
    }

    @Override
    public String message() {
        return conflicts.size() + " table conflict(s):\n" + conflicts.stream()
                                                                    .map(c -> "  " + c.describe())
                                                                    .collect(Collectors.joining("\n"));
    }
}
