package org.pragmatica.cfg.error;

import java.util.List;

/**
 * A grammar rewrite that could not reach its fixpoint within its pass bound.
 */
public sealed interface TransformError extends CfgError {

    /**
     * Left recursion survived the permitted number of elimination passes.
     *
     * @param passes     passes performed
     * @param remaining  nonterminals still left-recursive
     */
    record EliminationDiverged(int passes, List<String> remaining) implements TransformError {
        public EliminationDiverged {
            remaining = List.copyOf(remaining);
        }

        @Override
        public String message() {
            return "Left recursion elimination did not terminate after " + passes + " pass(es); still left-recursive: "
                   + String.join(", ", remaining);
        }
    }

    record FactoringDiverged(int passes) implements TransformError {
        @Override
        public String message() {
            return "Left factoring did not reach a fixpoint within " + passes + " pass(es)";
        }
    }
}
