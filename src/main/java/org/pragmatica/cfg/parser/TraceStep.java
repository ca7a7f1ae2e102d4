package org.pragmatica.cfg.parser;

import java.util.List;

/**
 * One recorded driver step: the stack (bottom first), the remaining input and the action taken.
 */
public record TraceStep(List<String> stack, List<String> input, String action) {

    public TraceStep {
        stack = List.copyOf(stack);
        input = List.copyOf(input);
    }

    @Override
    public String toString() {
        return String.join(" ", stack) + " | " + String.join(" ", input) + " | " + action;
    }
}
