package com.lodestar.core.phase;

import java.util.List;

/**
 * Thrown by {@link PhaseSet} factories when phase names are invalid.
 * Carries every problem found, not just the first.
 */
public class InvalidPhaseException extends IllegalArgumentException {

    private final List<String> problems;

    public InvalidPhaseException(List<String> problems) {
        super("Invalid phase names:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidPhaseException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
