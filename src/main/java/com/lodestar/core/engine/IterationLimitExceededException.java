package com.lodestar.core.engine;

/**
 * Thrown when a run reaches {@code lodestar.engine.max-iterations} without
 * reaching a terminal or paused outcome.
 */
public class IterationLimitExceededException extends RuntimeException {

    public IterationLimitExceededException(String message) {
        super(message);
    }

    public IterationLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
