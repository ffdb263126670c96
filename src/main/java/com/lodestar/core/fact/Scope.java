package com.lodestar.core.fact;

import java.util.Arrays;

/**
 * Lifetime of a {@link Fact}.
 * <p>
 * There is deliberately no default scope: every fact, emission and seed
 * must name one of these explicitly.
 */
public enum Scope {

    /** Visible until the current iteration ends; never persisted. */
    ITERATION("iteration"),

    /** Persisted for the lifetime of one session; cleared at a terminal phase. */
    SESSION("session"),

    /** Persisted across sessions; cleared only by explicit external action. */
    PERSISTENT("persistent");

    private final String wireName;

    Scope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isDurable() {
        return this != ITERATION;
    }

    public static Scope fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown fact scope: '" + wireName + "'"));
    }
}
