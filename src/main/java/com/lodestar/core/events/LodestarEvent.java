package com.lodestar.core.events;

import com.lodestar.core.engine.IterationOutcome;
import com.lodestar.core.persistence.SessionKey;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Something that happened during one iteration of a session.
 *
 * @param type      what happened
 * @param session   the session the iteration belongs to
 * @param iteration iteration number
 * @param phase     name of the phase the iteration ran in
 * @param payload   type-specific details, e.g. the failed action and its reason
 * @param timestamp when the event was published
 */
public record LodestarEvent(
    Type type,
    SessionKey session,
    int iteration,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) {

    public enum Type {
        ITERATION_STARTED("iteration.started"),
        ITERATION_ADVANCED("iteration.advanced"),
        ITERATION_PAUSED("iteration.paused"),
        ITERATION_COMPLETED("iteration.completed"),
        ITERATION_FAILED("iteration.failed"),
        ITERATION_STALLED("iteration.stalled"),
        ACTION_FAILED("action.failed");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /** The event closing an iteration that ended with the given status. */
        public static Type of(IterationOutcome.Status status) {
            return switch (status) {
                case ADVANCED -> ITERATION_ADVANCED;
                case PAUSED -> ITERATION_PAUSED;
                case COMPLETED -> ITERATION_COMPLETED;
                case FAILED -> ITERATION_FAILED;
                case STALLED -> ITERATION_STALLED;
            };
        }
    }

    public static LodestarEvent of(Type type, SessionKey session, int iteration, String phase,
                                   Map<String, Object> payload) {
        return new LodestarEvent(type, session, iteration, phase,
                Collections.unmodifiableMap(new LinkedHashMap<>(payload)), Instant.now());
    }
}
