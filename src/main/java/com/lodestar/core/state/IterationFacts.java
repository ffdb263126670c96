package com.lodestar.core.state;

import com.lodestar.core.fact.Facts;
import com.lodestar.core.phase.Phase;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One append-only history record: what each action emitted in one iteration.
 *
 * @param iteration 1-based iteration number within the session
 * @param phaseName name of the phase the iteration ran in
 * @param phase     the phase identity; {@code null} once the record has been read back from a store
 * @param timestamp when the iteration finished
 * @param byAction  action name to the facts it emitted, in execution order
 */
public record IterationFacts(
        int iteration,
        String phaseName,
        Phase phase,
        Instant timestamp,
        Map<String, Facts> byAction
) {

    public IterationFacts {
        if (iteration < 1) {
            throw new IllegalArgumentException("Iteration numbers start at 1, got " + iteration);
        }
        Objects.requireNonNull(phaseName, "phaseName");
        Objects.requireNonNull(timestamp, "timestamp");
        byAction = Collections.unmodifiableMap(new LinkedHashMap<>(byAction));
    }

    public static IterationFacts of(int iteration, Phase phase, Instant timestamp, Map<String, Facts> byAction) {
        return new IterationFacts(iteration, phase.name(), phase, timestamp, byAction);
    }

    /** Closing record for a session that ended without running a procedure. */
    public static IterationFacts closing(int iteration, Phase phase, Instant timestamp) {
        return of(iteration, phase, timestamp, Map.of());
    }

    public Optional<Phase> phaseOptional() {
        return Optional.ofNullable(phase);
    }

    /** Every fact emitted in the iteration, later actions winning on shared keys. */
    public Facts allFacts() {
        Facts all = Facts.empty();
        for (Facts facts : byAction.values()) {
            all = all.merge(facts);
        }
        return all;
    }

    /** Copy without the phase identity, as it reads after a store round trip. */
    public IterationFacts withoutPhaseIdentity() {
        return new IterationFacts(iteration, phaseName, null, timestamp, byAction);
    }
}
