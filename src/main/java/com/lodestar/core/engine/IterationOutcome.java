package com.lodestar.core.engine;

import com.lodestar.core.phase.Phase;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * What one call to {@link AgentController#runIteration} did.
 *
 * @param status      what happened
 * @param agentId     agent that was run
 * @param sessionId   session that was run
 * @param iteration   iteration number the call ran, or would have run for a pause
 * @param phase       phase whose procedure ran, or the current phase when preempted
 * @param nextPhase   phase derived from the new durable state; {@code null} unless ADVANCED
 * @param pauseReason why the session is paused; {@code null} unless PAUSED
 * @param keys        control-policy keys behind a preemption (missing or present)
 * @param actionName  action that failed; {@code null} unless an action failed
 * @param message     human-readable summary
 */
public record IterationOutcome(
        Status status,
        String agentId,
        String sessionId,
        int iteration,
        Phase phase,
        Phase nextPhase,
        PauseReason pauseReason,
        Set<String> keys,
        String actionName,
        String message
) {

    public enum Status {
        /** The procedure ran and its durable facts were persisted. */
        ADVANCED,
        /** Control policy is waiting for required state or user input. */
        PAUSED,
        /** A completion key is present. */
        COMPLETED,
        /** A failure key is present, or an action failed. */
        FAILED,
        /** The session repeatedly made no progress. */
        STALLED
    }

    public enum PauseReason {
        REQUIRED_STATE,
        USER_INPUT
    }

    public IterationOutcome {
        keys = keys == null || keys.isEmpty() ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(keys));
    }

    static IterationOutcome advanced(String agentId, String sessionId, int iteration, Phase phase, Phase nextPhase) {
        return new IterationOutcome(Status.ADVANCED, agentId, sessionId, iteration, phase, nextPhase, null, Set.of(), null,
                "Ran " + phase.name() + "; next phase " + nextPhase.name());
    }

    static IterationOutcome paused(String agentId, String sessionId, int iteration, Phase phase,
                                   PauseReason reason, Set<String> missingKeys) {
        String waitingFor = reason == PauseReason.USER_INPUT ? "user input" : "required state";
        return new IterationOutcome(Status.PAUSED, agentId, sessionId, iteration, phase, null, reason, missingKeys, null,
                "Waiting for " + waitingFor + ": " + String.join(", ", new TreeSet<>(missingKeys)));
    }

    static IterationOutcome completed(String agentId, String sessionId, int iteration, Phase phase, Set<String> keys) {
        return new IterationOutcome(Status.COMPLETED, agentId, sessionId, iteration, phase, null, null, keys, null,
                "Completed in " + phase.name() + " (" + String.join(", ", new TreeSet<>(keys)) + ")");
    }

    static IterationOutcome failed(String agentId, String sessionId, int iteration, Phase phase, Set<String> keys) {
        return new IterationOutcome(Status.FAILED, agentId, sessionId, iteration, phase, null, null, keys, null,
                "Failed in " + phase.name() + " (" + String.join(", ", new TreeSet<>(keys)) + ")");
    }

    static IterationOutcome actionFailed(String agentId, String sessionId, int iteration, Phase phase,
                                         String actionName, String reason) {
        return new IterationOutcome(Status.FAILED, agentId, sessionId, iteration, phase, null, null, Set.of(), actionName,
                "Action '" + actionName + "' failed: " + reason);
    }

    static IterationOutcome stalled(String agentId, String sessionId, int iteration, Phase phase, int stalledIterations) {
        return new IterationOutcome(Status.STALLED, agentId, sessionId, iteration, phase, null, null, Set.of(), null,
                "No progress in " + phase.name() + " for " + stalledIterations + " consecutive iterations");
    }

    /** An action failure: nothing was persisted and the iteration may simply be run again. */
    public boolean retryable() {
        return status == Status.FAILED && actionName != null;
    }

    /** The session is over: completed, failed by control policy, or stalled. */
    public boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.STALLED || (status == Status.FAILED && actionName == null);
    }

    public Optional<Phase> nextPhaseOptional() {
        return Optional.ofNullable(nextPhase);
    }

    public Optional<PauseReason> pauseReasonOptional() {
        return Optional.ofNullable(pauseReason);
    }
}
