package com.lodestar.core.policy;

import com.lodestar.core.phase.Phase;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Global, phase-independent constraints checked before every iteration.
 * <p>
 * Checked in order: failure keys present, required state keys incomplete,
 * user-required keys incomplete, completion keys present. Only when none
 * fire does the current phase's procedure run.
 *
 * @param requiredStateKeys keys that must exist for the agent to proceed autonomously
 * @param userRequiredKeys  keys that, when missing, require user input
 * @param completionKeys    keys that, when present, signal completion
 * @param failureKeys       keys that, when present, signal irrecoverable failure
 * @param contextPhase      phase whose procedure gathers missing required state; may be null,
 *                          in which case missing required state pauses the session
 */
public record ControlPolicy(
        Set<String> requiredStateKeys,
        Set<String> userRequiredKeys,
        Set<String> completionKeys,
        Set<String> failureKeys,
        Phase contextPhase
) {

    public ControlPolicy {
        requiredStateKeys = sorted(requiredStateKeys);
        userRequiredKeys = sorted(userRequiredKeys);
        completionKeys = sorted(completionKeys);
        failureKeys = sorted(failureKeys);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ControlPolicy none() {
        return builder().build();
    }

    public Optional<Phase> contextPhaseOptional() {
        return Optional.ofNullable(contextPhase);
    }

    public ControlDecision evaluate(Set<String> durableKeys) {
        Set<String> failed = intersection(failureKeys, durableKeys);
        if (!failed.isEmpty()) {
            return new ControlDecision(ControlDecision.Verdict.FAIL, failed);
        }
        Set<String> missingState = difference(requiredStateKeys, durableKeys);
        if (!missingState.isEmpty()) {
            return new ControlDecision(ControlDecision.Verdict.RETURN_TO_CONTEXT, missingState);
        }
        Set<String> missingInput = difference(userRequiredKeys, durableKeys);
        if (!missingInput.isEmpty()) {
            return new ControlDecision(ControlDecision.Verdict.AWAIT_INPUT, missingInput);
        }
        Set<String> completed = intersection(completionKeys, durableKeys);
        if (!completed.isEmpty()) {
            return new ControlDecision(ControlDecision.Verdict.COMPLETE, completed);
        }
        return ControlDecision.proceed();
    }

    /** Every key any of the four sets references. */
    public Set<String> referencedKeys() {
        var all = new TreeSet<String>(requiredStateKeys);
        all.addAll(userRequiredKeys);
        all.addAll(completionKeys);
        all.addAll(failureKeys);
        return Collections.unmodifiableSet(all);
    }

    private static Set<String> intersection(Set<String> declared, Set<String> present) {
        var out = new TreeSet<String>(declared);
        out.retainAll(present);
        return out;
    }

    private static Set<String> difference(Set<String> declared, Set<String> present) {
        var out = new TreeSet<String>(declared);
        out.removeAll(present);
        return out;
    }

    private static Set<String> sorted(Set<String> keys) {
        return keys == null || keys.isEmpty() ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(keys));
    }

    public static final class Builder {

        private Set<String> requiredStateKeys = Set.of();
        private Set<String> userRequiredKeys = Set.of();
        private Set<String> completionKeys = Set.of();
        private Set<String> failureKeys = Set.of();
        private Phase contextPhase;

        private Builder() {
        }

        public Builder requiredStateKeys(String... keys) {
            this.requiredStateKeys = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder userRequiredKeys(String... keys) {
            this.userRequiredKeys = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder completionKeys(String... keys) {
            this.completionKeys = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder failureKeys(String... keys) {
            this.failureKeys = Set.copyOf(Arrays.asList(keys));
            return this;
        }

        public Builder contextPhase(Phase phase) {
            this.contextPhase = phase;
            return this;
        }

        public ControlPolicy build() {
            return new ControlPolicy(requiredStateKeys, userRequiredKeys, completionKeys, failureKeys, contextPhase);
        }
    }
}
