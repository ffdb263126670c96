package com.lodestar.core.policy;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of evaluating a {@link ControlPolicy} against the durable key set.
 *
 * @param verdict what the controller must do
 * @param keys    the keys behind the verdict: present failure/completion keys,
 *                or missing required/user-required keys; empty for PROCEED
 */
public record ControlDecision(Verdict verdict, Set<String> keys) {

    public enum Verdict {
        /** No constraint fired; run the current phase's procedure. */
        PROCEED,
        /** A failure key is present; the session has failed terminally. */
        FAIL,
        /** Required state keys are missing; return to gathering context. */
        RETURN_TO_CONTEXT,
        /** User-required keys are missing; pause until input arrives. */
        AWAIT_INPUT,
        /** A completion key is present; the session is done. */
        COMPLETE
    }

    public ControlDecision {
        keys = Collections.unmodifiableSet(new TreeSet<>(keys));
    }

    public static ControlDecision proceed() {
        return new ControlDecision(Verdict.PROCEED, Set.of());
    }

    public boolean preempts() {
        return verdict != Verdict.PROCEED;
    }

    public boolean isTerminal() {
        return verdict == Verdict.FAIL || verdict == Verdict.COMPLETE;
    }
}
