package com.lodestar.core.procedure;

import com.lodestar.core.fact.Facts;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link Action#execute} call: facts on success, a reason on failure.
 */
public final class ActionResult {

    private final Facts facts;
    private final String failureReason;
    private final Throwable cause;

    private ActionResult(Facts facts, String failureReason, Throwable cause) {
        this.facts = facts;
        this.failureReason = failureReason;
        this.cause = cause;
    }

    public static ActionResult success(Facts facts) {
        return new ActionResult(Objects.requireNonNull(facts, "facts"), null, null);
    }

    public static ActionResult failure(String reason) {
        return new ActionResult(null, Objects.requireNonNull(reason, "reason"), null);
    }

    public static ActionResult failure(String reason, Throwable cause) {
        return new ActionResult(null, Objects.requireNonNull(reason, "reason"), cause);
    }

    public boolean isSuccess() {
        return facts != null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public Facts facts() {
        if (facts == null) {
            throw new IllegalStateException("Failed action result has no facts: " + failureReason);
        }
        return facts;
    }

    public String failureReason() {
        return failureReason;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ActionResult[success " + facts.keys() + "]" : "ActionResult[failure: " + failureReason + "]";
    }
}
