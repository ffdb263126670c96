package com.lodestar.core.procedure;

import com.lodestar.core.emission.EmissionSpec;
import com.lodestar.core.fact.FactView;

/**
 * A unit of work inside a procedure.
 * <p>
 * Given a read-only snapshot of the facts visible in the current iteration,
 * an action returns either a bundle of facts built through its own
 * {@link #emits()} spec or a failure. Implementations must complete or fail
 * within one call and must not retain the snapshot.
 *
 * <pre>{@code
 * class SayHello implements Action {
 *     static final EmissionSpec EMITS = EmissionSpec.builder()
 *             .emit("said_hello", Emission.of(Scope.SESSION, FactKind.PROGRESS))
 *             .build();
 *
 *     public EmissionSpec emits() { return EMITS; }
 *
 *     public ActionResult execute(FactView facts, ActionContext context) {
 *         return ActionResult.success(EMITS.build("said_hello", true));
 *     }
 * }
 * }</pre>
 */
public interface Action {

    /** Name recorded in the iteration history; defaults to the simple class name. */
    default String name() {
        return getClass().getSimpleName();
    }

    /** The facts this action may emit. Used by spec validation and to check every result. */
    EmissionSpec emits();

    /**
     * Runs the action. Thrown exceptions are treated by the controller as a failed result.
     */
    ActionResult execute(FactView facts, ActionContext context) throws Exception;
}
