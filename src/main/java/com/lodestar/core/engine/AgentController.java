package com.lodestar.core.engine;

import com.lodestar.core.config.BootstrapConfig;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.LodestarEvent;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.LodestarMetrics;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.persistence.StateStore;
import com.lodestar.core.phase.Phase;
import com.lodestar.core.policy.ControlDecision;
import com.lodestar.core.procedure.Action;
import com.lodestar.core.procedure.ActionContext;
import com.lodestar.core.procedure.ActionResult;
import com.lodestar.core.procedure.ProcedureTemplate;
import com.lodestar.core.spec.AgentRegistry;
import com.lodestar.core.spec.AgentSpec;
import com.lodestar.core.state.IterationFacts;
import com.lodestar.core.state.IterationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs exactly one iteration of one agent session per call.
 * <p>
 * An iteration:
 * <ol>
 *   <li>loads the durable facts and derives the current phase;</li>
 *   <li>evaluates the control policy, which may preempt (fail, pause or complete)
 *       without running anything or persisting facts;</li>
 *   <li>runs the phase's actions in order, applying each one's facts eagerly so the
 *       next action sees them;</li>
 *   <li>persists the durable subset with one history record and derives the next phase.</li>
 * </ol>
 * A failing action discards the whole iteration. Iterations that change neither the
 * durable facts nor the phase are counted by the {@link StallDetector}.
 * At most one iteration per session is in flight; a concurrent call is rejected.
 */
@Service
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentRegistry registry;
    private final StateStore store;
    private final StallDetector stallDetector;
    private final EventBus eventBus;
    private final LodestarMetrics metrics;

    private final Set<SessionKey> inFlight = ConcurrentHashMap.newKeySet();

    public AgentController(AgentRegistry registry,
                           StateStore store,
                           StallDetector stallDetector,
                           EventBus eventBus,
                           LodestarMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.stallDetector = stallDetector;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public IterationOutcome runIteration(String agentId, String sessionId) {
        return runIteration(agentId, sessionId, new BootstrapConfig(), Map.of());
    }

    /**
     * Runs one iteration.
     *
     * @param config bootstrap configuration exposed to actions
     * @param inputs external inputs exposed to actions for this iteration only
     * @throws IllegalArgumentException if the agent is unknown or an id is invalid
     * @throws IllegalStateException    if an iteration of this session is already running
     * @throws com.lodestar.core.persistence.StateStoreException if the store fails
     */
    public IterationOutcome runIteration(String agentId, String sessionId,
                                         BootstrapConfig config, Map<String, Object> inputs) {
        AgentSpec spec = registry.require(agentId);
        SessionKey key = SessionKey.of(agentId, sessionId);
        if (!inFlight.add(key)) {
            throw new IllegalStateException("An iteration of session " + key + " is already running");
        }
        long start = System.currentTimeMillis();
        try {
            MdcContext.setSession(agentId, sessionId);
            IterationOutcome outcome = iterate(spec, key, config, inputs);
            log.info("Iteration {} of {}: {} - {}", outcome.iteration(), key, outcome.status(), outcome.message());
            metrics.recordIterationOutcome(outcome.status().name());
            if (outcome.isTerminal()) {
                stallDetector.reset(key);
            }
            publishOutcome(key, outcome);
            return outcome;
        } finally {
            metrics.recordIterationDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
            inFlight.remove(key);
        }
    }

    /** Number of sessions with an iteration running right now. */
    int inFlightCount() {
        return inFlight.size();
    }

    private IterationOutcome iterate(AgentSpec spec, SessionKey key, BootstrapConfig config, Map<String, Object> inputs) {
        String agentId = key.agentId();
        String sessionId = key.sessionId();

        Facts durable = store.load(key);
        List<IterationFacts> history = store.history(key);
        int iteration = history.size() + 1;
        Phase phase = spec.derivePhase(durable.keys());
        MdcContext.setIteration(agentId, sessionId, iteration, phase.name());
        eventBus.publish(LodestarEvent.of(LodestarEvent.Type.ITERATION_STARTED, key, iteration, phase.name(), Map.of()));

        ControlDecision decision = spec.controlPolicy().evaluate(durable.keys());
        Phase runPhase = phase;
        switch (decision.verdict()) {
            case FAIL -> {
                appendClosingRecord(key, history, iteration, phase, durable);
                return IterationOutcome.failed(agentId, sessionId, iteration, phase, decision.keys());
            }
            case COMPLETE -> {
                appendClosingRecord(key, history, iteration, phase, durable);
                return IterationOutcome.completed(agentId, sessionId, iteration, phase, decision.keys());
            }
            case AWAIT_INPUT -> {
                return IterationOutcome.paused(agentId, sessionId, iteration, phase,
                        IterationOutcome.PauseReason.USER_INPUT, decision.keys());
            }
            case RETURN_TO_CONTEXT -> {
                if (spec.controlPolicy().contextPhase() == null) {
                    return IterationOutcome.paused(agentId, sessionId, iteration, phase,
                            IterationOutcome.PauseReason.REQUIRED_STATE, decision.keys());
                }
                runPhase = spec.controlPolicy().contextPhase();
                log.info("Required state {} missing; returning to {}", decision.keys(), runPhase.name());
                MdcContext.setIteration(agentId, sessionId, iteration, runPhase.name());
            }
            case PROCEED -> {
                // run the derived phase
            }
        }

        ProcedureTemplate procedure = spec.procedureFor(runPhase);
        var state = new IterationState(durable);
        var context = new ActionContext(agentId, sessionId, iteration, runPhase, config, inputs);
        var byAction = new LinkedHashMap<String, Facts>();
        log.debug("Running procedure '{}' ({} actions)", procedure.name(), procedure.actions().size());

        for (Action action : procedure.actions()) {
            String failure = runAction(action, state, context, byAction);
            if (failure != null) {
                log.warn("Action '{}' failed: {}; discarding iteration {}", action.name(), failure, iteration);
                metrics.incrementActionFailures(action.name());
                eventBus.publish(LodestarEvent.of(LodestarEvent.Type.ACTION_FAILED, key, iteration, runPhase.name(),
                        Map.of("action", action.name(), "reason", failure)));
                return IterationOutcome.actionFailed(agentId, sessionId, iteration, runPhase, action.name(), failure);
            }
        }

        Facts newDurable = state.durableFacts();
        Phase nextPhase = spec.derivePhase(newDurable.keys());
        boolean progressed = StallDetector.madeProgress(
                DurableFingerprint.of(durable), phase, DurableFingerprint.of(newDurable), nextPhase);
        if (stallDetector.recordIteration(key, progressed)) {
            return IterationOutcome.stalled(agentId, sessionId, iteration, runPhase, stallDetector.stalledCount(key));
        }

        store.save(key, IterationFacts.of(iteration, runPhase, now(), byAction), newDurable);
        metrics.recordDurableFactCount(newDurable.size());
        return IterationOutcome.advanced(agentId, sessionId, iteration, runPhase, nextPhase);
    }

    /**
     * @return {@code null} on success, otherwise the failure reason
     */
    private String runAction(Action action, IterationState state, ActionContext context, Map<String, Facts> byAction) {
        long start = System.currentTimeMillis();
        ActionResult result;
        try {
            result = action.execute(state.snapshot(), context);
        } catch (Exception e) {
            log.warn("Action '{}' threw {}", action.name(), e.toString(), e);
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        } finally {
            metrics.recordActionDuration(action.name(), System.currentTimeMillis() - start);
        }
        if (result == null) {
            return "returned no result";
        }
        if (!result.isSuccess()) {
            return result.failureReason();
        }
        List<String> problems = action.emits().conformanceProblems(result.facts());
        if (!problems.isEmpty()) {
            return "emission drift: " + String.join("; ", problems);
        }
        state.apply(result.facts());
        byAction.put(action.name(), result.facts());
        log.debug("Action '{}' emitted {}", action.name(), result.facts().keys());
        return null;
    }

    private void appendClosingRecord(SessionKey key, List<IterationFacts> history, int iteration, Phase phase,
                                     Facts durable) {
        if (!history.isEmpty() && history.get(history.size() - 1).phaseName().equals(phase.name())) {
            return;
        }
        store.save(key, IterationFacts.closing(iteration, phase, now()), durable);
        log.debug("Appended closing record {} in {}", iteration, phase.name());
    }

    private void publishOutcome(SessionKey key, IterationOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        outcome.nextPhaseOptional().ifPresent(p -> payload.put("nextPhase", p.name()));
        outcome.pauseReasonOptional().ifPresent(r -> payload.put("pauseReason", r.name()));
        if (!outcome.keys().isEmpty()) {
            payload.put("keys", List.copyOf(outcome.keys()));
        }
        if (outcome.actionName() != null) {
            payload.put("action", outcome.actionName());
        }
        payload.put("message", outcome.message());
        eventBus.publish(LodestarEvent.of(LodestarEvent.Type.of(outcome.status()), key,
                outcome.iteration(), outcome.phase().name(), payload));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
