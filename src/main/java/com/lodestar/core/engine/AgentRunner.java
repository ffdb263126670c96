package com.lodestar.core.engine;

import com.lodestar.core.config.BootstrapConfig;
import com.lodestar.core.config.LodestarProperties;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.persistence.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Drives a session through repeated iterations until it pauses or ends.
 * <p>
 * Bootstraps the session from the {@link BootstrapConfig} seed facts, then
 * calls {@link AgentController#runIteration} while the outcome is ADVANCED.
 * Action failures are retried up to {@code lodestar.engine.max-action-retries}
 * consecutive times.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final AgentController controller;
    private final StateStore store;
    private final LodestarProperties properties;

    public AgentRunner(AgentController controller, StateStore store, LodestarProperties properties) {
        this.controller = controller;
        this.store = store;
        this.properties = properties;
    }

    public IterationOutcome run(String agentId, String sessionId, BootstrapConfig config) {
        return run(agentId, sessionId, config, properties.getEngine().getMaxIterations(), outcome -> { });
    }

    /**
     * @param maxIterations upper bound on iterations run by this call
     * @param listener      invoked with every iteration outcome, including retried failures
     * @return the first outcome that is not ADVANCED (or the last failed attempt once retries are exhausted)
     * @throws IterationLimitExceededException if {@code maxIterations} iterations all advanced
     */
    public IterationOutcome run(String agentId, String sessionId, BootstrapConfig config,
                                int maxIterations, Consumer<IterationOutcome> listener) {
        bootstrap(agentId, sessionId, config);
        int maxRetries = properties.getEngine().getMaxActionRetries();
        int retries = 0;

        for (int i = 0; i < maxIterations; i++) {
            IterationOutcome outcome = controller.runIteration(agentId, sessionId, config, Map.of());
            listener.accept(outcome);

            if (outcome.status() == IterationOutcome.Status.ADVANCED) {
                retries = 0;
                continue;
            }
            if (outcome.retryable() && retries < maxRetries) {
                retries++;
                log.warn("Retrying session {}/{} after action failure ({} of {}): {}",
                        agentId, sessionId, retries, maxRetries, outcome.message());
                continue;
            }
            return finish(outcome);
        }
        throw new IterationLimitExceededException("Session " + agentId + "/" + sessionId
                + " did not pause or finish within " + maxIterations + " iterations");
    }

    /**
     * Bootstraps the session if needed and runs a single iteration.
     */
    public IterationOutcome step(String agentId, String sessionId, BootstrapConfig config) {
        bootstrap(agentId, sessionId, config);
        return finish(controller.runIteration(agentId, sessionId, config, Map.of()));
    }

    private void bootstrap(String agentId, String sessionId, BootstrapConfig config) {
        SessionKey key = SessionKey.of(agentId, sessionId);
        if (store.bootstrap(key, config.seedFacts())) {
            log.info("Started session {}", key);
        }
    }

    private IterationOutcome finish(IterationOutcome outcome) {
        if (outcome.isTerminal() && outcome.status() != IterationOutcome.Status.STALLED
                && properties.getEngine().isClearSessionOnTerminal()) {
            SessionKey key = SessionKey.of(outcome.agentId(), outcome.sessionId());
            store.clearScope(key, Scope.SESSION);
            log.info("Cleared session facts of {} after {}", key, outcome.status());
        }
        return outcome;
    }
}
