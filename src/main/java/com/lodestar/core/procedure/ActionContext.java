package com.lodestar.core.procedure;

import com.lodestar.core.config.BootstrapConfig;
import com.lodestar.core.phase.Phase;

import java.util.Map;
import java.util.Optional;

/**
 * Controller-assembled context for one iteration, read-only to actions.
 *
 * @param agentId   agent being run
 * @param sessionId session being run
 * @param iteration iteration number the results will be recorded under
 * @param phase     phase whose procedure is running
 * @param config    bootstrap configuration of the run
 * @param inputs    external inputs supplied by the runtime for this iteration
 */
public record ActionContext(
        String agentId,
        String sessionId,
        int iteration,
        Phase phase,
        BootstrapConfig config,
        Map<String, Object> inputs
) {

    public ActionContext {
        config = config != null ? config : new BootstrapConfig();
        inputs = inputs != null ? Map.copyOf(inputs) : Map.of();
    }

    /**
     * Looks a value up in the iteration inputs first, then in the bootstrap extras.
     */
    public Optional<Object> lookup(String key) {
        if (inputs.containsKey(key)) {
            return Optional.of(inputs.get(key));
        }
        return Optional.ofNullable(config.getExtras().get(key));
    }
}
