package com.lodestar.dispatch.cli;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.persistence.StateStore;
import com.lodestar.core.persistence.StateStoreException;
import com.lodestar.core.spec.AgentRegistry;
import com.lodestar.core.spec.AgentSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: lodestar state &lt;agent&gt; --session &lt;id&gt;
 * <p>
 * Shows the durable facts of a session and the phase they derive.
 */
@Command(name = "state", mixinStandardHelpOptions = true, description = "Show the durable facts of a session")
@Component
public class StateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Option(names = {"--session", "-s"}, description = "Session ID", required = true)
    private String session;

    private final StateStore store;
    private final AgentRegistry registry;

    public StateCommand(StateStore store, AgentRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    @Override
    public Integer call() {
        try {
            AgentSpec spec = registry.require(agent);
            SessionKey key = SessionKey.of(agent, session);
            if (!store.exists(key)) {
                ConsoleOutput.error("Session not found: " + key);
                return 1;
            }
            Facts facts = store.load(key);
            ConsoleOutput.info("Session " + key + " (" + facts.size() + " facts)");
            ConsoleOutput.info("Current phase: " + spec.derivePhase(facts.keys()).name());
            if (facts.isEmpty()) {
                return 0;
            }
            System.out.println();
            System.out.printf("  %-28s %-11s %-13s %s%n", "KEY", "SCOPE", "KIND", "VALUE");
            System.out.println("  " + "-".repeat(76));
            for (Fact fact : facts) {
                ConsoleOutput.fact(fact);
            }
            return 0;
        } catch (IllegalArgumentException | StateStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
