package com.lodestar.dispatch.cli;

import com.lodestar.core.config.LodestarProperties;
import com.lodestar.core.engine.AgentRunner;
import com.lodestar.core.engine.IterationOutcome;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.persistence.StateStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lodestar step &lt;agent&gt; --session &lt;id&gt;
 * <p>
 * Runs exactly one iteration, bootstrapping the session first if it is new.
 */
@Command(name = "step", mixinStandardHelpOptions = true, description = "Run a single iteration of an agent session")
@Component
public class StepCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Option(names = {"--session", "-s"}, description = "Session ID", required = true)
    private String session;

    @Option(names = {"--config", "-c"}, description = "Bootstrap YAML file (default: lodestar.bootstrap-file)")
    private Path config;

    @Option(names = {"--verbose", "-v"}, description = "Print engine events as they happen")
    private boolean verbose;

    private final AgentRunner runner;
    private final LodestarProperties properties;
    private final EventBus eventBus;

    public StepCommand(AgentRunner runner, LodestarProperties properties, EventBus eventBus) {
        this.runner = runner;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        try (EventBus.Subscription events = RunCommand.follow(eventBus, verbose, agent, session)) {
            IterationOutcome outcome = runner.step(agent, session, RunCommand.loadBootstrap(config, properties));
            ConsoleOutput.outcome(outcome);
            return ConsoleOutput.exitCode(outcome);
        } catch (IllegalArgumentException | IllegalStateException | StateStoreException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
