package com.lodestar.dispatch.cli;

import com.lodestar.core.config.BootstrapConfig;
import com.lodestar.core.config.LodestarProperties;
import com.lodestar.core.engine.AgentRunner;
import com.lodestar.core.engine.IterationLimitExceededException;
import com.lodestar.core.engine.IterationOutcome;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.persistence.StateStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lodestar run &lt;agent&gt;
 * <p>
 * Runs iterations of one session until it pauses, completes, fails or stalls.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run an agent session until it pauses or ends")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Option(names = {"--session", "-s"}, description = "Session ID (default: ${DEFAULT-VALUE})", defaultValue = "default")
    private String session;

    @Option(names = {"--config", "-c"}, description = "Bootstrap YAML file (default: lodestar.bootstrap-file)")
    private Path config;

    @Option(names = {"--max-iterations", "-n"}, description = "Iteration limit (default: lodestar.engine.max-iterations)")
    private Integer maxIterations;

    @Option(names = {"--verbose", "-v"}, description = "Print engine events as they happen")
    private boolean verbose;

    private final AgentRunner runner;
    private final LodestarProperties properties;
    private final EventBus eventBus;

    public RunCommand(AgentRunner runner, LodestarProperties properties, EventBus eventBus) {
        this.runner = runner;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Running " + agent + " session " + session);

        try (EventBus.Subscription events = follow(eventBus, verbose, agent, session)) {
            BootstrapConfig bootstrap = loadBootstrap(config, properties);
            int limit = maxIterations != null ? maxIterations : properties.getEngine().getMaxIterations();
            IterationOutcome outcome = runner.run(agent, session, bootstrap, limit, ConsoleOutput::outcome);
            return ConsoleOutput.exitCode(outcome);
        } catch (IterationLimitExceededException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (IllegalArgumentException | IllegalStateException | StateStoreException | UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    /** Prints the session's events while the command runs; a no-op subscription when not verbose. */
    static EventBus.Subscription follow(EventBus eventBus, boolean verbose, String agent, String session) {
        if (!verbose) {
            return () -> { };
        }
        return eventBus.subscribe(SessionKey.of(agent, session), ConsoleOutput::event);
    }

    static BootstrapConfig loadBootstrap(Path config, LodestarProperties properties) {
        Path path = config != null ? config : Path.of(properties.getBootstrapFile());
        return BootstrapConfig.fromYaml(path);
    }
}
