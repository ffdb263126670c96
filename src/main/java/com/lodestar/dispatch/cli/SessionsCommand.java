package com.lodestar.dispatch.cli;

import com.lodestar.core.persistence.StateStore;
import com.lodestar.core.persistence.StateStoreException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: lodestar sessions &lt;agent&gt;
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List the stored sessions of an agent")
@Component
public class SessionsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    private final StateStore store;

    public SessionsCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        try {
            List<String> sessions = store.sessions(agent);
            if (sessions.isEmpty()) {
                ConsoleOutput.info("No sessions found for " + agent + ".");
                return 0;
            }
            ConsoleOutput.info("Sessions of " + agent + " (" + sessions.size() + "):");
            sessions.forEach(s -> System.out.println("  " + s));
            return 0;
        } catch (IllegalArgumentException | StateStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
