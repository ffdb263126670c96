package com.lodestar.dispatch.cli;

import com.lodestar.core.fact.Facts;
import com.lodestar.core.persistence.SessionKey;
import com.lodestar.core.persistence.StateStore;
import com.lodestar.core.persistence.StateStoreException;
import com.lodestar.core.state.IterationFacts;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: lodestar history &lt;agent&gt; --session &lt;id&gt;
 * <p>
 * Lists the iteration records of a session: iteration, phase, time and
 * the keys each action emitted.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show the iteration history of a session")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Option(names = {"--session", "-s"}, description = "Session ID", required = true)
    private String session;

    @Option(names = {"--limit", "-n"}, description = "Number of most recent records", defaultValue = "20")
    private int limit;

    private final StateStore store;

    public HistoryCommand(StateStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        try {
            SessionKey key = SessionKey.of(agent, session);
            List<IterationFacts> history = store.history(key);
            if (history.isEmpty()) {
                ConsoleOutput.info("No history for " + key + ".");
                return 0;
            }

            // Apply limit
            List<IterationFacts> display = history.size() > limit
                    ? history.subList(history.size() - limit, history.size())
                    : history;

            ConsoleOutput.info("History of " + key + " (" + display.size() + " of " + history.size() + "):");
            System.out.println();
            System.out.printf("  %-6s %-18s %-26s %s%n", "ITER", "PHASE", "TIMESTAMP", "EMITTED");
            System.out.println("  " + "-".repeat(76));
            for (IterationFacts record : display) {
                System.out.printf("  %-6d %-18s %-26s %s%n",
                        record.iteration(), record.phaseName(), record.timestamp(), describe(record.byAction()));
            }
            return 0;
        } catch (IllegalArgumentException | StateStoreException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private static String describe(Map<String, Facts> byAction) {
        if (byAction.isEmpty()) {
            return "-";
        }
        var sb = new StringBuilder();
        byAction.forEach((action, facts) -> {
            if (sb.length() > 0) sb.append("; ");
            sb.append(action).append(": ").append(String.join(", ", facts.keys()));
        });
        return ConsoleOutput.truncate(sb.toString(), 60);
    }
}
