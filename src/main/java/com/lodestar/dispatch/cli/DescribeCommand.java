package com.lodestar.dispatch.cli;

import com.lodestar.core.spec.AgentRegistry;
import com.lodestar.core.spec.AgentSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: lodestar describe &lt;agent&gt; [--mermaid]
 */
@Command(name = "describe", mixinStandardHelpOptions = true, description = "Describe an agent spec")
@Component
public class DescribeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Agent name")
    private String agent;

    @Option(names = {"--mermaid", "-m"}, description = "Print a Mermaid state diagram instead")
    private boolean mermaid;

    private final AgentRegistry registry;

    public DescribeCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        var spec = registry.find(agent);
        if (spec.isEmpty()) {
            ConsoleOutput.error("Unknown agent: " + agent + " (known: " + String.join(", ", registry.names()) + ")");
            return 1;
        }
        AgentSpec found = spec.get();
        System.out.println(mermaid ? found.toMermaid() : found.describe());
        return 0;
    }
}
