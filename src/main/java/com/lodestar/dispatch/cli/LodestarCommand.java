package com.lodestar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Lodestar.
 * Routes to subcommands: run, step, state, history, sessions, describe.
 */
@Command(
        name = "lodestar",
        mixinStandardHelpOptions = true,
        version = "Lodestar 0.1.0",
        description = "Deterministic, resumable agent state machines",
        subcommands = {
                RunCommand.class,
                StepCommand.class,
                StateCommand.class,
                HistoryCommand.class,
                SessionsCommand.class,
                DescribeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LodestarCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
