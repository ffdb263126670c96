package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.IterationOutcome;
import com.lodestar.core.events.LodestarEvent;
import com.lodestar.core.fact.Fact;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Lodestar CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LODESTAR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LODESTAR]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void outcome(IterationOutcome outcome) {
        String prefix = switch (outcome.status()) {
            case ADVANCED -> "@|fg(blue) [ITERATION " + outcome.iteration() + "]|@";
            case PAUSED -> "@|fg(yellow),bold [PAUSED]|@";
            case COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case FAILED -> outcome.retryable()
                    ? "@|fg(red) [ACTION FAILED]|@"
                    : "@|fg(red),bold [FAILED]|@";
            case STALLED -> "@|fg(magenta),bold [STALLED]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + outcome.message()));
    }

    /** One engine event, printed by run and step in verbose mode. */
    public static void event(LodestarEvent event) {
        String detail = event.payload().isEmpty() ? "" : " " + truncate(event.payload().toString(), 80);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint   > " + event.type().wireName() + " #" + event.iteration() + " " + event.phase() + "|@" + detail));
    }

    public static void fact(Fact fact) {
        System.out.printf("  %-28s %-11s %-13s %s%n",
                fact.key(), fact.scope().wireName(), fact.kind().name().toLowerCase(Locale.ROOT), truncate(fact.value().toString(), 60));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    /** Exit code for an outcome: 0 when the session completed, paused or advanced, 1 otherwise. */
    static int exitCode(IterationOutcome outcome) {
        return switch (outcome.status()) {
            case ADVANCED, PAUSED, COMPLETED -> 0;
            case FAILED, STALLED -> 1;
        };
    }
}
