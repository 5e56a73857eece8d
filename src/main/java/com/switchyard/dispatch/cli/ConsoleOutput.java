package com.switchyard.dispatch.cli;

import com.switchyard.core.model.QueuedJob;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Switchyard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHYARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHYARD]|@ " + message));
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

    public static void route(String route, long latencyMs) {
        String color = switch (route) {
            case "local" -> "fg(green)";
            case "remote" -> "fg(blue)";
            case "cache" -> "fg(magenta)";
            default -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [" + route.toUpperCase() + "]|@ " + formatDuration(latencyMs)));
    }

    public static void job(QueuedJob job) {
        String color = switch (job.status()) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case PROCESSING -> "fg(blue)";
            case QUEUED -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-10s", job.status().key()) + "|@ "
                + job.id() + "  " + job.tool()
                + "  p=" + job.priority()
                + "  attempts=" + job.attempts() + "/" + job.maxAttempts()
                + (job.lastError() != null ? "  @|faint " + job.lastError() + "|@" : "")));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
