package com.awesomeposter.dispatch.cli;

import com.awesomeposter.core.events.RunEvent;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AWESOMEPOSTER ORCHESTRATOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ORCHESTRATOR]|@ " + message));
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

    /**
     * One line per run event, prefixed by its type.
     */
    public static void event(RunEvent event) {
        Map<String, Object> payload = event.payload();
        String prefix = switch (event.type()) {
            case START -> "@|fg(cyan) [START]|@";
            case PHASE -> "@|fg(blue) [PHASE]|@";
            case PROGRESS -> "@|fg(white) [PROGRESS]|@";
            case MESSAGE -> "@|fg(magenta) [MESSAGE]|@";
            case METRICS -> "@|fg(yellow) [METRICS]|@";
            case COMPLETE -> "@|fg(green),bold [COMPLETE]|@";
            case ERROR -> "@|fg(red),bold [ERROR]|@";
            case LOG -> "@|fg(yellow) [LOG]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event, payload)));
    }

    static String describe(RunEvent event, Map<String, Object> payload) {
        return switch (event.type()) {
            case START -> "run " + event.runId() + ": " + payload.get("objective");
            case PHASE -> payload.get("phase") + (event.stepId() != null ? " (" + event.stepId() + ")" : "");
            case PROGRESS -> payload.get("kind") + (event.stepId() != null ? " " + event.stepId() : "")
                    + (payload.containsKey("planVersion") ? " plan v" + payload.get("planVersion") : "")
                    + (payload.containsKey("error") ? ": " + payload.get("error") : "");
            case MESSAGE -> payload.get("kind") + (payload.containsKey("message") ? ": " + payload.get("message") : "")
                    + (payload.containsKey("requestId") ? " [request " + payload.get("requestId") + "]" : "");
            case METRICS -> payload.get("steps") + " steps, " + payload.get("failures") + " failed in "
                    + formatDuration(asLong(payload.get("durationMs")));
            case COMPLETE -> String.valueOf(payload.get("outcome"))
                    + (payload.containsKey("error") ? ": " + payload.get("error") : "");
            case ERROR, LOG -> String.valueOf(payload.get("message"));
        };
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
