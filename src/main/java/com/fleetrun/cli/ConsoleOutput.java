package com.fleetrun.cli;

import com.fleetrun.core.events.FleetrunEvent;
import com.fleetrun.core.model.RunReport;
import com.fleetrun.core.model.ScenarioResult;
import com.fleetrun.core.model.ScenarioStatus;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for Fleetrun CLI.
 */
public class ConsoleOutput {

    static final String VERSION = "Fleetrun 0.1.0";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLEETRUN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLEETRUN]|@ " + message));
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

    public static void scenarioResult(ScenarioResult result) {
        String status = switch (result.status()) {
            case PASSED -> "@|fg(green) PASS|@";
            case FAILED -> "@|fg(red) FAIL|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
        String line = "  " + status + " " + result.featureName() + " :: " + result.scenarioName()
                + " (" + formatDuration(result.durationMs()) + ")";
        if (result.degraded()) {
            line += " @|faint [degraded]|@";
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
        if (result.error() != null && result.status() != ScenarioStatus.PASSED) {
            System.out.println("      " + result.error());
        }
    }

    public static void summary(RunReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + report.runId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Items: " + report.completedItems() + "/" + report.totalItems() + " completed, "
                + "@|fg(green) " + report.countByStatus(ScenarioStatus.PASSED) + " passed|@, "
                + "@|fg(red) " + report.countByStatus(ScenarioStatus.FAILED) + " failed|@"
                + (report.countByStatus(ScenarioStatus.SKIPPED) > 0
                        ? ", @|fg(yellow) " + report.countByStatus(ScenarioStatus.SKIPPED) + " skipped|@" : "")));
        System.out.println("  Workers: " + report.workersStarted());
        System.out.println("  Published: " + report.publishedCount());
        if (report.degradedCount() > 0) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) Degraded: " + report.degradedCount() + "|@"));
        }
        if (!report.unflushed().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) Unpublished data-driven scenarios: " + report.unflushed().size() + "|@"));
        }
        if (report.timedOut()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red),bold Deadline exceeded|@"));
        }
        System.out.println("  Duration: " + formatDuration(report.elapsedMs()));
    }

    public static void watchEvent(FleetrunEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "worker.ready", "worker.spawn_failed", "worker.disconnected" -> "@|fg(magenta) [WORKER]|@";
            case "item.dispatched", "item.completed" -> "@|fg(blue) [ITEM]|@";
            case "scenario.published" -> "@|fg(green) [PUBLISH]|@";
            case "run.timed_out" -> "@|fg(red),bold [TIMEOUT]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String data = describe(event.payload());
        if (event.workItemId() != null) {
            data = event.workItemId() + " " + data;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data.trim()));
    }

    private static String describe(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        return payload.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
