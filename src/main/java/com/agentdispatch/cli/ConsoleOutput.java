package com.agentdispatch.cli;

import com.agentdispatch.core.events.Message;
import com.agentdispatch.core.model.ExecutionMetrics;
import com.agentdispatch.core.model.ExecutionResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.TaskOutcome;
import com.agentdispatch.core.model.TaskStatus;
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
                "@|bold,fg(yellow) AGENT DISPATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DISPATCH]|@ " + message));
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

    public static void status(ExecutionStatus status) {
        switch (status) {
            case COMPLETED -> success("Status: " + status);
            case FAILED -> error("Status: " + status);
            case CANCELLED -> warn("Status: " + status);
            default -> info("Status: " + status);
        }
    }

    public static void taskTable(Iterable<TaskOutcome> tasks) {
        System.out.println();
        System.out.printf("  %-10s %-14s %-10s %-6s %s%n", "TASK", "TYPE", "STATUS", "RETRY", "DETAIL");
        System.out.println("  " + "-".repeat(72));
        for (TaskOutcome t : tasks) {
            String detail = t.statusReason() != null ? t.statusReason() : String.join(", ", t.outputArtifacts());
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-10s %-14s %s %-6d %s",
                    t.id(), t.type(), colored(t.status()), t.retryCount(), truncate(detail, 40))));
        }
    }

    public static void result(ExecutionResult result) {
        System.out.println();
        System.out.println("SESSION " + result.sessionId());
        status(result.status());
        taskTable(result.tasks());
        metrics(result.metrics());
        if (!result.errors().isEmpty()) {
            System.out.println();
            error("Errors (" + result.errors().size() + "):");
            for (String e : result.errors()) {
                error("  " + e);
            }
        }
    }

    public static void metrics(ExecutionMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Dispatch Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + m.totalTasks() + " total, @|fg(green) " + m.completedTasks() + " completed|@, @|fg(red) "
                        + m.failedTasks() + " failed|@, " + m.skippedTasks() + " skipped, "
                        + m.cancelledTasks() + " cancelled"));
        int retries = m.retryCounts().values().stream().mapToInt(Integer::intValue).sum();
        if (retries > 0) {
            System.out.println("  Retries: " + retries);
        }
        if (!m.agentUtilization().isEmpty()) {
            var sb = new StringBuilder("  Agents:");
            for (Map.Entry<String, Double> e : m.agentUtilization().entrySet()) {
                sb.append(' ').append(e.getKey()).append('=').append(Math.round(e.getValue() * 100)).append('%');
            }
            System.out.println(sb);
        }
        System.out.println("  Critical path: " + String.format("%.1f", m.criticalPathLength()) + " units");
        System.out.println("  Duration: " + formatDuration(m.endToEndLatencyMs()));
    }

    public static void watchEvent(Message message) {
        String type = message.type() == null ? message.topic() : message.type();
        String prefix = switch (type) {
            case "dispatch.started", "dispatch.progress" -> "@|fg(cyan) [DISPATCH]|@";
            case "dispatch.phase" -> "@|bold,fg(yellow) [PHASE]|@";
            case "dispatch.finished" -> "@|bold [FINISHED]|@";
            case "task.status", "task.artifact" -> "@|fg(blue) [TASK]|@";
            case "agent.status" -> "@|fg(magenta) [AGENT]|@";
            case "checkpoint.saved" -> "@|faint [CHECKPOINT]|@";
            default -> "@|fg(white) [" + type + "]|@";
        };
        var fields = new StringBuilder();
        message.payload().forEach((k, v) -> {
            if (!"type".equals(k) && !"sessionId".equals(k)) {
                fields.append(k).append('=').append(v).append(' ');
            }
        });
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + fields.toString().trim()));
    }

    private static String colored(TaskStatus status) {
        String padded = String.format("%-10s", status);
        return switch (status) {
            case COMPLETED -> "@|fg(green) " + padded + "|@";
            case FAILED -> "@|fg(red) " + padded + "|@";
            case SKIPPED, CANCELLED -> "@|fg(yellow) " + padded + "|@";
            default -> padded;
        };
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
