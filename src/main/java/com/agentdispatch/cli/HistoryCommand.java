package com.agentdispatch.cli;

import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.persistence.CheckpointQueryService;
import com.agentdispatch.core.persistence.SessionSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: agentdispatch history
 * <p>
 * Lists the sessions known to the checkpoint store as a table:
 * Session ID | Last checkpoint | Done/Total | Failed | Updated.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List dispatch sessions")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final CheckpointQueryService queryService;

    public HistoryCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SessionSummary> sessions = queryService.listSessions();
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No sessions found.");
            return;
        }

        List<SessionSummary> display = sessions.size() > limit
                ? sessions.subList(sessions.size() - limit, sessions.size())
                : sessions;

        ConsoleOutput.info("Sessions (" + display.size() + " of " + sessions.size() + "):");
        System.out.println();
        System.out.printf("  %-20s %-16s %-10s %-8s %s%n", "SESSION ID", "LAST CHECKPOINT", "DONE", "FAILED", "UPDATED");
        System.out.println("  " + "-".repeat(76));

        for (SessionSummary s : display) {
            System.out.printf("  %-20s %-16s %-10s %-8d %s%n",
                    s.sessionId(),
                    s.lastReason() != null ? s.lastReason() : "-",
                    s.count(TaskStatus.COMPLETED) + "/" + s.totalTasks(),
                    s.count(TaskStatus.FAILED),
                    s.updatedAt() != null ? s.updatedAt() : "-");
        }
    }
}
