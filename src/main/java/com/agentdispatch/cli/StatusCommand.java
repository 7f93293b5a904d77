package com.agentdispatch.cli;

import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.persistence.CheckpointQueryService;
import com.agentdispatch.core.state.CheckpointCorruptException;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.agentdispatch.core.state.TaskState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * CLI command: agentdispatch status &lt;session-id&gt;
 * <p>
 * Shows the latest checkpoint of a session: task progress and published artifacts.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the latest checkpoint of a session")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    private final CheckpointQueryService queryService;

    public StatusCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Optional<DispatchCheckpoint> latest;
        try {
            latest = queryService.latestCheckpoint(sessionId);
        } catch (CheckpointCorruptException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (latest.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return;
        }
        DispatchCheckpoint checkpoint = latest.get();

        System.out.println();
        System.out.println("SESSION " + checkpoint.sessionId());
        ConsoleOutput.info("Checkpoint " + checkpoint.checkpointId() + " (" + checkpoint.reason() + ") at "
                + checkpoint.createdAt());
        if (checkpoint.cancelRequested()) {
            ConsoleOutput.warn("Cancellation was requested");
        }

        System.out.println();
        System.out.printf("  %-10s %-14s %-10s %-6s %-12s %s%n", "TASK", "TYPE", "STATUS", "RETRY", "AGENT", "DESCRIPTION");
        System.out.println("  " + "-".repeat(80));
        for (Task task : checkpoint.graph().tasks()) {
            TaskState state = checkpoint.taskStates().get(task.id());
            System.out.printf("  %-10s %-14s %-10s %-6d %-12s %s%n",
                    task.id(), task.type(), state.status(), state.retryCount(),
                    state.assignedAgentId() != null ? state.assignedAgentId() : "-",
                    ConsoleOutput.truncate(task.description(), 30));
        }

        if (!checkpoint.artifacts().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Artifacts (" + checkpoint.artifacts().size() + "):");
            checkpoint.artifacts().forEach(a -> System.out.println("  " + a.name()
                    + " <- " + a.producedBy() + (a.partial() ? " (placeholder)" : "")));
        }
    }
}
