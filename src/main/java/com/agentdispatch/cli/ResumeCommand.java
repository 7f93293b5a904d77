package com.agentdispatch.cli;

import com.agentdispatch.core.engine.Dispatcher;
import com.agentdispatch.core.model.ExecutionResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.state.CheckpointCorruptException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdispatch resume &lt;session-id&gt;
 * <p>
 * Restores a session from its checkpoint and runs the remaining tasks.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a dispatch from its checkpoint")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--checkpoint", "-c"}, description = "Checkpoint id (default: latest)")
    private String checkpointId;

    private final Dispatcher dispatcher;

    public ResumeCommand(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming session " + sessionId
                + (checkpointId != null ? " from checkpoint " + checkpointId : ""));

        ExecutionResult result;
        try {
            result = dispatcher.resume(sessionId, checkpointId);
        } catch (CheckpointCorruptException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume failed: " + DispatchCommand.rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.result(result);
        return result.status() == ExecutionStatus.COMPLETED ? 0 : 1;
    }
}
