package com.agentdispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: dispatch, resume, status, history.
 */
@Command(
        name = "agentdispatch",
        mixinStandardHelpOptions = true,
        version = "Agent Dispatch 0.1.0",
        description = "Decomposes a specification into tasks and runs them across a pool of agents",
        subcommands = {
                DispatchCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentDispatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
