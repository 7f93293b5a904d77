package com.agentdispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the matching subcommand.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentDispatchCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentDispatchCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
