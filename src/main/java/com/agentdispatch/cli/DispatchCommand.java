package com.agentdispatch.cli;

import com.agentdispatch.core.engine.Dispatcher;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.Subscription;
import com.agentdispatch.core.model.ExecutionResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.Specification;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdispatch dispatch &lt;spec.json&gt;
 * <p>
 * Reads a specification document, runs it to completion and prints the per-task outcome
 * and metrics. Exits non-zero unless the dispatch completed.
 */
@Command(name = "dispatch", mixinStandardHelpOptions = true, description = "Run a specification")
@Component
public class DispatchCommand implements Callable<Integer> {

    static final ObjectMapper SPEC_READER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Parameters(index = "0", description = "Specification JSON file")
    private Path specFile;

    @Option(names = {"--session", "-s"}, description = "Session id to use instead of a generated one")
    private String sessionId;

    @Option(names = {"--watch", "-w"}, description = "Print engine events while the dispatch runs")
    private boolean watch;

    private final Dispatcher dispatcher;
    private final MessageBus bus;

    public DispatchCommand(Dispatcher dispatcher, MessageBus bus) {
        this.dispatcher = dispatcher;
        this.bus = bus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Specification spec;
        try {
            spec = readSpecification(specFile);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read specification " + specFile + ": " + e.getMessage());
            return 2;
        }

        String id = sessionId != null ? sessionId : dispatcher.generateSessionId();
        ConsoleOutput.info("Dispatching " + (spec.title() != null ? "\"" + spec.title() + "\" " : "")
                + "as session " + id + " (" + spec.requirements().size() + " requirements)");

        List<Subscription> subscriptions = new ArrayList<>();
        if (watch) {
            subscriptions.add(bus.subscribe("dispatch." + id, ConsoleOutput::watchEvent));
            subscriptions.add(bus.subscribe("task.*", ConsoleOutput::watchEvent));
        }
        ExecutionResult result;
        try {
            result = dispatcher.dispatch(id, spec);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Dispatch failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            subscriptions.forEach(Subscription::unsubscribe);
        }

        ConsoleOutput.result(result);
        return result.status() == ExecutionStatus.COMPLETED ? 0 : 1;
    }

    static Specification readSpecification(Path file) throws IOException {
        return SPEC_READER.readValue(Files.readString(file), Specification.class);
    }

    static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
