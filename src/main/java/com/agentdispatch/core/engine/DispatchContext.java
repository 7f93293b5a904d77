package com.agentdispatch.core.engine;

import com.agentdispatch.core.agent.AgentFactory;
import com.agentdispatch.core.agent.AgentPool;
import com.agentdispatch.core.model.AgentSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Resources owned by one dispatch: its agent pool and worker threads.
 * <p>
 * Workers come from a cached pool. The coordinator caps how many attempts run at once, so a
 * thread stuck in an agent that ignores interruption never holds back later attempts.
 * Closing the context interrupts leftover workers and shuts the agents down.
 */
public final class DispatchContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchContext.class);

    private final String sessionId;
    private final AgentPool pool;
    private final ExecutorService workers;

    DispatchContext(String sessionId, AgentPool pool, ExecutorService workers) {
        this.sessionId = sessionId;
        this.pool = pool;
        this.workers = workers;
    }

    /**
     * @param agentListener receives every agent status change
     */
    public static DispatchContext open(String sessionId, AgentFactory factory, int agentsPerProvider,
                                       Consumer<AgentSnapshot> agentListener) {
        var counter = new AtomicInteger();
        ExecutorService workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dispatch-" + sessionId + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new DispatchContext(sessionId, new AgentPool(factory, agentsPerProvider, agentListener), workers);
    }

    public String sessionId() {
        return sessionId;
    }

    public AgentPool pool() {
        return pool;
    }

    public ExecutorService workers() {
        return workers;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker threads of session {} did not stop within 5s", sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pool.close();
    }
}
