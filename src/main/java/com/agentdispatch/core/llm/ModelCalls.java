package com.agentdispatch.core.llm;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one language-model call on its own thread under a time limit.
 * <p>
 * The thread belongs to the call: on timeout the call is interrupted and the thread is
 * released, so a hung model never holds a shared pool.
 */
public final class ModelCalls {

    private ModelCalls() {}

    /**
     * @param name    used in the thread name
     * @throws TimeoutException if the call does not return within {@code timeout}; the call is interrupted
     */
    public static <T> T callWithTimeout(String name, Supplier<T> call, Duration timeout) throws TimeoutException {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "model-call-" + name);
            t.setDaemon(true);
            return t;
        });
        Future<T> future = executor.submit(call::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for model call " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Model call " + name + " failed: " + cause, cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
