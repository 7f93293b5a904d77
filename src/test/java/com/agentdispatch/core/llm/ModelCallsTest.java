package com.agentdispatch.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ModelCallsTest {

    @Test
    @DisplayName("a call that returns in time hands back its value on a dedicated thread")
    void returnsValue() throws TimeoutException {
        var threadName = new AtomicReference<String>();

        String value = ModelCalls.callWithTimeout("plan", () -> {
            threadName.set(Thread.currentThread().getName());
            return "ok";
        }, Duration.ofSeconds(5));

        assertEquals("ok", value);
        assertEquals("model-call-plan", threadName.get());
    }

    @Test
    @DisplayName("a slow call times out and is interrupted")
    void slowCallIsInterrupted() throws InterruptedException {
        var interrupted = new CountDownLatch(1);

        assertThrows(TimeoutException.class, () -> ModelCalls.callWithTimeout("slow", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return "late";
        }, Duration.ofMillis(50)));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("runtime failures of the call propagate unchanged")
    void failuresPropagate() {
        var thrown = assertThrows(LlmParseException.class, () -> ModelCalls.callWithTimeout("bad", () -> {
            throw new LlmParseException("not json");
        }, Duration.ofSeconds(5)));

        assertEquals("not json", thrown.getMessage());
    }
}
