package com.agentdispatch.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(3));

    @Test
    @DisplayName("maxAttempts counts the first attempt")
    void attemptsAreBounded() {
        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    @DisplayName("backoff doubles and is capped")
    void exponentialBackoff() {
        assertEquals(Duration.ZERO, policy.backoff(0));
        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(2), policy.backoff(2));
        assertEquals(Duration.ofSeconds(3), policy.backoff(3));
        assertEquals(Duration.ofSeconds(3), policy.backoff(40));
    }

    @Test
    @DisplayName("a single attempt means no retries")
    void singleAttempt() {
        var once = new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(10));

        assertFalse(once.shouldRetry(1));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
    }
}
