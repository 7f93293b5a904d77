package com.agentdispatch.core.scheduler;

import java.time.Duration;

/**
 * Bounded retries with exponential backoff.
 *
 * @param maxAttempts total attempts per task, the first one included
 * @param base        delay before the first retry
 * @param max         cap on any single delay
 */
public record RetryPolicy(int maxAttempts, Duration base, Duration max) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
    }

    /**
     * @param failedAttempts attempts that have failed so far
     */
    public boolean shouldRetry(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * {@code base * 2^(failedAttempts-1)}, capped at {@code max}.
     */
    public Duration backoff(int failedAttempts) {
        if (failedAttempts < 1) {
            return Duration.ZERO;
        }
        int exponent = Math.min(failedAttempts - 1, 30);
        long millis = base.toMillis() << exponent;
        if (millis < 0 || millis > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(millis);
    }
}
