package com.auraflux.core.dispatch;

import java.io.Serializable;

/**
 * Bounded exponential backoff for transient task failures.
 *
 * @param maxAttempts      total attempts including the first; 1 disables retry
 * @param initialBackoffMs delay before the second attempt
 * @param multiplier       growth factor per further attempt
 * @param maxBackoffMs     cap on any single delay
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMs,
    double multiplier,
    long maxBackoffMs
) implements Serializable {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoffMs = Math.max(0, initialBackoffMs);
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        maxBackoffMs = Math.max(initialBackoffMs, maxBackoffMs);
    }

    public boolean allowsAnotherAttempt(int attemptsSoFar) {
        return attemptsSoFar < maxAttempts;
    }

    /**
     * Delay before attempt {@code failedAttempt + 1}.
     */
    public long backoffAfter(int failedAttempt) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
