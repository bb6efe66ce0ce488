package com.auraflux.core.dispatch;

/**
 * Failure taxonomy used by the retry policy.
 */
public enum FailureKind {
    /** Timeouts and transient provider errors. Retried with backoff. */
    TRANSIENT,
    /** Invalid input, policy violations. Never retried. */
    PERMANENT
}
