package com.auraflux.core.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("backoff grows exponentially and is capped")
    void exponentialBackoff() {
        var policy = new RetryPolicy(5, 100, 2.0, 500);

        assertEquals(100, policy.backoffAfter(1));
        assertEquals(200, policy.backoffAfter(2));
        assertEquals(400, policy.backoffAfter(3));
        assertEquals(500, policy.backoffAfter(4));
    }

    @Test
    @DisplayName("attempt budget includes the first attempt")
    void attemptBudget() {
        var policy = new RetryPolicy(3, 0, 1.0, 0);

        assertTrue(policy.allowsAnotherAttempt(1));
        assertTrue(policy.allowsAnotherAttempt(2));
        assertFalse(policy.allowsAnotherAttempt(3));
    }

    @Test
    @DisplayName("out-of-range values are clamped")
    void clamping() {
        var policy = new RetryPolicy(0, -5, 0.5, 10);

        assertEquals(1, policy.maxAttempts());
        assertEquals(0, policy.initialBackoffMs());
        assertEquals(1.0, policy.multiplier());
        assertFalse(policy.allowsAnotherAttempt(1));
    }

    @Test
    @DisplayName("dispatcher defaults map onto a policy")
    void defaultsFromProperties() {
        RetryPolicy policy = new DispatcherProperties().getRetry().toPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(500, policy.initialBackoffMs());
        assertEquals(1000, policy.backoffAfter(2));
    }
}
