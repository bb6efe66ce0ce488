package com.auraflux.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AurafluxMetricsTest {

    private SimpleMeterRegistry registry;
    private AurafluxMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AurafluxMetrics(registry);
    }

    @Test
    @DisplayName("recordTransition counts allowed and denied separately")
    void recordTransition() {
        metrics.recordTransition("EXPLORATION", true);
        metrics.recordTransition("EXPLORATION", false);
        metrics.recordTransition("EXPLORATION", false);

        var allowed = registry.find("auraflux.transitions").tag("result", "allowed").counter();
        var denied = registry.find("auraflux.transitions").tag("result", "denied").counter();
        assertNotNull(allowed);
        assertNotNull(denied);
        assertEquals(1.0, allowed.count());
        assertEquals(2.0, denied.count());
    }

    @Test
    @DisplayName("recordTaskExecution records a timer by task type")
    void recordTaskExecution() {
        metrics.recordTaskExecution("KEYWORD_EXTRACTION", true, 250);
        var timer = registry.find("auraflux.task.duration").tag("task_type", "KEYWORD_EXTRACTION").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("submission, retry and reconciliation counters are tagged")
    void taggedCounters() {
        metrics.recordSubmission("STREAM", "accepted");
        metrics.recordRetry("FEASIBILITY_SCORING");
        metrics.recordReconciliation("stale");

        assertEquals(1.0, registry.find("auraflux.tasks.submitted").tag("lane", "STREAM").counter().count());
        assertEquals(1.0, registry.find("auraflux.tasks.retries").counter().count());
        assertEquals(1.0, registry.find("auraflux.reconciliations").tag("outcome", "stale").counter().count());
    }

    @Test
    @DisplayName("delivery counters increment")
    void deliveryCounters() {
        metrics.recordStreamMessageDropped();
        metrics.recordStreamMessageDropped();
        metrics.recordResync();
        assertEquals(2.0, registry.find("auraflux.delivery.stream_dropped").counter().count());
        assertEquals(1.0, registry.find("auraflux.delivery.resyncs").counter().count());
    }
}
