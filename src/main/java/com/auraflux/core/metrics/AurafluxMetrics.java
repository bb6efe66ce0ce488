package com.auraflux.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session transitions, agent tasks and delivery.
 */
@Service
public class AurafluxMetrics {

    private final MeterRegistry registry;

    public AurafluxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String target, boolean allowed) {
        Counter.builder("auraflux.transitions")
                .tag("target", target)
                .tag("result", allowed ? "allowed" : "denied")
                .register(registry)
                .increment();
    }

    public void recordSubmission(String lane, String result) {
        Counter.builder("auraflux.tasks.submitted")
                .tag("lane", lane)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String taskType, boolean success, long ms) {
        Timer.builder("auraflux.task.duration")
                .tag("task_type", taskType)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String taskType) {
        Counter.builder("auraflux.tasks.retries")
                .tag("task_type", taskType)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "applied", "failed", "stale", "discarded" or "unknown"
     */
    public void recordReconciliation(String outcome) {
        Counter.builder("auraflux.reconciliations")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStreamMessageDropped() {
        Counter.builder("auraflux.delivery.stream_dropped")
                .description("Stream messages dropped from full subscriber buffers")
                .register(registry)
                .increment();
    }

    public void recordResync() {
        Counter.builder("auraflux.delivery.resyncs")
                .description("Resync signals issued after state buffer overflow")
                .register(registry)
                .increment();
    }
}
