package com.auraflux.core.agent;

import com.auraflux.core.delivery.DeliveryChannelRouter;
import com.auraflux.core.delivery.PushMessage;
import com.auraflux.core.dispatch.AgentTaskRequest;
import com.auraflux.core.dispatch.AgentTaskResult;
import com.auraflux.core.dispatch.FailureKind;
import com.auraflux.core.dispatch.Lane;
import com.auraflux.core.metrics.AurafluxMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Executes one attempt of an agent task on a worker thread.
 * <p>
 * The runner never reads or writes session state: it turns a request into an
 * {@link AgentTaskResult} and, for streaming tasks, forwards sequenced chunks to the stream
 * channel. It never throws; every failure is folded into a FAILURE result.
 */
@Service
public class AgentTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskRunner.class);

    private final GenerationService generationService;
    private final DeliveryChannelRouter router;
    private final AurafluxMetrics metrics;

    public AgentTaskRunner(GenerationService generationService, DeliveryChannelRouter router,
                           AurafluxMetrics metrics) {
        this.generationService = generationService;
        this.router = router;
        this.metrics = metrics;
    }

    public AgentTaskResult run(AgentTaskRequest request, AgentRoleConfig role, int attempt) {
        long start = System.currentTimeMillis();
        AgentRoleConfig effective = role.onLane(request.lane());
        AgentTaskResult result;
        try {
            Map<String, Object> output = generationService.generate(
                    request.taskType(), request.payload(), effective, chunkSink(request));
            result = AgentTaskResult.success(request, output, attempt);
        } catch (GenerationException e) {
            result = AgentTaskResult.failure(request, e.kind(), e.getMessage(), attempt);
        } catch (RuntimeException e) {
            log.error("Unexpected error running {} attempt {}", request.taskType(), attempt, e);
            result = AgentTaskResult.failure(request, FailureKind.PERMANENT,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), attempt);
        }

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordTaskExecution(request.taskType(), result.isSuccess(), elapsed);
        if (result.isSuccess()) {
            log.info("Task {} attempt {} succeeded in {}ms", request.taskType(), attempt, elapsed);
        } else {
            log.warn("Task {} attempt {} failed ({}) in {}ms: {}", request.taskType(), attempt,
                    result.failureKind(), elapsed, result.error());
        }
        return result;
    }

    private Consumer<String> chunkSink(AgentTaskRequest request) {
        if (request.lane() != Lane.STREAM) {
            return chunk -> { };
        }
        var seq = new AtomicLong();
        return chunk -> {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("seq", seq.incrementAndGet());
            payload.put("chunk", chunk);
            router.publishStream(request.sessionId(), request.taskType(), request.idempotencyKey(),
                    PushMessage.TASK_CHUNK, payload);
        };
    }
}
