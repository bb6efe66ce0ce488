package com.auraflux.core.dispatch;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Structured outcome of one task execution attempt.
 *
 * @param idempotencyKey key of the originating request
 * @param sessionId      the target session
 * @param taskType       task type of the originating request
 * @param outcome        SUCCESS or FAILURE
 * @param payload        agent output on success (empty on failure)
 * @param error          failure message (null on success)
 * @param failureKind    TRANSIENT or PERMANENT on failure (null on success)
 * @param attempt        1-based attempt number that produced this result
 * @param producedAt     when the result was produced
 */
public record AgentTaskResult(
    String idempotencyKey,
    String sessionId,
    String taskType,
    TaskOutcome outcome,
    Map<String, Object> payload,
    String error,
    FailureKind failureKind,
    int attempt,
    Instant producedAt
) implements Serializable {

    public AgentTaskResult {
        payload = payload == null ? Map.of() : payload;
    }

    public static AgentTaskResult success(AgentTaskRequest request, Map<String, Object> payload, int attempt) {
        return new AgentTaskResult(request.idempotencyKey(), request.sessionId(), request.taskType(),
                TaskOutcome.SUCCESS, payload, null, null, attempt, Instant.now());
    }

    public static AgentTaskResult failure(AgentTaskRequest request, FailureKind kind, String error, int attempt) {
        return new AgentTaskResult(request.idempotencyKey(), request.sessionId(), request.taskType(),
                TaskOutcome.FAILURE, Map.of(), error, kind, attempt, Instant.now());
    }

    public boolean isSuccess() {
        return outcome == TaskOutcome.SUCCESS;
    }

    public boolean isTransientFailure() {
        return outcome == TaskOutcome.FAILURE && failureKind == FailureKind.TRANSIENT;
    }
}
