package com.auraflux.core.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Returned by {@link TaskDispatcher#submit} once a task is queued.
 *
 * @param idempotencyKey the request key
 * @param sessionId      the target session
 * @param taskType       the task type
 * @param lane           the lane the task was queued on
 * @param acceptedAt     when the first submission with this key was accepted
 * @param replayed       true when this is the cached acceptance of an earlier submission
 */
public record TaskAcceptance(
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("task_type") String taskType,
    Lane lane,
    @JsonProperty("accepted_at") Instant acceptedAt,
    boolean replayed
) implements Serializable {

    public TaskAcceptance asReplay() {
        return new TaskAcceptance(idempotencyKey, sessionId, taskType, lane, acceptedAt, true);
    }
}
