package com.auraflux.core.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One recorded task failure.
 *
 * @param idempotencyKey key of the failed request
 * @param taskType       task type
 * @param reason         TRANSIENT, PERMANENT or STALE
 * @param message        failure detail
 * @param attempts       attempts made before giving up
 * @param occurredAt     when the failure was recorded
 */
public record TaskFailure(
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("task_type") String taskType,
    String reason,
    String message,
    int attempts,
    @JsonProperty("occurred_at") Instant occurredAt
) implements Serializable {}
