package com.auraflux.dispatch.api;

import com.auraflux.core.dispatch.Lane;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/tasks.
 *
 * @param taskType       configured task type
 * @param payload        task input
 * @param idempotencyKey client-chosen key; nullable, a random key is generated when absent
 * @param lane           lane override; nullable, defaults to the task type's lane
 */
public record TaskSubmissionRequest(
    @JsonProperty("task_type") String taskType,
    Map<String, Object> payload,
    @JsonProperty("idempotency_key") String idempotencyKey,
    Lane lane
) {}
