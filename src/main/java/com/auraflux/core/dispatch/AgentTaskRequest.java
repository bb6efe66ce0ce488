package com.auraflux.core.dispatch;

import java.io.Serializable;
import java.util.Map;

/**
 * A request to run one agent task for a session.
 *
 * @param taskType       configured task type, e.g. "keyword-extraction"
 * @param sessionId      the target session
 * @param idempotencyKey unique per logical request; resubmissions with the same key never run twice
 * @param payload        task input passed to the generation service
 * @param lane           requested lane, or null to use the lane configured for the task type
 */
public record AgentTaskRequest(
    String taskType,
    String sessionId,
    String idempotencyKey,
    Map<String, Object> payload,
    Lane lane
) implements Serializable {

    public AgentTaskRequest {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
