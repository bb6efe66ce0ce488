package com.auraflux.core.agent;

import com.auraflux.core.dispatch.Lane;
import com.auraflux.core.dispatch.RetryPolicy;

import java.io.Serializable;
import java.util.Map;

/**
 * Per task type agent configuration. Pure data, loaded from configuration.
 *
 * @param taskType     canonical task type, e.g. {@code KEYWORD_EXTRACTION}
 * @param promptRef    reference to the prompt template (informational, logged with each call)
 * @param systemPrompt system prompt sent to the model
 * @param lane         lane the task type runs on unless a request overrides it
 * @param resultKind   how the result payload is applied to the session
 * @param modelParams  model options such as {@code model}, {@code temperature}, {@code max-tokens}
 * @param retryPolicy  retry policy for transient failures
 */
public record AgentRoleConfig(
    String taskType,
    String promptRef,
    String systemPrompt,
    Lane lane,
    ResultKind resultKind,
    Map<String, Object> modelParams,
    RetryPolicy retryPolicy
) implements Serializable {

    public AgentRoleConfig {
        lane = lane == null ? Lane.DEFAULT : lane;
        modelParams = modelParams == null ? Map.of() : Map.copyOf(modelParams);
    }

    /**
     * The same role running on {@code requested}, e.g. when a request overrides the lane.
     */
    public AgentRoleConfig onLane(Lane requested) {
        if (requested == null || requested == lane) {
            return this;
        }
        return new AgentRoleConfig(taskType, promptRef, systemPrompt, requested, resultKind, modelParams, retryPolicy);
    }
}
