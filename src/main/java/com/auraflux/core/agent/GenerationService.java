package com.auraflux.core.agent;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Boundary to the generative model provider.
 */
public interface GenerationService {

    /**
     * Runs one generation for a task.
     *
     * @param taskType   canonical task type
     * @param payload    task input
     * @param role       the task type's role configuration
     * @param chunkSink  receives incremental output for streaming roles; ignored otherwise
     * @return the structured result payload
     * @throws GenerationException classified as transient or permanent
     */
    Map<String, Object> generate(String taskType, Map<String, Object> payload, AgentRoleConfig role,
                                 Consumer<String> chunkSink);
}
