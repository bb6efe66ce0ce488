package com.auraflux.core.agent;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up the agent role for a task type.
 */
public interface AgentRoleConfigSource {

    Optional<AgentRoleConfig> find(String taskType);

    Set<String> taskTypes();

    /**
     * Canonical task type form: upper case with underscores, so {@code keyword-extraction} and
     * {@code KEYWORD_EXTRACTION} name the same role.
     */
    static String canonical(String taskType) {
        return taskType == null ? "" : taskType.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    }
}
