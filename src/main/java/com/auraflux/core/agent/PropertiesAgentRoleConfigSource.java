package com.auraflux.core.agent;

import com.auraflux.core.dispatch.DispatcherProperties;
import com.auraflux.core.dispatch.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link AgentRoleConfigSource} backed by {@code auraflux.agents.roles}. Roles are resolved once at
 * startup; a role without a {@code result-kind} is rejected.
 */
@Service
public class PropertiesAgentRoleConfigSource implements AgentRoleConfigSource {

    private static final Logger log = LoggerFactory.getLogger(PropertiesAgentRoleConfigSource.class);

    private final Map<String, AgentRoleConfig> roles;

    public PropertiesAgentRoleConfigSource(AgentRoleProperties properties, DispatcherProperties dispatcherProperties) {
        var resolved = new LinkedHashMap<String, AgentRoleConfig>();
        DispatcherProperties.Retry defaults = dispatcherProperties.getRetry();
        properties.getRoles().forEach((key, role) -> {
            String taskType = AgentRoleConfigSource.canonical(key);
            if (role.getResultKind() == null) {
                throw new IllegalStateException("Agent role " + taskType + " has no result-kind");
            }
            resolved.put(taskType, new AgentRoleConfig(taskType, role.getPromptRef(), role.getSystemPrompt(),
                    role.getLane(), role.getResultKind(), role.getModelParams(), retryPolicy(role, defaults)));
        });
        this.roles = Collections.unmodifiableMap(resolved);
        log.info("Loaded {} agent role(s): {}", roles.size(), roles.keySet());
    }

    @Override
    public Optional<AgentRoleConfig> find(String taskType) {
        return Optional.ofNullable(roles.get(AgentRoleConfigSource.canonical(taskType)));
    }

    @Override
    public Set<String> taskTypes() {
        return roles.keySet();
    }

    private static RetryPolicy retryPolicy(AgentRoleProperties.Role role, DispatcherProperties.Retry defaults) {
        AgentRoleProperties.RetryOverride o = role.getRetry();
        if (o == null) {
            return defaults.toPolicy();
        }
        return new RetryPolicy(
                o.getMaxAttempts() != null ? o.getMaxAttempts() : defaults.getMaxAttempts(),
                o.getInitialBackoffMs() != null ? o.getInitialBackoffMs() : defaults.getInitialBackoffMs(),
                o.getMultiplier() != null ? o.getMultiplier() : defaults.getMultiplier(),
                o.getMaxBackoffMs() != null ? o.getMaxBackoffMs() : defaults.getMaxBackoffMs());
    }
}
