package com.auraflux.core.agent;

import com.auraflux.core.dispatch.Lane;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agent roles keyed by task type, e.g. {@code auraflux.agents.roles.keyword-extraction.*}.
 */
@Component
@ConfigurationProperties(prefix = "auraflux.agents")
public class AgentRoleProperties {

    private Map<String, Role> roles = new LinkedHashMap<>();

    public Map<String, Role> getRoles() {
        return roles;
    }

    public void setRoles(Map<String, Role> roles) {
        this.roles = roles;
    }

    public static class Role {

        private String promptRef;
        private String systemPrompt = "";
        private Lane lane = Lane.DEFAULT;
        private ResultKind resultKind;
        private Map<String, Object> modelParams = new LinkedHashMap<>();

        /** Per-role overrides of the dispatcher retry defaults; unset fields inherit. */
        private RetryOverride retry = new RetryOverride();

        public String getPromptRef() {
            return promptRef;
        }

        public void setPromptRef(String promptRef) {
            this.promptRef = promptRef;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public Lane getLane() {
            return lane;
        }

        public void setLane(Lane lane) {
            this.lane = lane;
        }

        public ResultKind getResultKind() {
            return resultKind;
        }

        public void setResultKind(ResultKind resultKind) {
            this.resultKind = resultKind;
        }

        public Map<String, Object> getModelParams() {
            return modelParams;
        }

        public void setModelParams(Map<String, Object> modelParams) {
            this.modelParams = modelParams;
        }

        public RetryOverride getRetry() {
            return retry;
        }

        public void setRetry(RetryOverride retry) {
            this.retry = retry;
        }
    }

    public static class RetryOverride {

        private Integer maxAttempts;
        private Long initialBackoffMs;
        private Double multiplier;
        private Long maxBackoffMs;

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(Long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public Double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(Double multiplier) {
            this.multiplier = multiplier;
        }

        public Long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(Long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }
}
