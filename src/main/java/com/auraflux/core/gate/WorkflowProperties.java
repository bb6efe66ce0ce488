package com.auraflux.core.gate;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "auraflux.workflow")
public class WorkflowProperties {

    /** Keywords required before leaving Initiation. */
    private int minKeywords = 3;

    /** Scope elements required before leaving Exploration. */
    private int minScopeElements = 2;

    /** Scope element names that must all be present before leaving Exploration. */
    private List<String> requiredScopeElements = new ArrayList<>();

    /** Backward edges in FROM:TO form, e.g. "EXPLORATION:INITIATION". Empty disables rollback. */
    private List<String> rollbackEdges = new ArrayList<>();

    /** Bound on optimistic re-read-and-retry for additive commits. */
    private int maxCommitRetries = 5;

    public int getMinKeywords() {
        return minKeywords;
    }

    public void setMinKeywords(int minKeywords) {
        this.minKeywords = minKeywords;
    }

    public int getMinScopeElements() {
        return minScopeElements;
    }

    public void setMinScopeElements(int minScopeElements) {
        this.minScopeElements = minScopeElements;
    }

    public List<String> getRequiredScopeElements() {
        return requiredScopeElements;
    }

    public void setRequiredScopeElements(List<String> requiredScopeElements) {
        this.requiredScopeElements = requiredScopeElements;
    }

    public List<String> getRollbackEdges() {
        return rollbackEdges;
    }

    public void setRollbackEdges(List<String> rollbackEdges) {
        this.rollbackEdges = rollbackEdges;
    }

    public int getMaxCommitRetries() {
        return maxCommitRetries;
    }

    public void setMaxCommitRetries(int maxCommitRetries) {
        this.maxCommitRetries = maxCommitRetries;
    }
}
