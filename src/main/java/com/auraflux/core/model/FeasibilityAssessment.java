package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Result of a feasibility scoring task.
 *
 * @param status    HIGH, MEDIUM or LOW
 * @param score     agent availability score in [0, 10]
 * @param rationale short agent explanation
 */
public record FeasibilityAssessment(
    FeasibilityStatus status,
    int score,
    String rationale
) implements Serializable {

    @JsonProperty(value = "resource_suggestion", access = JsonProperty.Access.READ_ONLY)
    public String resourceSuggestion() {
        return status != null ? status.resourceSuggestion() : "";
    }
}
