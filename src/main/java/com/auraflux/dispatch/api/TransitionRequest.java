package com.auraflux.dispatch.api;

import com.auraflux.core.model.Phase;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/transitions.
 */
public record TransitionRequest(
    @JsonProperty("target_phase") Phase targetPhase,
    @JsonProperty("expected_version") Long expectedVersion
) {}
