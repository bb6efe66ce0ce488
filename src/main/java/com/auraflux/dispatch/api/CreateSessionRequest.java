package com.auraflux.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param question initial draft research question; nullable
 */
public record CreateSessionRequest(
    String question
) {}
