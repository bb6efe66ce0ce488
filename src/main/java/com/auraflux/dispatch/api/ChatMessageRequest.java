package com.auraflux.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/chat.
 *
 * @param message        the user's message
 * @param idempotencyKey client-chosen key; nullable, a random key is generated when absent
 */
public record ChatMessageRequest(
    @JsonProperty("user_message") String message,
    @JsonProperty("idempotency_key") String idempotencyKey
) {}
