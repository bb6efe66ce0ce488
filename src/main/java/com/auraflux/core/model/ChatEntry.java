package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One message of the conversation between the user and the session's chat agent.
 *
 * @param sequenceNumber 1-based position in the conversation
 * @param author         who wrote the message
 * @param name           display name of the speaker, e.g. the agent's task type
 * @param content        message text
 * @param timestamp      when the message was recorded
 */
public record ChatEntry(
    @JsonProperty("sequence_number") int sequenceNumber,
    Author author,
    String name,
    String content,
    Instant timestamp
) implements Serializable {}
