package com.auraflux.core.model;

/**
 * Who wrote a reflection log entry or chat message.
 */
public enum Author {
    AGENT,
    USER
}
