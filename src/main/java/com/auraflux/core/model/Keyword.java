package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * A search keyword with its review status.
 */
public record Keyword(
    String text,
    ItemStatus status
) implements Serializable {

    public Keyword {
        text = text == null ? "" : text.trim();
        status = status == null ? ItemStatus.USER_DRAFT : status;
    }

    @JsonIgnore
    public boolean isLocked() {
        return status == ItemStatus.LOCKED;
    }

    public boolean matches(String other) {
        return other != null && text.equalsIgnoreCase(other.trim());
    }
}
