package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * One boundary of the research scope, e.g. "Timeframe" or "Geography".
 */
public record ScopeElement(
    String name,
    String description,
    ItemStatus status
) implements Serializable {

    public ScopeElement {
        name = name == null ? "" : name.trim();
        description = description == null ? "" : description;
        status = status == null ? ItemStatus.USER_DRAFT : status;
    }

    public ScopeElement(String name, String description) {
        this(name, description, ItemStatus.USER_DRAFT);
    }

    @JsonIgnore
    public boolean isLocked() {
        return status == ItemStatus.LOCKED;
    }

    public boolean matches(String other) {
        return other != null && name.equalsIgnoreCase(other.trim());
    }

    public ScopeElement withStatus(ItemStatus newStatus) {
        return new ScopeElement(name, description, newStatus);
    }
}
