package com.auraflux.core.model;

/**
 * Status of a single keyword or scope element.
 * <p>
 * Locked items are confirmed by the user and are handed to agents as fixed context. Archived items
 * are kept for history but no longer count towards phase gates.
 */
public enum ItemStatus {
    USER_DRAFT,
    AI_EXTRACTED,
    LOCKED,
    ON_HOLD,
    ARCHIVED;

    public boolean isActive() {
        return this != ARCHIVED;
    }
}
