package com.auraflux.core.model;

/**
 * Lifecycle of the research question. A locked question's text cannot change.
 */
public enum QuestionStatus {
    DRAFT,
    LOCKED
}
