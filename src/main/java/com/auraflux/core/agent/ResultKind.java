package com.auraflux.core.agent;

/**
 * How a task's result payload is applied to the session.
 * <p>
 * Commutative kinds are safe to apply against any newer version of the session. Non-commutative
 * kinds overwrite a field that the user may have changed since the task was dispatched, and are
 * rejected as stale when that happened.
 */
public enum ResultKind {
    /** {@code {"keywords": ["..."]}}, merged into the keywords as AI_EXTRACTED. */
    KEYWORDS(true),
    /** {@code {"scope_elements": [{"name": "...", "description": "..."}]}}, added as AI_EXTRACTED, existing names skipped. */
    SCOPE_ELEMENTS(true),
    /** {@code {"text": "..."}}, appended to the reflection log as an agent entry. */
    REFLECTION(true),
    /** {@code {"question": "..."}}, replaces the draft question text. */
    QUESTION_TEXT(false),
    /** {@code {"score": 0-10, "is_niche": false, "rationale": "..."}}, rated into a feasibility status. */
    FEASIBILITY(false),
    /** {@code {"reply": "..."}}, plain text appended to the chat history as an agent message. */
    CHAT_REPLY(true);

    private final boolean commutative;

    ResultKind(boolean commutative) {
        this.commutative = commutative;
    }

    public boolean isCommutative() {
        return commutative;
    }
}
