package com.auraflux.core.error;

/**
 * Thrown when editing the text of a locked research question.
 */
public class QuestionLockedException extends AurafluxException {

    public QuestionLockedException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "QUESTION_LOCKED";
    }
}
