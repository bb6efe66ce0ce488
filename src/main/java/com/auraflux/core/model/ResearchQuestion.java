package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * The session's research question.
 *
 * @param text   the question text (may be empty while drafting)
 * @param status DRAFT or LOCKED
 */
public record ResearchQuestion(
    String text,
    QuestionStatus status
) implements Serializable {

    public ResearchQuestion {
        text = text == null ? "" : text;
        status = status == null ? QuestionStatus.DRAFT : status;
    }

    public static ResearchQuestion draft(String text) {
        return new ResearchQuestion(text, QuestionStatus.DRAFT);
    }

    @JsonIgnore
    public boolean isLocked() {
        return status == QuestionStatus.LOCKED;
    }

    public ResearchQuestion withText(String newText) {
        return new ResearchQuestion(newText, status);
    }

    public ResearchQuestion locked() {
        return new ResearchQuestion(text, QuestionStatus.LOCKED);
    }

    public ResearchQuestion unlocked() {
        return new ResearchQuestion(text, QuestionStatus.DRAFT);
    }
}
