package com.auraflux.core.reconcile;

import com.auraflux.core.agent.ResultKind;
import com.auraflux.core.model.Author;
import com.auraflux.core.model.FeasibilityAssessment;
import com.auraflux.core.model.FeasibilityStatus;
import com.auraflux.core.model.ItemStatus;
import com.auraflux.core.model.ReflectionEntry;
import com.auraflux.core.model.ScopeElement;
import com.auraflux.core.model.SessionSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Turns a task result payload into a session mutation, and decides when a non-commutative result
 * no longer fits the session it would be applied to.
 */
final class ResultMutations {

    private ResultMutations() {}

    /**
     * @param agentName name recorded on chat replies
     * @throws IllegalArgumentException if the payload does not have the shape {@code kind} requires
     */
    static UnaryOperator<SessionSnapshot> forResult(ResultKind kind, String agentName, Map<String, Object> payload) {
        return switch (kind) {
            case KEYWORDS -> {
                List<String> keywords = stringList(payload, "keywords");
                yield s -> s.withKeywordsAdded(keywords, ItemStatus.AI_EXTRACTED);
            }
            case SCOPE_ELEMENTS -> {
                List<ScopeElement> elements = scopeElements(payload);
                yield s -> s.withScopeElementsAdded(elements);
            }
            case REFLECTION -> {
                String text = requiredText(payload, "text");
                Instant at = Instant.now();
                yield s -> s.withReflection(new ReflectionEntry(at, Author.AGENT, text));
            }
            case QUESTION_TEXT -> {
                String text = requiredText(payload, "question");
                yield s -> s.withQuestion(s.question().withText(text));
            }
            case FEASIBILITY -> {
                FeasibilityAssessment assessment = feasibility(payload);
                yield s -> s.withFeasibility(assessment);
            }
            case CHAT_REPLY -> {
                String reply = requiredText(payload, "reply");
                Instant at = Instant.now();
                yield s -> s.withChatEntry(Author.AGENT, agentName, reply, at);
            }
        };
    }

    /**
     * Why a result of {@code kind} dispatched against {@code basis} cannot be applied to
     * {@code current}, or empty when it still fits.
     */
    static Optional<String> staleness(ResultKind kind, SessionSnapshot basis, SessionSnapshot current) {
        if (current.isClosed()) {
            return Optional.of("Session was closed after the task was dispatched");
        }
        if (kind.isCommutative()) {
            return Optional.empty();
        }
        boolean textChanged = !Objects.equals(basis.question().text(), current.question().text());
        if (kind == ResultKind.QUESTION_TEXT) {
            if (current.question().isLocked()) {
                return Optional.of("Research question was locked after the task was dispatched");
            }
            if (textChanged || basis.question().status() != current.question().status()) {
                return Optional.of("Research question was edited after the task was dispatched");
            }
        }
        if (kind == ResultKind.FEASIBILITY && textChanged) {
            return Optional.of("Research question changed after the feasibility task was dispatched");
        }
        return Optional.empty();
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static List<String> stringList(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("Result field '" + field + "' must be a list");
        }
        var result = new ArrayList<String>();
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static List<ScopeElement> scopeElements(Map<String, Object> payload) {
        Object value = payload.get("scope_elements");
        if (!(value instanceof Collection<?> items)) {
            throw new IllegalArgumentException("Result field 'scope_elements' must be a list");
        }
        var result = new ArrayList<ScopeElement>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                Object name = map.get("name");
                Object description = map.get("description");
                result.add(new ScopeElement(name == null ? null : name.toString(),
                        description == null ? null : description.toString(), ItemStatus.AI_EXTRACTED));
            } else if (item != null) {
                result.add(new ScopeElement(item.toString(), null, ItemStatus.AI_EXTRACTED));
            }
        }
        return result;
    }

    private static String requiredText(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Result field '" + field + "' must not be blank");
        }
        return value.toString().trim();
    }

    private static FeasibilityAssessment feasibility(Map<String, Object> payload) {
        Object rawScore = payload.get("score");
        int score;
        try {
            score = rawScore instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(rawScore).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Result field 'score' must be a number, got " + rawScore);
        }
        if (score < 0 || score > 10) {
            throw new IllegalArgumentException("Result field 'score' must be between 0 and 10, got " + score);
        }
        boolean niche = Boolean.parseBoolean(String.valueOf(payload.getOrDefault("is_niche", "false")));
        Object rationale = payload.get("rationale");
        return new FeasibilityAssessment(FeasibilityStatus.fromScore(score, niche), score,
                rationale == null ? "" : rationale.toString());
    }
}
