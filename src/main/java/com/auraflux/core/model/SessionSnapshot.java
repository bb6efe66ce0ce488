package com.auraflux.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned snapshot of one research session.
 * <p>
 * Every {@code with...} method returns a new snapshot with the same {@link #version()}; only
 * {@link com.auraflux.core.state.SessionStateStore} assigns versions when it commits.
 *
 * @param sessionId     opaque session identifier
 * @param phase         current ISP phase
 * @param question      research question text and lock status
 * @param keywords      keywords in insertion order, unique by text ignoring case
 * @param scopeElements scope elements in presentation order
 * @param reflectionLog append-only reflection entries
 * @param chatHistory   append-only conversation with the chat agent
 * @param feasibility   latest feasibility assessment, or null when none was produced
 * @param version       optimistic-concurrency version, starts at 1
 * @param createdAt     when the session started
 * @param updatedAt     when the last mutation committed
 */
public record SessionSnapshot(
    @JsonProperty("session_id") String sessionId,
    Phase phase,
    ResearchQuestion question,
    List<Keyword> keywords,
    @JsonProperty("scope_elements") List<ScopeElement> scopeElements,
    @JsonProperty("reflection_log") List<ReflectionEntry> reflectionLog,
    @JsonProperty("chat_history") List<ChatEntry> chatHistory,
    FeasibilityAssessment feasibility,
    long version,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) implements Serializable {

    public SessionSnapshot {
        phase = phase == null ? Phase.INITIATION : phase;
        question = question == null ? ResearchQuestion.draft("") : question;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        scopeElements = scopeElements == null ? List.of() : List.copyOf(scopeElements);
        reflectionLog = reflectionLog == null ? List.of() : List.copyOf(reflectionLog);
        chatHistory = chatHistory == null ? List.of() : List.copyOf(chatHistory);
    }

    /**
     * A fresh session in {@link Phase#INITIATION} with a draft question. Version 0 means "not yet
     * committed"; the store commits it as version 1.
     */
    public static SessionSnapshot start(String sessionId, String initialQuestion, Instant now) {
        return new SessionSnapshot(sessionId, Phase.INITIATION, ResearchQuestion.draft(initialQuestion),
                List.of(), List.of(), List.of(), List.of(), null, 0L, now, now);
    }

    @JsonIgnore
    public boolean isClosed() {
        return phase.isTerminal();
    }

    public boolean hasKeyword(String keyword) {
        return findKeyword(keyword).isPresent();
    }

    public Optional<Keyword> findKeyword(String text) {
        return keywords.stream().filter(k -> k.matches(text)).findFirst();
    }

    public boolean hasScopeElement(String name) {
        return findScopeElement(name).isPresent();
    }

    public Optional<ScopeElement> findScopeElement(String name) {
        return scopeElements.stream().filter(e -> e.matches(name == null ? "" : name)).findFirst();
    }

    /** Keywords that are not archived. */
    public long activeKeywordCount() {
        return keywords.stream().filter(k -> k.status().isActive()).count();
    }

    /** Scope elements that are not archived. */
    public long activeScopeElementCount() {
        return scopeElements.stream().filter(e -> e.status().isActive()).count();
    }

    public List<String> lockedKeywords() {
        return keywords.stream().filter(Keyword::isLocked).map(Keyword::text).toList();
    }

    public List<ScopeElement> lockedScopeElements() {
        return scopeElements.stream().filter(ScopeElement::isLocked).toList();
    }

    public SessionSnapshot withPhase(Phase newPhase) {
        return new SessionSnapshot(sessionId, newPhase, question, keywords, scopeElements, reflectionLog,
                chatHistory, feasibility, version, createdAt, updatedAt);
    }

    public SessionSnapshot withQuestion(ResearchQuestion newQuestion) {
        return new SessionSnapshot(sessionId, phase, newQuestion, keywords, scopeElements, reflectionLog,
                chatHistory, feasibility, version, createdAt, updatedAt);
    }

    public SessionSnapshot withKeywordsAdded(Collection<String> added) {
        return withKeywordsAdded(added, ItemStatus.USER_DRAFT);
    }

    /**
     * Adds keywords with the given status, trimming whitespace and skipping blanks and
     * case-insensitive duplicates. Existing keywords keep their status.
     */
    public SessionSnapshot withKeywordsAdded(Collection<String> added, ItemStatus status) {
        var merged = new ArrayList<>(keywords);
        for (String raw : added) {
            Keyword keyword = new Keyword(raw, status);
            boolean exists = keyword.text().isEmpty()
                    || merged.stream().anyMatch(k -> k.matches(keyword.text()));
            if (!exists) {
                merged.add(keyword);
            }
        }
        return withKeywords(merged);
    }

    /**
     * Replaces the keyword matching {@code text} in place. Callers check that it exists.
     */
    public SessionSnapshot withKeywordReplaced(String text, Keyword replacement) {
        var replaced = new ArrayList<Keyword>(keywords.size());
        for (Keyword keyword : keywords) {
            replaced.add(keyword.matches(text) ? replacement : keyword);
        }
        return withKeywords(replaced);
    }

    /**
     * Appends scope elements whose name is not already present (case-insensitive).
     */
    public SessionSnapshot withScopeElementsAdded(Collection<ScopeElement> added) {
        var merged = new ArrayList<>(scopeElements);
        for (ScopeElement element : added) {
            boolean exists = element.name().isEmpty()
                    || merged.stream().anyMatch(e -> e.matches(element.name()));
            if (!exists) {
                merged.add(element);
            }
        }
        return withScopeElements(merged);
    }

    /**
     * Replaces the scope element named {@code name} in place. Callers check that it exists.
     */
    public SessionSnapshot withScopeElementReplaced(String name, ScopeElement replacement) {
        var replaced = new ArrayList<ScopeElement>(scopeElements.size());
        for (ScopeElement element : scopeElements) {
            replaced.add(element.matches(name) ? replacement : element);
        }
        return withScopeElements(replaced);
    }

    public SessionSnapshot withReflection(ReflectionEntry entry) {
        var log = new ArrayList<>(reflectionLog);
        log.add(entry);
        return new SessionSnapshot(sessionId, phase, question, keywords, scopeElements, log,
                chatHistory, feasibility, version, createdAt, updatedAt);
    }

    /**
     * Appends a chat message as the next entry of the conversation.
     */
    public SessionSnapshot withChatEntry(Author author, String name, String content, Instant at) {
        var history = new ArrayList<>(chatHistory);
        history.add(new ChatEntry(chatHistory.size() + 1, author, name, content, at));
        return new SessionSnapshot(sessionId, phase, question, keywords, scopeElements, reflectionLog,
                history, feasibility, version, createdAt, updatedAt);
    }

    public SessionSnapshot withFeasibility(FeasibilityAssessment assessment) {
        return new SessionSnapshot(sessionId, phase, question, keywords, scopeElements, reflectionLog,
                chatHistory, assessment, version, createdAt, updatedAt);
    }

    /**
     * Stamps the committed version and update time. Store use only.
     */
    public SessionSnapshot committedAs(long newVersion, Instant committedAt) {
        return new SessionSnapshot(sessionId, phase, question, keywords, scopeElements, reflectionLog,
                chatHistory, feasibility, newVersion, createdAt, committedAt);
    }

    private SessionSnapshot withKeywords(List<Keyword> newKeywords) {
        return new SessionSnapshot(sessionId, phase, question, newKeywords, scopeElements, reflectionLog,
                chatHistory, feasibility, version, createdAt, updatedAt);
    }

    private SessionSnapshot withScopeElements(List<ScopeElement> newElements) {
        return new SessionSnapshot(sessionId, phase, question, keywords, newElements, reflectionLog,
                chatHistory, feasibility, version, createdAt, updatedAt);
    }
}
