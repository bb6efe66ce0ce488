package com.auraflux.core.engine;

import com.auraflux.core.error.ItemLockedException;
import com.auraflux.core.error.ItemNotFoundException;
import com.auraflux.core.error.QuestionLockedException;
import com.auraflux.core.error.SessionClosedException;
import com.auraflux.core.model.Author;
import com.auraflux.core.model.ItemStatus;
import com.auraflux.core.model.Keyword;
import com.auraflux.core.model.Phase;
import com.auraflux.core.model.ReflectionEntry;
import com.auraflux.core.model.ScopeElement;
import com.auraflux.core.model.SessionSnapshot;
import com.auraflux.core.state.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * User-side edits of a session. Every edit is checked against the caller's expected version and
 * committed through the store, so it bumps the version and reaches subscribers like any other write.
 */
@Service
public class SessionEditor {

    private static final Logger log = LoggerFactory.getLogger(SessionEditor.class);

    private final SessionStateStore store;

    public SessionEditor(SessionStateStore store) {
        this.store = store;
    }

    public SessionSnapshot createSession(String initialQuestion) {
        return store.create(initialQuestion == null ? "" : initialQuestion.trim());
    }

    /**
     * @throws QuestionLockedException if the question is locked
     */
    public SessionSnapshot editQuestion(String sessionId, long expectedVersion, String text) {
        return edit(sessionId, expectedVersion, "question.edited", s -> {
            if (s.question().isLocked()) {
                throw new QuestionLockedException("Research question of session " + sessionId + " is locked");
            }
            return s.withQuestion(s.question().withText(text == null ? "" : text.trim()));
        });
    }

    public SessionSnapshot lockQuestion(String sessionId, long expectedVersion) {
        return edit(sessionId, expectedVersion, "question.locked", s -> {
            if (s.question().text().isBlank()) {
                throw new IllegalArgumentException("Cannot lock an empty research question");
            }
            return s.withQuestion(s.question().locked());
        });
    }

    /**
     * @throws QuestionLockedException outside the initiation phase
     */
    public SessionSnapshot unlockQuestion(String sessionId, long expectedVersion) {
        return edit(sessionId, expectedVersion, "question.unlocked", s -> {
            if (s.phase() != Phase.INITIATION) {
                throw new QuestionLockedException("Research question can only be unlocked during INITIATION");
            }
            return s.withQuestion(s.question().unlocked());
        });
    }

    public SessionSnapshot addKeywords(String sessionId, long expectedVersion, List<String> keywords) {
        return addKeywords(sessionId, expectedVersion, keywords, null);
    }

    /**
     * @param status status of the new keywords, USER_DRAFT when null
     */
    public SessionSnapshot addKeywords(String sessionId, long expectedVersion, List<String> keywords,
                                       ItemStatus status) {
        ItemStatus initial = status == null ? ItemStatus.USER_DRAFT : status;
        return edit(sessionId, expectedVersion, "keywords.added", s -> s.withKeywordsAdded(keywords, initial));
    }

    /**
     * Renames a keyword and/or changes its status. A locked keyword can only be renamed in the same
     * edit that unlocks it.
     *
     * @param newText new text, or null to keep the current one
     * @param status  new status, or null to keep the current one
     * @throws ItemNotFoundException if the session has no such keyword
     * @throws ItemLockedException   if the keyword is locked and stays locked while its text changes
     */
    public SessionSnapshot updateKeyword(String sessionId, long expectedVersion, String keyword,
                                         String newText, ItemStatus status) {
        return edit(sessionId, expectedVersion, "keyword.updated", s -> {
            Keyword current = s.findKeyword(keyword).orElseThrow(() ->
                    new ItemNotFoundException("Keyword '" + keyword + "' not found in session " + sessionId));
            String text = newText == null ? current.text() : newText.trim();
            ItemStatus nextStatus = status == null ? current.status() : status;
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Keyword text must not be blank");
            }
            boolean renamed = !text.equals(current.text());
            if (renamed && current.isLocked() && nextStatus == ItemStatus.LOCKED) {
                throw new ItemLockedException("Keyword '" + current.text() + "' is locked");
            }
            if (renamed && !current.matches(text) && s.hasKeyword(text)) {
                throw new IllegalArgumentException("Keyword '" + text + "' already exists");
            }
            return s.withKeywordReplaced(current.text(), new Keyword(text, nextStatus));
        });
    }

    public SessionSnapshot addScopeElements(String sessionId, long expectedVersion, List<ScopeElement> elements) {
        return edit(sessionId, expectedVersion, "scope.added", s -> s.withScopeElementsAdded(elements));
    }

    /**
     * Renames, re-describes and/or changes the status of a scope element. A locked element can only
     * change its name or description in the same edit that unlocks it.
     *
     * @param newName        new name, or null to keep the current one
     * @param newDescription new description, or null to keep the current one
     * @param status         new status, or null to keep the current one
     * @throws ItemNotFoundException if the session has no such scope element
     * @throws ItemLockedException   if the element is locked and stays locked while its content changes
     */
    public SessionSnapshot updateScopeElement(String sessionId, long expectedVersion, String name,
                                              String newName, String newDescription, ItemStatus status) {
        return edit(sessionId, expectedVersion, "scope.updated", s -> {
            ScopeElement current = s.findScopeElement(name).orElseThrow(() ->
                    new ItemNotFoundException("Scope element '" + name + "' not found in session " + sessionId));
            var next = new ScopeElement(newName == null ? current.name() : newName,
                    newDescription == null ? current.description() : newDescription,
                    status == null ? current.status() : status);
            if (next.name().isEmpty()) {
                throw new IllegalArgumentException("Scope element name must not be blank");
            }
            boolean contentChanged = !next.name().equals(current.name())
                    || !next.description().equals(current.description());
            if (contentChanged && current.isLocked() && next.isLocked()) {
                throw new ItemLockedException("Scope element '" + current.name() + "' is locked");
            }
            if (!current.matches(next.name()) && s.hasScopeElement(next.name())) {
                throw new IllegalArgumentException("Scope element '" + next.name() + "' already exists");
            }
            return s.withScopeElementReplaced(current.name(), next);
        });
    }

    public SessionSnapshot addReflection(String sessionId, long expectedVersion, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Reflection text must not be blank");
        }
        return edit(sessionId, expectedVersion, "reflection.added",
                s -> s.withReflection(new ReflectionEntry(Instant.now(), Author.USER, text.trim())));
    }

    private SessionSnapshot edit(String sessionId, long expectedVersion, String cause,
                                 UnaryOperator<SessionSnapshot> mutation) {
        SessionSnapshot committed = store.commit(sessionId, expectedVersion, cause, s -> {
            if (s.isClosed()) {
                throw new SessionClosedException("Session " + sessionId + " is closed");
            }
            return mutation.apply(s);
        });
        log.info("Session {} {} (version {})", sessionId, cause, committed.version());
        return committed;
    }
}
