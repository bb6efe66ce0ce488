package com.auraflux.core.state;

import com.auraflux.core.error.SessionNotFoundException;
import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Single writer of record for research sessions.
 * <p>
 * Every mutation goes through {@link #commit}: the current snapshot is read, the expected version
 * is checked, the mutation is applied and stored as version + 1, and commit listeners are notified,
 * all under a per-session lock. Writes to different sessions never contend. Callers only ever
 * receive immutable snapshots.
 */
@Service
public class SessionStateStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStateStore.class);

    private final SessionRepository repository;
    private final List<SessionCommitListener> listeners;
    private final int maxCommitRetries;

    private final ConcurrentHashMap<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    @Autowired
    public SessionStateStore(SessionRepository repository,
                             List<SessionCommitListener> listeners,
                             @Value("${auraflux.workflow.max-commit-retries:5}") int maxCommitRetries) {
        this.repository = repository;
        this.listeners = List.copyOf(listeners);
        this.maxCommitRetries = Math.max(1, maxCommitRetries);
    }

    /**
     * Starts a new session in the initial phase, committed as version 1.
     */
    public SessionSnapshot create(String initialQuestion) {
        String sessionId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        SessionSnapshot committed = withSessionLock(sessionId, () -> {
            var snapshot = SessionSnapshot.start(sessionId, initialQuestion, now).committedAs(1L, now);
            repository.insert(snapshot);
            notifyListeners(snapshot, "session.created");
            return snapshot;
        });
        log.info("Created session {}", sessionId);
        return committed;
    }

    public Optional<SessionSnapshot> find(String sessionId) {
        return repository.findLatest(sessionId);
    }

    /**
     * Atomic read of the latest committed snapshot.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public SessionSnapshot get(String sessionId) {
        return find(sessionId).orElseThrow(() ->
                new SessionNotFoundException("Session " + sessionId + " not found"));
    }

    public List<SessionSnapshot> history(String sessionId) {
        return repository.history(sessionId);
    }

    /**
     * Applies {@code mutation} to the current snapshot if it is at {@code expectedVersion}.
     * <p>
     * Returns the current snapshot unchanged, without a version bump, when the mutation produces an
     * equal snapshot. Exceptions thrown by the mutation propagate and nothing is stored.
     *
     * @throws SessionNotFoundException  if the session does not exist
     * @throws VersionConflictException  if the session is not at {@code expectedVersion}
     */
    public SessionSnapshot commit(String sessionId, long expectedVersion, String cause,
                                  UnaryOperator<SessionSnapshot> mutation) {
        return withSessionLock(sessionId, () -> {
            SessionSnapshot current = get(sessionId);
            if (current.version() != expectedVersion) {
                throw new VersionConflictException(sessionId, expectedVersion, current.version());
            }
            return applyAndStore(current, cause, mutation);
        });
    }

    /**
     * Applies {@code mutation} to whatever version is current, re-reading and retrying when another
     * writer commits first. For additive mutations that are safe against any newer version.
     *
     * @throws VersionConflictException if every attempt lost the race
     */
    public SessionSnapshot update(String sessionId, String cause, UnaryOperator<SessionSnapshot> mutation) {
        VersionConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxCommitRetries; attempt++) {
            try {
                return withSessionLock(sessionId, () -> applyAndStore(get(sessionId), cause, mutation));
            } catch (VersionConflictException e) {
                lastConflict = e;
                log.debug("Commit race on session {} (attempt {}/{}), retrying", sessionId, attempt, maxCommitRetries);
            }
        }
        throw lastConflict;
    }

    private SessionSnapshot applyAndStore(SessionSnapshot current, String cause,
                                          UnaryOperator<SessionSnapshot> mutation) {
        SessionSnapshot next = mutation.apply(current);
        if (next == null || next.equals(current)) {
            log.debug("Mutation '{}' left session {} unchanged at version {}", cause, current.sessionId(), current.version());
            return current;
        }
        if (!current.sessionId().equals(next.sessionId())) {
            throw new IllegalStateException("Mutation '" + cause + "' changed the session id");
        }
        var committed = next.committedAs(current.version() + 1, Instant.now());
        repository.insert(committed);
        log.debug("Committed session {} version {} ({})", committed.sessionId(), committed.version(), cause);
        notifyListeners(committed, cause);
        return committed;
    }

    private <T> T withSessionLock(String sessionId, Supplier<T> action) {
        ReentrantLock lock = sessionLocks.computeIfAbsent(sessionId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void notifyListeners(SessionSnapshot snapshot, String cause) {
        for (SessionCommitListener listener : listeners) {
            try {
                listener.onCommit(snapshot, cause);
            } catch (Exception e) {
                log.warn("Commit listener threw processing {} for session {}: {}",
                        cause, snapshot.sessionId(), e.getMessage(), e);
            }
        }
    }
}
