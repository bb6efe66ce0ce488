package com.auraflux.core.state;

import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.model.SessionSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for session snapshots, keyed by {@code (sessionId, version)}.
 * <p>
 * Implementations never overwrite a stored version: inserting a version that already exists
 * fails with {@link VersionConflictException}.
 */
public interface SessionRepository {

    Optional<SessionSnapshot> findLatest(String sessionId);

    /**
     * Stores a newly committed snapshot.
     *
     * @throws VersionConflictException if {@code (sessionId, version)} is already stored
     */
    void insert(SessionSnapshot snapshot);

    /**
     * All stored versions of a session, oldest first.
     */
    List<SessionSnapshot> history(String sessionId);
}
