package com.auraflux.core.state;

import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.model.SessionSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Non-durable {@link SessionRepository} used when no DataSource is configured.
 * State is lost on restart.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, NavigableMap<Long, SessionSnapshot>> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionSnapshot> findLatest(String sessionId) {
        NavigableMap<Long, SessionSnapshot> versions = snapshots.get(sessionId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    @Override
    public void insert(SessionSnapshot snapshot) {
        NavigableMap<Long, SessionSnapshot> versions =
                snapshots.computeIfAbsent(snapshot.sessionId(), k -> new ConcurrentSkipListMap<>());
        SessionSnapshot existing = versions.putIfAbsent(snapshot.version(), snapshot);
        if (existing != null) {
            throw new VersionConflictException(snapshot.sessionId(), snapshot.version() - 1,
                    versions.lastKey());
        }
    }

    @Override
    public List<SessionSnapshot> history(String sessionId) {
        NavigableMap<Long, SessionSnapshot> versions = snapshots.get(sessionId);
        return versions == null ? List.of() : new ArrayList<>(versions.values());
    }
}
