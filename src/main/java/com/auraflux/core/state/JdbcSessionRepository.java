package com.auraflux.core.state;

import com.auraflux.core.error.VersionConflictException;
import com.auraflux.core.model.SessionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link SessionRepository} that persists each committed snapshot as a
 * JSON-serialized row keyed by {@code (session_id, version)}.
 * <p>
 * The primary key doubles as the optimistic-concurrency guard across processes: two writers that
 * both read version N cannot both insert version N+1.
 * <p>
 * The table {@code research_session_snapshots} is created automatically via {@link #createTables()}.
 */
public class JdbcSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionRepository.class);

    private static final String TABLE_NAME = "research_session_snapshots";

    /** SQLSTATE class for integrity constraint violations. */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id   VARCHAR(64) NOT NULL,
                version      BIGINT NOT NULL,
                phase        VARCHAR(32) NOT NULL,
                snapshot     TEXT NOT NULL,
                committed_at TIMESTAMP NOT NULL,
                PRIMARY KEY (session_id, version)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (session_id, version, phase, snapshot, committed_at)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT snapshot
            FROM %s
            WHERE session_id = ?
            ORDER BY version DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_HISTORY_SQL = """
            SELECT snapshot
            FROM %s
            WHERE session_id = ?
            ORDER BY version ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_MAX_VERSION_SQL = """
            SELECT MAX(version) AS max_version FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcSessionRepository(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the snapshot table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Session snapshot table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<SessionSnapshot> findLatest(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load session " + sessionId, e);
        }
        return Optional.empty();
    }

    @Override
    public void insert(SessionSnapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, snapshot.sessionId());
            stmt.setLong(2, snapshot.version());
            stmt.setString(3, snapshot.phase().name());
            stmt.setString(4, serialize(snapshot));
            stmt.setTimestamp(5, Timestamp.from(snapshot.updatedAt()));
            stmt.executeUpdate();
            log.debug("Stored session '{}' version {}", snapshot.sessionId(), snapshot.version());
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                throw new VersionConflictException(snapshot.sessionId(), snapshot.version() - 1,
                        currentVersion(snapshot.sessionId()));
            }
            throw new IllegalStateException("Failed to store session " + snapshot.sessionId()
                    + " version " + snapshot.version(), e);
        }
    }

    @Override
    public List<SessionSnapshot> history(String sessionId) {
        List<SessionSnapshot> versions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_HISTORY_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    versions.add(deserialize(rs.getString("snapshot")));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load history of session " + sessionId, e);
        }
        return versions;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private long currentVersion(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_MAX_VERSION_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong("max_version") : 0L;
            }
        } catch (SQLException e) {
            log.warn("Failed to read current version of session '{}': {}", sessionId, e.getMessage());
            return -1L;
        }
    }

    private static boolean isIntegrityViolation(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS);
    }

    private String serialize(SessionSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session snapshot", e);
        }
    }

    private SessionSnapshot deserialize(String json) {
        try {
            return objectMapper.readValue(json, SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize session snapshot", e);
        }
    }
}
