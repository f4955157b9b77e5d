package com.marketpulse.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-based {@link CheckpointStore} that persists checkpoints to a PostgreSQL table.
 * <p>
 * Rows are only ever inserted. The generated {@code id} column gives the append
 * order, so {@link #readSession(String)} returns records in the order they were
 * written even when several share a timestamp.
 * <p>
 * The table {@code marketpulse_checkpoints} is created automatically via
 * {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    static final String TABLE_NAME = "marketpulse_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          BIGSERIAL PRIMARY KEY,
                session_id  VARCHAR(64)  NOT NULL,
                stage       VARCHAR(64)  NOT NULL,
                category    VARCHAR(64)  NOT NULL,
                payload     TEXT         NOT NULL,
                created_at  TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %s_session_idx ON %s (session_id, id)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (session_id, stage, category, payload, created_at)
            VALUES (?, ?, ?, ?, ?)
            RETURNING id
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_SESSION_SQL = """
            SELECT id, session_id, stage, category, payload, created_at
            FROM %s
            WHERE session_id = ?
            ORDER BY id ASC
            """.formatted(TABLE_NAME);

    private static final String SELECT_SESSIONS_SQL = """
            SELECT DISTINCT session_id FROM %s ORDER BY session_id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcCheckpointStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement table = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_INDEX_SQL)) {
            table.execute();
            index.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Checkpoint append(String sessionId, String category, String label, Object payload) {
        String json = serialize(sessionId, label, payload);
        Instant now = clock.instant();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setString(2, label);
            stmt.setString(3, category);
            stmt.setString(4, json);
            stmt.setTimestamp(5, Timestamp.from(now));

            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new CheckpointWriteException(
                            "Insert returned no id for checkpoint '" + label + "' of session " + sessionId, null);
                }
                long id = rs.getLong(1);
                log.debug("Saved checkpoint #{} '{}' ({}) for session {}", id, label, category, sessionId);
                return new Checkpoint(sessionId, id, label, category, json, now);
            }
        } catch (SQLException e) {
            throw new CheckpointWriteException(
                    "Failed to store checkpoint '" + label + "' for session " + sessionId, e);
        }
    }

    @Override
    public List<Checkpoint> readSession(String sessionId) {
        List<Checkpoint> checkpoints = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_SESSION_SQL)) {
            stmt.setString(1, sessionId);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    checkpoints.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read checkpoints for session '{}'", sessionId, e);
        }

        return checkpoints;
    }

    @Override
    public List<String> listSessions() {
        List<String> ids = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SESSIONS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            log.error("Failed to list checkpoint sessions", e);
        }

        return ids;
    }

    @Override
    public String describe() {
        return "jdbc:" + TABLE_NAME;
    }

    /**
     * Whether a connection can be obtained and validated within the given seconds.
     */
    public boolean isReachable(int timeoutSeconds) {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(timeoutSeconds);
        } catch (SQLException e) {
            log.warn("Checkpoint database unreachable: {}", e.getMessage());
            return false;
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private String serialize(String sessionId, String label, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CheckpointWriteException(
                    "Failed to serialize checkpoint '" + label + "' for session " + sessionId, e);
        }
    }

    private Checkpoint fromResultSet(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new Checkpoint(
                rs.getString("session_id"),
                rs.getLong("id"),
                rs.getString("stage"),
                rs.getString("category"),
                rs.getString("payload"),
                created == null ? null : created.toInstant());
    }
}
