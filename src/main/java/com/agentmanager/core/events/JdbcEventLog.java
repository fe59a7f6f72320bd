package com.agentmanager.core.events;

import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.StorageException;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.persistence.JdbcSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Map;
import java.util.Objects;

/**
 * {@link EventLog} persisted to the PostgreSQL {@code session_events} table.
 * <p>
 * Each append runs in one transaction: it advances {@code sessions.last_seq} with
 * {@code UPDATE ... RETURNING}, which row-locks the session until commit, then inserts the
 * event with the returned seq. Concurrent appenders for the same session therefore queue on
 * the row lock, and a rolled back insert also rolls back the counter, so seqs stay gapless.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    private static final String TABLE_NAME = "session_events";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         BIGSERIAL PRIMARY KEY,
                session_id VARCHAR(36) NOT NULL REFERENCES sessions(id) ON DELETE CASCADE,
                seq        BIGINT NOT NULL,
                source     VARCHAR(16) NOT NULL,
                type       VARCHAR(128) NOT NULL,
                payload    TEXT NOT NULL,
                ts         TIMESTAMPTZ NOT NULL,
                UNIQUE (session_id, seq)
            )
            """.formatted(TABLE_NAME);

    private static final String NEXT_SEQ_SQL = """
            UPDATE sessions SET last_seq = last_seq + 1 WHERE id = ? RETURNING last_seq
            """;

    private static final String INSERT_SQL = """
            INSERT INTO %s (session_id, seq, source, type, payload, ts)
            VALUES (?, ?, ?, ?, ?, ?)
            RETURNING id
            """.formatted(TABLE_NAME);

    private static final String SELECT_SINCE_SQL = """
            SELECT id, session_id, seq, source, type, payload, ts
            FROM %s
            WHERE session_id = ? AND seq > ?
            ORDER BY seq ASC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private static final String LAST_SEQ_SQL = """
            SELECT last_seq FROM sessions WHERE id = ?
            """;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcEventLog(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the events table. Must run after the sessions table exists.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public SessionEvent append(String sessionId, EventSource source, String type, Map<String, Object> payload) {
        Map<String, Object> body = payload == null ? Map.of() : payload;
        String json = serialize(body);
        Instant ts = clock.instant();

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long seq;
                try (PreparedStatement stmt = conn.prepareStatement(NEXT_SEQ_SQL)) {
                    stmt.setString(1, sessionId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            throw new NotFoundException("Session", sessionId);
                        }
                        seq = rs.getLong(1);
                    }
                }
                long id;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                    stmt.setString(1, sessionId);
                    stmt.setLong(2, seq);
                    stmt.setString(3, source.wireName());
                    stmt.setString(4, type);
                    stmt.setString(5, json);
                    stmt.setTimestamp(6, Timestamp.from(ts));
                    try (ResultSet rs = stmt.executeQuery()) {
                        rs.next();
                        id = rs.getLong(1);
                    }
                }
                conn.commit();
                return new SessionEvent(id, sessionId, source, type, body, seq, ts);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to append " + type + " event to session " + sessionId, e);
        }
    }

    @Override
    public List<SessionEvent> query(String sessionId, long sinceSeq) {
        return query(sessionId, sinceSeq, Integer.MAX_VALUE);
    }

    @Override
    public List<SessionEvent> query(String sessionId, long sinceSeq, int limit) {
        List<SessionEvent> events = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SINCE_SQL)) {
            stmt.setString(1, sessionId);
            stmt.setLong(2, sinceSeq);
            stmt.setInt(3, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    events.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query events of session " + sessionId, e);
        }
        return events;
    }

    @Override
    public long lastSeq(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(LAST_SEQ_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read last seq of session " + sessionId, e);
        }
    }

    private SessionEvent fromResultSet(ResultSet rs) throws SQLException {
        return new SessionEvent(
                rs.getLong("id"),
                rs.getString("session_id"),
                EventSource.fromWire(rs.getString("source")),
                rs.getString("type"),
                deserialize(rs.getString("payload")),
                rs.getLong("seq"),
                JdbcSupport.instant(rs, "ts"));
    }

    private String serialize(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StorageException("Event payload is not serializable", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable event payload, returning empty map: {}", e.getMessage());
            return Map.of();
        }
    }
}
