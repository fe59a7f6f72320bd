package com.agentmanager.core.persistence;

import com.agentmanager.core.errors.StorageException;
import com.agentmanager.core.model.Repo;
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
import java.util.Optional;
import java.util.UUID;

/**
 * {@link RepoStore} backed by the PostgreSQL {@code repos} table.
 */
public class JdbcRepoStore implements RepoStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRepoStore.class);

    static final String TABLE_NAME = "repos";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(36) PRIMARY KEY,
                owner            VARCHAR(255) NOT NULL,
                name             VARCHAR(255) NOT NULL,
                default_branch   VARCHAR(255) NOT NULL DEFAULT 'main',
                created_at       TIMESTAMPTZ NOT NULL,
                updated_at       TIMESTAMPTZ NOT NULL,
                last_activity_at TIMESTAMPTZ,
                UNIQUE (owner, name)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, owner, name, default_branch, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (owner, name) DO NOTHING
            """.formatted(TABLE_NAME);

    private static final String SELECT_COLUMNS =
            "SELECT id, owner, name, default_branch, created_at, updated_at, last_activity_at FROM " + TABLE_NAME;

    private static final String TOUCH_SQL = """
            UPDATE %s SET last_activity_at = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcRepoStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Repo register(String owner, String name, String defaultBranch) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, UUID.randomUUID().toString());
                stmt.setString(2, owner);
                stmt.setString(3, name);
                stmt.setString(4, defaultBranch);
                stmt.setTimestamp(5, Timestamp.from(now));
                stmt.setTimestamp(6, Timestamp.from(now));
                stmt.executeUpdate();
            }
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " WHERE owner = ? AND name = ?")) {
                stmt.setString(1, owner);
                stmt.setString(2, name);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new StorageException("Repo " + owner + "/" + name + " vanished after insert", null);
                    }
                    return fromResultSet(rs);
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to register repo " + owner + "/" + name, e);
        }
    }

    @Override
    public Optional<Repo> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load repo " + id, e);
        }
    }

    @Override
    public List<Repo> findAll() {
        List<Repo> repos = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " ORDER BY owner, name");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                repos.add(fromResultSet(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list repos", e);
        }
        return repos;
    }

    @Override
    public void touchActivity(String id) {
        Timestamp now = Timestamp.from(clock.instant());
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(TOUCH_SQL)) {
            stmt.setTimestamp(1, now);
            stmt.setTimestamp(2, now);
            stmt.setString(3, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to update activity for repo " + id, e);
        }
    }

    private static Repo fromResultSet(ResultSet rs) throws SQLException {
        return new Repo(
                rs.getString("id"),
                rs.getString("owner"),
                rs.getString("name"),
                rs.getString("default_branch"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "updated_at"),
                JdbcSupport.instant(rs, "last_activity_at"));
    }
}
