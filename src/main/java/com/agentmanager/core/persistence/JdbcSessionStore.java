package com.agentmanager.core.persistence;

import com.agentmanager.core.errors.ConflictException;
import com.agentmanager.core.errors.NotFoundException;
import com.agentmanager.core.errors.StorageException;
import com.agentmanager.core.model.NewSession;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionRole;
import com.agentmanager.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SessionStore} backed by the PostgreSQL {@code sessions} table.
 * <p>
 * The one-active-orchestrator-per-repo rule is a partial unique index, so the reservation
 * is a single INSERT: concurrent requests race on the index and all but one get a
 * unique violation, surfaced as {@link ConflictException}.
 * <p>
 * The {@code last_seq} column is the per-session event counter advanced by {@code JdbcEventLog}.
 */
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    static final String TABLE_NAME = "sessions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                VARCHAR(36) PRIMARY KEY,
                repo_id           VARCHAR(36) NOT NULL REFERENCES %s(id),
                role              VARCHAR(32) NOT NULL,
                status            VARCHAR(32) NOT NULL,
                branch_name       VARCHAR(255),
                base_branch       VARCHAR(255),
                worktree_path     TEXT,
                container_id      VARCHAR(128),
                goal_prompt       TEXT,
                model             VARCHAR(64),
                last_seq          BIGINT NOT NULL DEFAULT 0,
                last_known_pr_url TEXT,
                created_at        TIMESTAMPTZ NOT NULL,
                updated_at        TIMESTAMPTZ NOT NULL,
                finished_at       TIMESTAMPTZ
            )
            """.formatted(TABLE_NAME, JdbcRepoStore.TABLE_NAME);

    private static final String CREATE_ORCHESTRATOR_INDEX_SQL = """
            CREATE UNIQUE INDEX IF NOT EXISTS sessions_one_active_orchestrator
            ON %s (repo_id)
            WHERE role = 'orchestrator' AND status IN ('starting', 'running', 'waiting')
            """.formatted(TABLE_NAME);

    private static final String CREATE_REPO_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS sessions_repo_id ON %s (repo_id)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, repo_id, role, status, branch_name, base_branch, goal_prompt, model,
                            created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_COLUMNS = """
            SELECT id, repo_id, role, status, branch_name, base_branch, worktree_path, container_id,
                   goal_prompt, model, created_at, updated_at, finished_at, last_known_pr_url
            FROM %s
            """.formatted(TABLE_NAME);

    private static final String CAS_STATUS_SQL = """
            UPDATE %s
            SET status = ?, updated_at = ?, finished_at = COALESCE(?, finished_at)
            WHERE id = ? AND status = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_PROVISIONING_SQL = """
            UPDATE %s
            SET branch_name = COALESCE(?, branch_name),
                worktree_path = COALESCE(?, worktree_path),
                container_id = COALESCE(?, container_id),
                updated_at = ?
            WHERE id = ? AND status IN ('starting', 'running', 'waiting')
            """.formatted(TABLE_NAME);

    private static final String UPDATE_PR_URL_SQL = """
            UPDATE %s
            SET last_known_pr_url = ?
            WHERE id = ? AND status IN ('starting', 'running', 'waiting')
            """.formatted(TABLE_NAME);

    private static final String STATS_SQL = """
            SELECT COUNT(*) AS total,
                   COUNT(*) FILTER (WHERE status IN ('starting', 'running', 'waiting')) AS active,
                   COUNT(*) FILTER (WHERE status = 'running') AS running,
                   COUNT(*) FILTER (WHERE status = 'waiting') AS waiting,
                   COUNT(*) FILTER (WHERE status = 'error') AS errored
            FROM %s
            WHERE repo_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcSessionStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the sessions table and its indexes. Must run after the repos table exists.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL, CREATE_ORCHESTRATOR_INDEX_SQL, CREATE_REPO_INDEX_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Session insert(NewSession newSession) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, newSession.id());
            stmt.setString(2, newSession.repoId());
            stmt.setString(3, newSession.role().wireName());
            stmt.setString(4, SessionStatus.STARTING.wireName());
            stmt.setString(5, newSession.branchName());
            stmt.setString(6, newSession.baseBranch());
            stmt.setString(7, newSession.goalPrompt());
            stmt.setString(8, newSession.model());
            JdbcSupport.setInstant(stmt, 9, newSession.createdAt());
            JdbcSupport.setInstant(stmt, 10, newSession.createdAt());
            stmt.executeUpdate();
            return newSession.toSession();
        } catch (SQLException e) {
            if (JdbcSupport.isUniqueViolation(e) && newSession.role() == SessionRole.ORCHESTRATOR) {
                throw new ConflictException(newSession.repoId());
            }
            throw new StorageException("Failed to insert session " + newSession.id(), e);
        }
    }

    @Override
    public Optional<Session> findById(String id) {
        List<Session> found = select(SELECT_COLUMNS + " WHERE id = ?", id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Session> findByRepo(String repoId) {
        return select(SELECT_COLUMNS + " WHERE repo_id = ? ORDER BY created_at DESC", repoId);
    }

    @Override
    public List<Session> findByStatus(SessionStatus status) {
        return select(SELECT_COLUMNS + " WHERE status = ? ORDER BY created_at ASC", status.wireName());
    }

    @Override
    public boolean compareAndSetStatus(String id, SessionStatus expected, SessionStatus next) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CAS_STATUS_SQL)) {
            stmt.setString(1, next.wireName());
            JdbcSupport.setInstant(stmt, 2, now);
            JdbcSupport.setInstant(stmt, 3, next.isTerminal() ? now : null);
            stmt.setString(4, id);
            stmt.setString(5, expected.wireName());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("Failed to update status of session " + id, e);
        }
    }

    @Override
    public Session updateProvisioning(String id, String branchName, String worktreePath, String containerId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_PROVISIONING_SQL)) {
            stmt.setString(1, branchName);
            stmt.setString(2, worktreePath);
            stmt.setString(3, containerId);
            JdbcSupport.setInstant(stmt, 4, clock.instant());
            stmt.setString(5, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to update provisioning of session " + id, e);
        }
        // zero rows means missing or terminal; the re-read tells which
        return findById(id).orElseThrow(() -> new NotFoundException("Session", id));
    }

    @Override
    public Session recordPullRequest(String id, String prUrl) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_PR_URL_SQL)) {
            stmt.setString(1, prUrl);
            stmt.setString(2, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record pull request of session " + id, e);
        }
        return findById(id).orElseThrow(() -> new NotFoundException("Session", id));
    }

    @Override
    public RepoStats statsForRepo(String repoId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(STATS_SQL)) {
            stmt.setString(1, repoId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return RepoStats.EMPTY;
                }
                return new RepoStats(
                        rs.getInt("total"),
                        rs.getInt("active"),
                        rs.getInt("running") > 0,
                        rs.getInt("waiting") > 0,
                        rs.getInt("errored") > 0);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to compute stats for repo " + repoId, e);
        }
    }

    private List<Session> select(String sql, String param) {
        List<Session> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sessions.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to query sessions", e);
        }
        return sessions;
    }

    private static Session fromResultSet(ResultSet rs) throws SQLException {
        return new Session(
                rs.getString("id"),
                rs.getString("repo_id"),
                SessionRole.parse(rs.getString("role")).orElseThrow(),
                SessionStatus.fromWire(rs.getString("status")),
                rs.getString("branch_name"),
                rs.getString("base_branch"),
                rs.getString("worktree_path"),
                rs.getString("container_id"),
                rs.getString("goal_prompt"),
                rs.getString("model"),
                JdbcSupport.instant(rs, "created_at"),
                JdbcSupport.instant(rs, "updated_at"),
                JdbcSupport.instant(rs, "finished_at"),
                rs.getString("last_known_pr_url"));
    }
}
