package tempo.scheduler.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.RunCondition;
import tempo.scheduler.model.TimeJob;
import tempo.scheduler.repository.TimeJobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static tempo.scheduler.store.JdbcSupport.*;

/**
 * JDBC implementation of TimeJobRepository.
 * Claims are optimistic: a conditional update on {@code updated_at}.
 */
public class JdbcTimeJobRepository implements TimeJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTimeJobRepository.class);

    private static final String CLAIMABLE = """
                status IN ('IDLE', 'QUEUED') AND (lock_holder = ? OR locked_at IS NULL)
            """;

    private final Database db;

    public JdbcTimeJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(TimeJob job) {
        String sql = """
                    INSERT INTO time_jobs (id, function_name, description, payload, execution_time, status,
                                           lock_holder, locked_at, executed_at, elapsed_ms, exception,
                                           retries, retry_count, retry_intervals, parent_id, run_condition,
                                           created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                addTree(ps, job, job.parentId());
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.debug("Saved time job {} ({})", job.id(), job.function());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save time job: " + job.id(), e);
        }
    }

    /** Parents are batched before their children so the foreign key holds */
    private void addTree(PreparedStatement ps, TimeJob job, UUID parentId) throws SQLException {
        ps.setObject(1, job.id());
        ps.setString(2, job.function());
        ps.setString(3, job.description());
        setBytes(ps, 4, job.payload());
        setInstant(ps, 5, job.executionTime());
        ps.setString(6, job.status().name());
        ps.setString(7, job.lockHolder());
        setInstant(ps, 8, job.lockedAt());
        setInstant(ps, 9, job.executedAt());
        setLongOrNull(ps, 10, job.elapsedMs());
        ps.setString(11, job.exception());
        ps.setInt(12, job.retries());
        ps.setInt(13, job.retryCount());
        ps.setString(14, encodeIntervals(job.retryIntervals()));
        setUuid(ps, 15, parentId);
        ps.setString(16, job.runCondition() != null ? job.runCondition().name() : null);
        setInstant(ps, 17, job.createdAt());
        setInstant(ps, 18, job.updatedAt());
        ps.addBatch();

        for (TimeJob child : job.children()) {
            addTree(ps, child, job.id());
        }
    }

    @Override
    public boolean update(TimeJob job) {
        String sql = """
                    UPDATE time_jobs
                    SET function_name = ?, description = ?, payload = ?, execution_time = ?,
                        retries = ?, retry_intervals = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.function());
            ps.setString(2, job.description());
            setBytes(ps, 3, job.payload());
            setInstant(ps, 4, job.executionTime());
            ps.setInt(5, job.retries());
            ps.setString(6, encodeIntervals(job.retryIntervals()));
            setInstant(ps, 7, job.updatedAt() != null ? job.updatedAt() : Instant.now());
            ps.setObject(8, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update time job: " + job.id(), e);
        }
    }

    @Override
    public Optional<TimeJob> findById(UUID id) {
        String sql = "SELECT * FROM time_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            List<TimeJob> found = queryTrees(conn, ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find time job: " + id, e);
        }
    }

    @Override
    public List<TimeJob> findRoots(int limit) {
        String sql = """
                    SELECT * FROM time_jobs
                    WHERE parent_id IS NULL
                    ORDER BY execution_time
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return queryTrees(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list time jobs", e);
        }
    }

    @Override
    public boolean delete(UUID id) {
        String sql = "DELETE FROM time_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete time job: " + id, e);
        }
    }

    @Override
    public Optional<Instant> findEarliestExecutionTime(String nodeId, Instant from) {
        String sql = """
                    SELECT MIN(execution_time) AS earliest FROM time_jobs
                    WHERE parent_id IS NULL AND execution_time IS NOT NULL AND execution_time >= ?
                      AND
                """ + CLAIMABLE;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, from);
            ps.setString(2, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(getInstant(rs, "earliest"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find earliest time job for node: " + nodeId, e);
        }
    }

    @Override
    public List<TimeJob> findClaimable(String nodeId, Instant from, Instant to) {
        String sql = """
                    SELECT * FROM time_jobs
                    WHERE parent_id IS NULL AND execution_time >= ? AND execution_time < ?
                      AND
                """ + CLAIMABLE + " ORDER BY execution_time";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, from);
            setInstant(ps, 2, to);
            ps.setString(3, nodeId);
            return queryTrees(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find claimable time jobs for node: " + nodeId, e);
        }
    }

    @Override
    public Optional<TimeJob> tryQueue(TimeJob observed, String nodeId, Instant now) {
        Instant at = truncate(now);
        if (!conditionalUpdate(observed, JobStatus.QUEUED, nodeId, at, true)) {
            return Optional.empty();
        }
        return Optional.of(observed.toBuilder()
                .status(JobStatus.QUEUED)
                .lockHolder(nodeId)
                .lockedAt(at)
                .updatedAt(at)
                .build());
    }

    @Override
    public List<TimeJob> findTimedOut(Instant cutoff) {
        String sql = """
                    SELECT * FROM time_jobs
                    WHERE parent_id IS NULL AND execution_time IS NOT NULL AND execution_time <= ?
                      AND status IN ('IDLE', 'QUEUED')
                    ORDER BY execution_time
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, cutoff);
            return queryTrees(conn, ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find timed-out time jobs", e);
        }
    }

    @Override
    public Optional<TimeJob> tryReclaim(TimeJob observed, String nodeId, Instant now) {
        Instant at = truncate(now);
        if (!conditionalUpdate(observed, JobStatus.IN_PROGRESS, nodeId, at, false)) {
            return Optional.empty();
        }
        return Optional.of(observed.toBuilder()
                .status(JobStatus.IN_PROGRESS)
                .lockHolder(nodeId)
                .lockedAt(at)
                .updatedAt(at)
                .build());
    }

    /**
     * The single version-checked write. Commits only if {@code updated_at}
     * still holds the observed value and the row is still idle or queued.
     */
    private boolean conditionalUpdate(TimeJob observed, JobStatus target, String nodeId, Instant at,
            boolean respectLease) {
        String sql = """
                    UPDATE time_jobs
                    SET status = ?, lock_holder = ?, locked_at = ?, updated_at = ?
                    WHERE id = ? AND updated_at = ? AND status IN ('IDLE', 'QUEUED')
                """ + (respectLease ? " AND (lock_holder = ? OR locked_at IS NULL)" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, target.name());
            ps.setString(2, nodeId);
            setInstant(ps, 3, at);
            setInstant(ps, 4, at);
            ps.setObject(5, observed.id());
            setInstant(ps, 6, observed.updatedAt());
            if (respectLease) {
                ps.setString(7, nodeId);
            }

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Lost claim on time job {} ({})", observed.id(), target);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim time job: " + observed.id(), e);
        }
    }

    @Override
    public boolean applyUpdate(ExecutionContext context, Instant now) {
        try (Connection conn = db.getConnection()) {
            boolean updated = applyContext(conn, "time_jobs", context, now);
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update time job: " + context.jobId(), e);
        }
    }

    @Override
    public int updateStatus(Collection<UUID> ids, JobStatus status, String message, boolean releaseLock,
            Instant now) {
        if (ids.isEmpty())
            return 0;

        String sql = "UPDATE time_jobs SET status = ?, updated_at = ?"
                + (message != null ? ", exception = ?" : "")
                + (releaseLock ? ", lock_holder = NULL, locked_at = NULL" : "")
                + " WHERE id IN (" + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            ps.setString(i++, status.name());
            setInstant(ps, i++, now);
            if (message != null) {
                ps.setString(i++, message);
            }
            bindUuids(ps, i, ids);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set status " + status + " on time jobs", e);
        }
    }

    @Override
    public int release(Collection<UUID> ids, String nodeId, Instant now) {
        if (ids.isEmpty())
            return 0;

        String sql = """
                    UPDATE time_jobs
                    SET status = 'IDLE', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status = 'QUEUED' AND id IN (
                """ + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, now);
            ps.setString(2, nodeId);
            bindUuids(ps, 3, ids);

            int released = ps.executeUpdate();
            conn.commit();
            return released;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release time jobs for node: " + nodeId, e);
        }
    }

    @Override
    public int releaseAll(String nodeId, Instant now) {
        String idleSql = """
                    UPDATE time_jobs
                    SET status = 'IDLE', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status = 'QUEUED'
                """;
        String cancelSql = """
                    UPDATE time_jobs
                    SET status = 'CANCELLED', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status = 'IN_PROGRESS'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int released = releaseWith(conn, idleSql, nodeId, now)
                        + releaseWith(conn, cancelSql, nodeId, now);
                conn.commit();
                return released;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release time jobs for node: " + nodeId, e);
        }
    }

    @Override
    public int releaseNode(String nodeId, Instant now) {
        String sql = """
                    UPDATE time_jobs
                    SET status = 'IDLE', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status IN ('QUEUED', 'IN_PROGRESS')
                """;

        try (Connection conn = db.getConnection()) {
            int released = releaseWith(conn, sql, nodeId, now);
            conn.commit();

            if (released > 0) {
                log.info("Freed {} time jobs from dead node {}", released, nodeId);
            }
            return released;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release time jobs for dead node: " + nodeId, e);
        }
    }

    @Override
    public Optional<byte[]> findPayload(UUID id) {
        String sql = "SELECT payload FROM time_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getBytes("payload"));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load payload of time job: " + id, e);
        }
    }

    // Helper methods

    private static int releaseWith(Connection conn, String sql, String nodeId, Instant now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, now);
            ps.setString(2, nodeId);
            return ps.executeUpdate();
        }
    }

    private List<TimeJob> queryTrees(Connection conn, PreparedStatement ps) throws SQLException {
        List<TimeJob.Builder> builders = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                builders.add(mapRow(rs));
            }
        }

        List<TimeJob> results = new ArrayList<>(builders.size());
        for (TimeJob.Builder builder : builders) {
            TimeJob shallow = builder.build();
            results.add(builder.children(loadChildren(conn, shallow.id())).build());
        }
        return results;
    }

    private List<TimeJob> loadChildren(Connection conn, UUID parentId) throws SQLException {
        String sql = "SELECT * FROM time_jobs WHERE parent_id = ? ORDER BY created_at, id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, parentId);
            return queryTrees(conn, ps);
        }
    }

    private TimeJob.Builder mapRow(ResultSet rs) throws SQLException {
        String runCondition = rs.getString("run_condition");
        return TimeJob.builder()
                .id(getUuid(rs, "id"))
                .function(rs.getString("function_name"))
                .description(rs.getString("description"))
                .payload(rs.getBytes("payload"))
                .executionTime(getInstant(rs, "execution_time"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .lockHolder(rs.getString("lock_holder"))
                .lockedAt(getInstant(rs, "locked_at"))
                .executedAt(getInstant(rs, "executed_at"))
                .elapsedMs(getLongOrNull(rs, "elapsed_ms"))
                .exception(rs.getString("exception"))
                .retries(rs.getInt("retries"))
                .retryCount(rs.getInt("retry_count"))
                .retryIntervals(decodeIntervals(rs.getString("retry_intervals")))
                .parentId(getUuid(rs, "parent_id"))
                .runCondition(runCondition != null ? RunCondition.valueOf(runCondition) : null)
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"));
    }
}
