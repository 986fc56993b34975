package tempo.scheduler.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.repository.OccurrenceRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static tempo.scheduler.store.JdbcSupport.*;

/**
 * JDBC implementation of OccurrenceRepository.
 * Cron and interval occurrences share one table, discriminated by {@code kind}.
 */
public class JdbcOccurrenceRepository implements OccurrenceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOccurrenceRepository.class);

    private final Database db;

    public JdbcOccurrenceRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insert(Occurrence occurrence) {
        String sql = """
                    INSERT INTO occurrences (id, kind, definition_id, execution_time, status, lock_holder, locked_at,
                                             executed_at, elapsed_ms, exception, retry_count, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setObject(1, occurrence.id());
                ps.setString(2, occurrence.kind().name());
                ps.setObject(3, occurrence.definitionId());
                setInstant(ps, 4, occurrence.executionTime());
                ps.setString(5, occurrence.status().name());
                ps.setString(6, occurrence.lockHolder());
                setInstant(ps, 7, occurrence.lockedAt());
                setInstant(ps, 8, occurrence.executedAt());
                setLongOrNull(ps, 9, occurrence.elapsedMs());
                ps.setString(10, occurrence.exception());
                ps.setInt(11, occurrence.retryCount());
                setInstant(ps, 12, occurrence.createdAt());
                setInstant(ps, 13, occurrence.updatedAt());

                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    log.debug("Occurrence of {} at {} already exists", occurrence.definitionId(),
                            occurrence.executionTime());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert occurrence: " + occurrence.id(), e);
        }
    }

    @Override
    public Optional<Occurrence> findById(UUID id) {
        String sql = "SELECT * FROM occurrences WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            List<Occurrence> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find occurrence: " + id, e);
        }
    }

    @Override
    public List<Occurrence> findByDefinition(JobKind kind, UUID definitionId, int limit) {
        String sql = """
                    SELECT * FROM occurrences
                    WHERE kind = ? AND definition_id = ?
                    ORDER BY execution_time DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, kind.name());
            ps.setObject(2, definitionId);
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find occurrences of definition: " + definitionId, e);
        }
    }

    @Override
    public List<Occurrence> findEarliestClaimable(JobKind kind, String nodeId, Instant from) {
        String minSql = """
                    SELECT MIN(execution_time) AS earliest FROM occurrences
                    WHERE kind = ? AND execution_time >= ?
                      AND status IN ('IDLE', 'QUEUED') AND (lock_holder = ? OR locked_at IS NULL)
                """;
        String rowsSql = """
                    SELECT * FROM occurrences
                    WHERE kind = ? AND execution_time >= ? AND execution_time < ?
                      AND status IN ('IDLE', 'QUEUED') AND (lock_holder = ? OR locked_at IS NULL)
                    ORDER BY execution_time
                """;

        try (Connection conn = db.getConnection()) {
            Instant earliest;
            try (PreparedStatement ps = conn.prepareStatement(minSql)) {
                ps.setString(1, kind.name());
                setInstant(ps, 2, from);
                ps.setString(3, nodeId);
                try (ResultSet rs = ps.executeQuery()) {
                    earliest = rs.next() ? getInstant(rs, "earliest") : null;
                }
            }
            if (earliest == null) {
                return List.of();
            }

            Instant second = earliest.truncatedTo(ChronoUnit.SECONDS);
            try (PreparedStatement ps = conn.prepareStatement(rowsSql)) {
                ps.setString(1, kind.name());
                setInstant(ps, 2, second.isBefore(from) ? from : second);
                setInstant(ps, 3, second.plusSeconds(1));
                ps.setString(4, nodeId);
                return executeQuery(ps);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find earliest " + kind + " occurrences for node: " + nodeId, e);
        }
    }

    @Override
    public Map<UUID, Instant> findLatestExecutionTimes(JobKind kind) {
        String sql = """
                    SELECT definition_id, MAX(execution_time) AS latest FROM occurrences
                    WHERE kind = ?
                    GROUP BY definition_id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, kind.name());
            Map<UUID, Instant> latest = new HashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    latest.put(getUuid(rs, "definition_id"), getInstant(rs, "latest"));
                }
            }
            return latest;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find latest " + kind + " occurrences", e);
        }
    }

    @Override
    public Optional<Occurrence> tryQueue(Occurrence observed, String nodeId, Instant now) {
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
    public List<Occurrence> findTimedOut(JobKind kind, Instant cutoff) {
        String sql = """
                    SELECT * FROM occurrences
                    WHERE kind = ? AND execution_time <= ? AND status IN ('IDLE', 'QUEUED')
                    ORDER BY execution_time
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, kind.name());
            setInstant(ps, 2, cutoff);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find timed-out " + kind + " occurrences", e);
        }
    }

    @Override
    public Optional<Occurrence> tryReclaim(Occurrence observed, String nodeId, Instant now) {
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

    private boolean conditionalUpdate(Occurrence observed, JobStatus target, String nodeId, Instant at,
            boolean respectLease) {
        String sql = """
                    UPDATE occurrences
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
                log.debug("Lost claim on occurrence {} ({})", observed.id(), target);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim occurrence: " + observed.id(), e);
        }
    }

    @Override
    public boolean applyUpdate(ExecutionContext context, Instant now) {
        try (Connection conn = db.getConnection()) {
            boolean updated = applyContext(conn, "occurrences", context, now);
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update occurrence: " + context.jobId(), e);
        }
    }

    @Override
    public int markInProgress(Collection<UUID> ids, Instant now) {
        if (ids.isEmpty())
            return 0;

        String sql = "UPDATE occurrences SET status = 'IN_PROGRESS', updated_at = ? WHERE id IN ("
                + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, now);
            bindUuids(ps, 2, ids);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark occurrences in progress", e);
        }
    }

    @Override
    public int release(Collection<UUID> ids, String nodeId, Instant now) {
        if (ids.isEmpty())
            return 0;

        String sql = """
                    UPDATE occurrences
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
            throw new RuntimeException("Failed to release occurrences for node: " + nodeId, e);
        }
    }

    @Override
    public int releaseAll(String nodeId, Instant now) {
        String idleSql = """
                    UPDATE occurrences
                    SET status = 'IDLE', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status = 'QUEUED'
                """;
        String cancelSql = """
                    UPDATE occurrences
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
            throw new RuntimeException("Failed to release occurrences for node: " + nodeId, e);
        }
    }

    @Override
    public int releaseNode(String nodeId, Instant now) {
        String sql = """
                    UPDATE occurrences
                    SET status = 'IDLE', lock_holder = NULL, locked_at = NULL, updated_at = ?
                    WHERE lock_holder = ? AND status IN ('QUEUED', 'IN_PROGRESS')
                """;

        try (Connection conn = db.getConnection()) {
            int released = releaseWith(conn, sql, nodeId, now);
            conn.commit();

            if (released > 0) {
                log.info("Freed {} occurrences from dead node {}", released, nodeId);
            }
            return released;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release occurrences for dead node: " + nodeId, e);
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

    private List<Occurrence> executeQuery(PreparedStatement ps) throws SQLException {
        List<Occurrence> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Occurrence mapRow(ResultSet rs) throws SQLException {
        return Occurrence.builder()
                .id(getUuid(rs, "id"))
                .kind(JobKind.valueOf(rs.getString("kind")))
                .definitionId(getUuid(rs, "definition_id"))
                .executionTime(getInstant(rs, "execution_time"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .lockHolder(rs.getString("lock_holder"))
                .lockedAt(getInstant(rs, "locked_at"))
                .executedAt(getInstant(rs, "executed_at"))
                .elapsedMs(getLongOrNull(rs, "elapsed_ms"))
                .exception(rs.getString("exception"))
                .retryCount(rs.getInt("retry_count"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
