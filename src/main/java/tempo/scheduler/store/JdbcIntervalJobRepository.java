package tempo.scheduler.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.repository.IntervalJobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static tempo.scheduler.store.JdbcSupport.*;

/**
 * JDBC implementation of IntervalJobRepository.
 */
public class JdbcIntervalJobRepository implements IntervalJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcIntervalJobRepository.class);

    private final Database db;

    public JdbcIntervalJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(IntervalJob job) {
        String sql = """
                    INSERT INTO interval_jobs (id, function_name, description, interval_ms, start_time, end_time,
                                               active, last_executed_at, execution_count, payload, retries,
                                               retry_intervals, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, job.id());
            ps.setString(2, job.function());
            ps.setString(3, job.description());
            ps.setLong(4, job.interval().toMillis());
            setInstant(ps, 5, job.startTime());
            setInstant(ps, 6, job.endTime());
            ps.setBoolean(7, job.active());
            setInstant(ps, 8, job.lastExecutedAt());
            ps.setLong(9, job.executionCount());
            setBytes(ps, 10, job.payload());
            ps.setInt(11, job.retries());
            ps.setString(12, encodeIntervals(job.retryIntervals()));
            setInstant(ps, 13, job.createdAt());
            setInstant(ps, 14, job.updatedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved interval job {} ({} every {})", job.id(), job.function(), job.interval());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save interval job: " + job.id(), e);
        }
    }

    @Override
    public boolean update(IntervalJob job) {
        String sql = """
                    UPDATE interval_jobs
                    SET function_name = ?, description = ?, interval_ms = ?, start_time = ?, end_time = ?,
                        payload = ?, retries = ?, retry_intervals = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.function());
            ps.setString(2, job.description());
            ps.setLong(3, job.interval().toMillis());
            setInstant(ps, 4, job.startTime());
            setInstant(ps, 5, job.endTime());
            setBytes(ps, 6, job.payload());
            ps.setInt(7, job.retries());
            ps.setString(8, encodeIntervals(job.retryIntervals()));
            setInstant(ps, 9, job.updatedAt() != null ? job.updatedAt() : Instant.now());
            ps.setObject(10, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update interval job: " + job.id(), e);
        }
    }

    @Override
    public Optional<IntervalJob> findById(UUID id) {
        String sql = "SELECT * FROM interval_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            List<IntervalJob> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find interval job: " + id, e);
        }
    }

    @Override
    public List<IntervalJob> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty())
            return List.of();

        String sql = "SELECT * FROM interval_jobs WHERE id IN (" + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindUuids(ps, 1, ids);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find interval jobs by ids", e);
        }
    }

    @Override
    public List<IntervalJob> findAll() {
        String sql = "SELECT * FROM interval_jobs ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list interval jobs", e);
        }
    }

    @Override
    public List<IntervalJob> findActive(Instant now) {
        String sql = """
                    SELECT * FROM interval_jobs
                    WHERE active = TRUE AND (end_time IS NULL OR end_time >= ?)
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, now);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active interval jobs", e);
        }
    }

    @Override
    public boolean setActive(UUID id, boolean active, Instant now) {
        String sql = "UPDATE interval_jobs SET active = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, active);
            setInstant(ps, 2, now);
            ps.setObject(3, id);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Interval job {} {}", id, active ? "resumed" : "paused");
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to toggle interval job: " + id, e);
        }
    }

    @Override
    public boolean recordExecution(UUID id, Instant executedAt, Instant now) {
        String sql = """
                    UPDATE interval_jobs
                    SET last_executed_at = ?, execution_count = execution_count + 1, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, executedAt);
            setInstant(ps, 2, now);
            ps.setObject(3, id);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record execution of interval job: " + id, e);
        }
    }

    @Override
    public boolean delete(UUID id) {
        String occurrencesSql = "DELETE FROM occurrences WHERE kind = ? AND definition_id = ?";
        String jobSql = "DELETE FROM interval_jobs WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement occ = conn.prepareStatement(occurrencesSql);
                    PreparedStatement job = conn.prepareStatement(jobSql)) {

                occ.setString(1, JobKind.INTERVAL.name());
                occ.setObject(2, id);
                occ.executeUpdate();

                job.setObject(1, id);
                int deleted = job.executeUpdate();
                conn.commit();
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete interval job: " + id, e);
        }
    }

    private List<IntervalJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<IntervalJob> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private IntervalJob mapRow(ResultSet rs) throws SQLException {
        return IntervalJob.builder()
                .id(getUuid(rs, "id"))
                .function(rs.getString("function_name"))
                .description(rs.getString("description"))
                .interval(Duration.ofMillis(rs.getLong("interval_ms")))
                .startTime(getInstant(rs, "start_time"))
                .endTime(getInstant(rs, "end_time"))
                .active(rs.getBoolean("active"))
                .lastExecutedAt(getInstant(rs, "last_executed_at"))
                .executionCount(rs.getLong("execution_count"))
                .payload(rs.getBytes("payload"))
                .retries(rs.getInt("retries"))
                .retryIntervals(decodeIntervals(rs.getString("retry_intervals")))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
