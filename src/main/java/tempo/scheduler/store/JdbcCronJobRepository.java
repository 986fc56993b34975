package tempo.scheduler.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.repository.CronJobRepository;

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
 * JDBC implementation of CronJobRepository.
 */
public class JdbcCronJobRepository implements CronJobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCronJobRepository.class);

    private final Database db;

    public JdbcCronJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(CronJob job) {
        String sql = """
                    INSERT INTO cron_jobs (id, function_name, description, expression, payload, retries,
                                           retry_intervals, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, job.id());
            ps.setString(2, job.function());
            ps.setString(3, job.description());
            ps.setString(4, job.expression());
            setBytes(ps, 5, job.payload());
            ps.setInt(6, job.retries());
            ps.setString(7, encodeIntervals(job.retryIntervals()));
            setInstant(ps, 8, job.createdAt());
            setInstant(ps, 9, job.updatedAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved cron job {} ({} '{}')", job.id(), job.function(), job.expression());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save cron job: " + job.id(), e);
        }
    }

    @Override
    public boolean update(CronJob job) {
        String sql = """
                    UPDATE cron_jobs
                    SET function_name = ?, description = ?, expression = ?, payload = ?,
                        retries = ?, retry_intervals = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.function());
            ps.setString(2, job.description());
            ps.setString(3, job.expression());
            setBytes(ps, 4, job.payload());
            ps.setInt(5, job.retries());
            ps.setString(6, encodeIntervals(job.retryIntervals()));
            setInstant(ps, 7, job.updatedAt() != null ? job.updatedAt() : Instant.now());
            ps.setObject(8, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update cron job: " + job.id(), e);
        }
    }

    @Override
    public Optional<CronJob> findById(UUID id) {
        String sql = "SELECT * FROM cron_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            List<CronJob> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cron job: " + id, e);
        }
    }

    @Override
    public List<CronJob> findByIds(Collection<UUID> ids) {
        if (ids.isEmpty())
            return List.of();

        String sql = "SELECT * FROM cron_jobs WHERE id IN (" + placeholders(ids.size()) + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindUuids(ps, 1, ids);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cron jobs by ids", e);
        }
    }

    @Override
    public Optional<CronJob> findByFunction(String function) {
        String sql = "SELECT * FROM cron_jobs WHERE function_name = ? ORDER BY created_at LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, function);
            List<CronJob> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cron job for function: " + function, e);
        }
    }

    @Override
    public List<CronJob> findAll() {
        String sql = "SELECT * FROM cron_jobs ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cron jobs", e);
        }
    }

    @Override
    public boolean delete(UUID id) {
        String occurrencesSql = "DELETE FROM occurrences WHERE kind = ? AND definition_id = ?";
        String jobSql = "DELETE FROM cron_jobs WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement occ = conn.prepareStatement(occurrencesSql);
                    PreparedStatement job = conn.prepareStatement(jobSql)) {

                occ.setString(1, JobKind.CRON.name());
                occ.setObject(2, id);
                int occurrences = occ.executeUpdate();

                job.setObject(1, id);
                int deleted = job.executeUpdate();
                conn.commit();

                if (deleted > 0) {
                    log.debug("Deleted cron job {} with {} occurrences", id, occurrences);
                }
                return deleted > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete cron job: " + id, e);
        }
    }

    private List<CronJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<CronJob> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private CronJob mapRow(ResultSet rs) throws SQLException {
        return CronJob.builder()
                .id(getUuid(rs, "id"))
                .function(rs.getString("function_name"))
                .description(rs.getString("description"))
                .expression(rs.getString("expression"))
                .payload(rs.getBytes("payload"))
                .retries(rs.getInt("retries"))
                .retryIntervals(decodeIntervals(rs.getString("retry_intervals")))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
