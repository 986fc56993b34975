package tempo.scheduler.store;

import tempo.scheduler.model.ExecutionContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Column helpers shared by the JDBC repositories.
 * Timestamps are stored with microsecond precision, so every instant
 * that is written (and later compared as a version) is truncated first.
 */
final class JdbcSupport {

    /** SQLState for a unique constraint violation */
    static final String UNIQUE_VIOLATION = "23505";

    private JdbcSupport() {
    }

    static Instant truncate(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.MICROS) : null;
    }

    static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, OffsetDateTime.ofInstant(truncate(instant), ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static void setUuid(PreparedStatement ps, int index, UUID id) throws SQLException {
        if (id != null) {
            ps.setObject(index, id);
        } else {
            ps.setNull(index, Types.OTHER);
        }
    }

    static UUID getUuid(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, UUID.class);
    }

    static void setLongOrNull(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static void setBytes(PreparedStatement ps, int index, byte[] value) throws SQLException {
        if (value != null) {
            ps.setBytes(index, value);
        } else {
            ps.setNull(index, Types.VARBINARY);
        }
    }

    /** Retry intervals are stored as comma-separated seconds */
    static String encodeIntervals(int[] intervals) {
        if (intervals == null || intervals.length == 0) {
            return null;
        }
        return Arrays.stream(intervals)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(","));
    }

    static int[] decodeIntervals(String value) {
        if (value == null || value.isBlank()) {
            return new int[0];
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .mapToInt(Integer::parseInt)
                .toArray();
    }

    /** "?, ?, ?" for an IN clause */
    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    static int bindUuids(PreparedStatement ps, int startIndex, Collection<UUID> ids) throws SQLException {
        int index = startIndex;
        for (UUID id : ids) {
            ps.setObject(index++, id);
        }
        return index;
    }

    /**
     * Write the changed fields of a context to its row in {@code table}.
     * The row is owned by the caller's lease, so no version check is made.
     */
    static boolean applyContext(Connection conn, String table, ExecutionContext ctx, Instant now)
            throws SQLException {
        Set<ExecutionContext.Field> fields = ctx.changedFields();
        List<String> assignments = new ArrayList<>();
        if (fields.contains(ExecutionContext.Field.STATUS))
            assignments.add("status = ?");
        if (fields.contains(ExecutionContext.Field.EXECUTED_AT))
            assignments.add("executed_at = ?");
        if (fields.contains(ExecutionContext.Field.ELAPSED))
            assignments.add("elapsed_ms = ?");
        if (fields.contains(ExecutionContext.Field.EXCEPTION))
            assignments.add("exception = ?");
        if (fields.contains(ExecutionContext.Field.RETRY_COUNT))
            assignments.add("retry_count = ?");
        if (fields.contains(ExecutionContext.Field.RELEASE_LOCK))
            assignments.add("lock_holder = NULL, locked_at = NULL");
        assignments.add("updated_at = ?");

        String sql = "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (fields.contains(ExecutionContext.Field.STATUS))
                ps.setString(i++, ctx.status().name());
            if (fields.contains(ExecutionContext.Field.EXECUTED_AT))
                setInstant(ps, i++, ctx.executedAt());
            if (fields.contains(ExecutionContext.Field.ELAPSED))
                ps.setLong(i++, ctx.elapsedMs());
            if (fields.contains(ExecutionContext.Field.EXCEPTION))
                ps.setString(i++, ctx.exceptionDetails());
            if (fields.contains(ExecutionContext.Field.RETRY_COUNT))
                ps.setInt(i++, ctx.retryCount());
            setInstant(ps, i++, now);
            ps.setObject(i, ctx.jobId());
            return ps.executeUpdate() > 0;
        }
    }
}
