package tempo.scheduler.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single materialized firing of a cron or interval definition.
 * Its execution time never changes once created.
 */
public final class Occurrence implements Leased {
    private final UUID id;
    private final JobKind kind;
    private final UUID definitionId;
    private final Instant executionTime;
    private final JobStatus status;
    private final String lockHolder;
    private final Instant lockedAt;
    private final Instant executedAt;
    private final Long elapsedMs;
    private final String exception;
    private final int retryCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Occurrence(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        if (kind == JobKind.TIME) {
            throw new IllegalArgumentException("Occurrences belong to cron or interval definitions");
        }
        this.definitionId = Objects.requireNonNull(builder.definitionId, "definitionId is required");
        this.executionTime = Objects.requireNonNull(builder.executionTime, "executionTime is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lockHolder = builder.lockHolder;
        this.lockedAt = builder.lockedAt;
        this.executedAt = builder.executedAt;
        this.elapsedMs = builder.elapsedMs;
        this.exception = builder.exception;
        this.retryCount = builder.retryCount;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    @Override
    public UUID id() {
        return id;
    }

    public JobKind kind() {
        return kind;
    }

    public UUID definitionId() {
        return definitionId;
    }

    public Instant executionTime() {
        return executionTime;
    }

    @Override
    public JobStatus status() {
        return status;
    }

    @Override
    public String lockHolder() {
        return lockHolder;
    }

    @Override
    public Instant lockedAt() {
        return lockedAt;
    }

    public Instant executedAt() {
        return executedAt;
    }

    public Long elapsedMs() {
        return elapsedMs;
    }

    public String exception() {
        return exception;
    }

    public int retryCount() {
        return retryCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public Instant updatedAt() {
        return updatedAt;
    }

    /** An occurrence that has never been written since its insert */
    public boolean isFresh() {
        return createdAt != null && createdAt.equals(updatedAt);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .kind(kind)
                .definitionId(definitionId)
                .executionTime(executionTime)
                .status(status)
                .lockHolder(lockHolder)
                .lockedAt(lockedAt)
                .executedAt(executedAt)
                .elapsedMs(elapsedMs)
                .exception(exception)
                .retryCount(retryCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private JobKind kind;
        private UUID definitionId;
        private Instant executionTime;
        private JobStatus status = JobStatus.IDLE;
        private String lockHolder;
        private Instant lockedAt;
        private Instant executedAt;
        private Long elapsedMs;
        private String exception;
        private int retryCount;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder kind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder definitionId(UUID definitionId) {
            this.definitionId = definitionId;
            return this;
        }

        public Builder executionTime(Instant executionTime) {
            this.executionTime = executionTime;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder lockHolder(String lockHolder) {
            this.lockHolder = lockHolder;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Builder executedAt(Instant executedAt) {
            this.executedAt = executedAt;
            return this;
        }

        public Builder elapsedMs(Long elapsedMs) {
            this.elapsedMs = elapsedMs;
            return this;
        }

        public Builder exception(String exception) {
            this.exception = exception;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Occurrence build() {
            return new Occurrence(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Occurrence that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Occurrence{id=" + id + ", kind=" + kind + ", definitionId=" + definitionId
                + ", executionTime=" + executionTime + ", status=" + status + "}";
    }
}
