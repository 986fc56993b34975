package tempo.scheduler.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable one-off job. A root job has an execution time; children have none
 * and run after (or alongside) their parent according to their run condition.
 */
public final class TimeJob implements Leased {
    private final UUID id;
    private final String function;
    private final String description;
    private final byte[] payload;
    private final Instant executionTime;
    private final JobStatus status;
    private final String lockHolder;
    private final Instant lockedAt;
    private final Instant executedAt;
    private final Long elapsedMs;
    private final String exception;
    private final int retries;
    private final int retryCount;
    private final int[] retryIntervals; // seconds
    private final UUID parentId;
    private final RunCondition runCondition;
    private final List<TimeJob> children;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TimeJob(Builder builder) {
        this.id = builder.id;
        this.function = Objects.requireNonNull(builder.function, "function is required");
        this.description = builder.description;
        this.payload = builder.payload;
        this.executionTime = builder.executionTime;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.lockHolder = builder.lockHolder;
        this.lockedAt = builder.lockedAt;
        this.executedAt = builder.executedAt;
        this.elapsedMs = builder.elapsedMs;
        this.exception = builder.exception;
        this.retries = builder.retries;
        this.retryCount = builder.retryCount;
        this.retryIntervals = builder.retryIntervals.clone();
        this.parentId = builder.parentId;
        this.runCondition = builder.runCondition;
        this.children = List.copyOf(builder.children);
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    @Override
    public UUID id() {
        return id;
    }

    public String function() {
        return function;
    }

    public String description() {
        return description;
    }

    public byte[] payload() {
        return payload;
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

    public int retries() {
        return retries;
    }

    public int retryCount() {
        return retryCount;
    }

    public int[] retryIntervals() {
        return retryIntervals.clone();
    }

    public UUID parentId() {
        return parentId;
    }

    public RunCondition runCondition() {
        return runCondition;
    }

    public List<TimeJob> children() {
        return children;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if this job is the root of a tree */
    public boolean isRoot() {
        return parentId == null;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .function(function)
                .description(description)
                .payload(payload)
                .executionTime(executionTime)
                .status(status)
                .lockHolder(lockHolder)
                .lockedAt(lockedAt)
                .executedAt(executedAt)
                .elapsedMs(elapsedMs)
                .exception(exception)
                .retries(retries)
                .retryCount(retryCount)
                .retryIntervals(retryIntervals)
                .parentId(parentId)
                .runCondition(runCondition)
                .children(children)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private String function;
        private String description;
        private byte[] payload;
        private Instant executionTime;
        private JobStatus status = JobStatus.IDLE;
        private String lockHolder;
        private Instant lockedAt;
        private Instant executedAt;
        private Long elapsedMs;
        private String exception;
        private int retries = 0;
        private int retryCount = 0;
        private int[] retryIntervals = new int[0];
        private UUID parentId;
        private RunCondition runCondition;
        private List<TimeJob> children = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
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

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder retryIntervals(int... retryIntervals) {
            this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals.clone();
            return this;
        }

        public Builder parentId(UUID parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder runCondition(RunCondition runCondition) {
            this.runCondition = runCondition;
            return this;
        }

        public Builder children(List<TimeJob> children) {
            this.children = new ArrayList<>(children);
            return this;
        }

        public Builder child(TimeJob child) {
            this.children.add(child);
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

        public TimeJob build() {
            return new TimeJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TimeJob{id=" + id + ", function='" + function + "', status=" + status
                + ", executionTime=" + executionTime + ", retryIntervals=" + Arrays.toString(retryIntervals) + "}";
    }
}
