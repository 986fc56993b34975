package tempo.scheduler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Recurring definition that fires every {@code interval}, optionally bounded
 * by a start/end window. Firings are materialized as {@link Occurrence}s.
 */
public final class IntervalJob {
    private final UUID id;
    private final String function;
    private final String description;
    private final Duration interval;
    private final Instant startTime;
    private final Instant endTime;
    private final boolean active;
    private final Instant lastExecutedAt;
    private final long executionCount;
    private final byte[] payload;
    private final int retries;
    private final int[] retryIntervals;
    private final Instant createdAt;
    private final Instant updatedAt;

    private IntervalJob(Builder builder) {
        this.id = builder.id;
        this.function = Objects.requireNonNull(builder.function, "function is required");
        this.description = builder.description;
        this.interval = Objects.requireNonNull(builder.interval, "interval is required");
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.active = builder.active;
        this.lastExecutedAt = builder.lastExecutedAt;
        this.executionCount = builder.executionCount;
        this.payload = builder.payload;
        this.retries = builder.retries;
        this.retryIntervals = builder.retryIntervals.clone();
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public UUID id() {
        return id;
    }

    public String function() {
        return function;
    }

    public String description() {
        return description;
    }

    public Duration interval() {
        return interval;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public boolean active() {
        return active;
    }

    public Instant lastExecutedAt() {
        return lastExecutedAt;
    }

    public long executionCount() {
        return executionCount;
    }

    public byte[] payload() {
        return payload;
    }

    public int retries() {
        return retries;
    }

    public int[] retryIntervals() {
        return retryIntervals.clone();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if the definition may fire at the given instant */
    public boolean isWithinWindow(Instant at) {
        return (startTime == null || !at.isBefore(startTime))
                && (endTime == null || !at.isAfter(endTime));
    }

    /**
     * Next firing instant.
     *
     * @param now              current time
     * @param lastMaterialized execution time of the latest stored occurrence, or null
     * @return next firing, empty when inactive or past the end of the window
     */
    public Optional<Instant> nextExecution(Instant now, Instant lastMaterialized) {
        if (!active) {
            return Optional.empty();
        }

        Instant next;
        if (startTime != null && startTime.isAfter(now)) {
            next = startTime;
        } else {
            Instant base = latest(lastExecutedAt, lastMaterialized);
            if (base == null) {
                next = startTime != null ? startTime : now;
            } else {
                next = base.plus(interval);
                if (!next.isAfter(now)) {
                    long passed = Duration.between(base, now).toNanos() / interval.toNanos();
                    next = base.plus(interval.multipliedBy(passed + 1));
                }
            }
        }

        if (endTime != null && next.isAfter(endTime)) {
            return Optional.empty();
        }
        return Optional.of(next);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.isAfter(b) ? a : b;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .function(function)
                .description(description)
                .interval(interval)
                .startTime(startTime)
                .endTime(endTime)
                .active(active)
                .lastExecutedAt(lastExecutedAt)
                .executionCount(executionCount)
                .payload(payload)
                .retries(retries)
                .retryIntervals(retryIntervals)
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
        private Duration interval;
        private Instant startTime;
        private Instant endTime;
        private boolean active = true;
        private Instant lastExecutedAt;
        private long executionCount = 0;
        private byte[] payload;
        private int retries = 0;
        private int[] retryIntervals = new int[0];
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

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder lastExecutedAt(Instant lastExecutedAt) {
            this.lastExecutedAt = lastExecutedAt;
            return this;
        }

        public Builder executionCount(long executionCount) {
            this.executionCount = executionCount;
            return this;
        }

        public Builder payload(byte[] payload) {
            this.payload = payload;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryIntervals(int... retryIntervals) {
            this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals.clone();
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

        public IntervalJob build() {
            return new IntervalJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IntervalJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "IntervalJob{id=" + id + ", function='" + function + "', interval=" + interval
                + ", active=" + active + "}";
    }
}
