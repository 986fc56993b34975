package tempo.scheduler.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Recurring definition driven by a cron expression. It never executes by
 * itself: each firing is materialized as an {@link Occurrence}.
 */
public final class CronJob {
    private final UUID id;
    private final String function;
    private final String description;
    private final String expression;
    private final byte[] payload;
    private final int retries;
    private final int[] retryIntervals;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CronJob(Builder builder) {
        this.id = builder.id;
        this.function = Objects.requireNonNull(builder.function, "function is required");
        this.description = builder.description;
        this.expression = Objects.requireNonNull(builder.expression, "expression is required");
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

    public String expression() {
        return expression;
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

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .function(function)
                .description(description)
                .expression(expression)
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
        private String expression;
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

        public Builder expression(String expression) {
            this.expression = expression;
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

        public CronJob build() {
            return new CronJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CronJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CronJob{id=" + id + ", function='" + function + "', expression='" + expression + "'}";
    }
}
