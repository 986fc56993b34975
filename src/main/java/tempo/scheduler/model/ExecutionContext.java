package tempo.scheduler.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable, in-flight view of a claimed unit. Setters for persisted state
 * record the field as changed so that updates write only what moved.
 */
public final class ExecutionContext {

    /** Persisted fields an update may carry */
    public enum Field {
        STATUS,
        EXECUTED_AT,
        ELAPSED,
        EXCEPTION,
        RETRY_COUNT,
        RELEASE_LOCK
    }

    private final UUID jobId;
    private final JobKind kind;
    private final String functionName;
    private final UUID parentId;
    private final Instant executionTime;
    private final int retries;
    private final int[] retryIntervals;
    private final RunCondition runCondition;
    private final List<ExecutionContext> children = new ArrayList<>();
    private final Set<Field> changed = EnumSet.noneOf(Field.class);

    private JobPriority priority = JobPriority.NORMAL;
    private JobStatus status;
    private int retryCount;
    private Instant executedAt;
    private long elapsedMs;
    private String exceptionDetails;

    /**
     * @param jobId         id of the time job or occurrence
     * @param kind          schedule kind
     * @param functionName  registered function to run
     * @param parentId      parent job for children, definition id for occurrences
     * @param executionTime scheduled instant, null for children
     * @param retries       maximum retries
     * @param retryCount    retries already spent
     * @param retryIntervals backoff in seconds
     * @param runCondition  gating rule for children, null for roots
     * @param status        status as read from the store
     */
    public ExecutionContext(UUID jobId, JobKind kind, String functionName, UUID parentId,
            Instant executionTime, int retries, int retryCount, int[] retryIntervals,
            RunCondition runCondition, JobStatus status) {
        this.jobId = jobId;
        this.kind = kind;
        this.functionName = functionName;
        this.parentId = parentId;
        this.executionTime = executionTime;
        this.retries = Math.max(0, retries);
        this.retryCount = Math.min(Math.max(0, retryCount), this.retries);
        this.retryIntervals = retryIntervals == null ? new int[0] : retryIntervals.clone();
        this.runCondition = runCondition;
        this.status = status;
    }

    public UUID jobId() {
        return jobId;
    }

    public JobKind kind() {
        return kind;
    }

    public String functionName() {
        return functionName;
    }

    public UUID parentId() {
        return parentId;
    }

    public Instant executionTime() {
        return executionTime;
    }

    public int retries() {
        return retries;
    }

    public int[] retryIntervals() {
        return retryIntervals.clone();
    }

    public RunCondition runCondition() {
        return runCondition == null ? RunCondition.ON_ANY_COMPLETED_STATUS : runCondition;
    }

    public List<ExecutionContext> children() {
        return Collections.unmodifiableList(children);
    }

    public ExecutionContext addChild(ExecutionContext child) {
        children.add(child);
        return this;
    }

    public JobPriority priority() {
        return priority;
    }

    public ExecutionContext priority(JobPriority priority) {
        this.priority = priority;
        return this;
    }

    public JobStatus status() {
        return status;
    }

    public int retryCount() {
        return retryCount;
    }

    public Instant executedAt() {
        return executedAt;
    }

    public long elapsedMs() {
        return elapsedMs;
    }

    public String exceptionDetails() {
        return exceptionDetails;
    }

    public boolean releaseLock() {
        return changed.contains(Field.RELEASE_LOCK);
    }

    public ExecutionContext status(JobStatus status) {
        this.status = status;
        changed.add(Field.STATUS);
        return this;
    }

    public ExecutionContext retryCount(int retryCount) {
        this.retryCount = retryCount;
        changed.add(Field.RETRY_COUNT);
        return this;
    }

    public ExecutionContext executedAt(Instant executedAt) {
        this.executedAt = executedAt;
        changed.add(Field.EXECUTED_AT);
        return this;
    }

    public ExecutionContext elapsedMs(long elapsedMs) {
        this.elapsedMs = elapsedMs;
        changed.add(Field.ELAPSED);
        return this;
    }

    public ExecutionContext exceptionDetails(String exceptionDetails) {
        this.exceptionDetails = exceptionDetails;
        changed.add(Field.EXCEPTION);
        return this;
    }

    /** Mark the lease for clearing on the next update */
    public ExecutionContext releasingLock() {
        changed.add(Field.RELEASE_LOCK);
        return this;
    }

    public Set<Field> changedFields() {
        return Collections.unmodifiableSet(EnumSet.copyOf(changed));
    }

    public boolean hasChanges() {
        return !changed.isEmpty();
    }

    public ExecutionContext resetChanges() {
        changed.clear();
        return this;
    }

    @Override
    public String toString() {
        return "ExecutionContext{jobId=" + jobId + ", kind=" + kind + ", function='" + functionName
                + "', status=" + status + ", retryCount=" + retryCount + "}";
    }
}
