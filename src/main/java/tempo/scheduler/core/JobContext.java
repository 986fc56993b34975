package tempo.scheduler.core;

import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * What a running {@link JobFunction} sees of its unit.
 */
public final class JobContext {

    private final ExecutionContext execution;
    private final boolean due;
    private final CancellationHandle cancellation;
    private final CancellationRegistry registry;
    private final Supplier<Optional<byte[]>> payloadLoader;

    private byte[] payload;
    private boolean payloadLoaded;

    JobContext(ExecutionContext execution, boolean due, CancellationHandle cancellation,
            CancellationRegistry registry, Supplier<Optional<byte[]>> payloadLoader) {
        this.execution = execution;
        this.due = due;
        this.cancellation = cancellation;
        this.registry = registry;
        this.payloadLoader = payloadLoader;
    }

    public UUID id() {
        return execution.jobId();
    }

    public String functionName() {
        return execution.functionName();
    }

    public JobKind kind() {
        return execution.kind();
    }

    /** True when the unit was reclaimed after missing its slot */
    public boolean isDue() {
        return due;
    }

    public Instant scheduledFor() {
        return execution.executionTime();
    }

    public int retryCount() {
        return execution.retryCount();
    }

    public CancellationHandle cancellation() {
        return cancellation;
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancelled();
    }

    /** Opaque payload bytes, loaded on first access. Null when the unit has none. */
    public synchronized byte[] payload() {
        if (!payloadLoaded) {
            payload = payloadLoader.get().orElse(null);
            payloadLoaded = true;
        }
        return payload;
    }

    public String payloadAsString() {
        byte[] bytes = payload();
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    public void requestCancel() {
        cancellation.cancel();
    }

    /**
     * Stop this run as SKIPPED when another occurrence of the same definition
     * is already running on this node. Has no effect for one-off jobs.
     */
    public void skipIfAlreadyRunning() {
        if (execution.kind() == JobKind.TIME) {
            return;
        }
        if (registry.isParentRunningExcludingSelf(execution.parentId(), execution.jobId())) {
            throw new TerminateExecutionException(
                    "Another occurrence of " + execution.functionName() + " is already running", JobStatus.SKIPPED);
        }
    }
}
