package tempo.scheduler.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.RunCondition;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a claimed unit end to end: delegate lookup, retries with backoff,
 * outcome persistence and the child tree.
 *
 * <p>
 * Nothing thrown by job code escapes {@link #execute}; the outcome is the
 * unit's persisted status.
 */
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    static final String RUN_CONDITION_MISMATCH = "Rule RunCondition did not match!";

    private final FunctionRegistry functions;
    private final CancellationRegistry cancellations;
    private final JobStateManager state;
    private final JobExceptionHandler exceptionHandler;
    private final Sleeper sleeper;
    private final Duration defaultRetryInterval;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService childExecutor;

    public ExecutionEngine(FunctionRegistry functions, CancellationRegistry cancellations, JobStateManager state,
            JobExceptionHandler exceptionHandler, Sleeper sleeper, Duration defaultRetryInterval, Clock clock) {
        this.functions = functions;
        this.cancellations = cancellations;
        this.state = state;
        this.exceptionHandler = exceptionHandler != null ? exceptionHandler : JobExceptionHandler.NONE;
        this.sleeper = sleeper;
        this.defaultRetryInterval = defaultRetryInterval;
        this.clock = clock;

        AtomicInteger counter = new AtomicInteger();
        this.childExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tempo-child-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Execute a unit and, for one-off jobs, its children.
     *
     * @param context the claimed unit
     * @param isDue   true when the unit was reclaimed after missing its slot
     */
    public void execute(ExecutionContext context, boolean isDue) {
        List<CompletableFuture<Void>> running = new ArrayList<>();

        // IN_PROGRESS children overlap with the parent
        for (ExecutionContext child : context.children()) {
            if (child.runCondition() == RunCondition.IN_PROGRESS) {
                running.add(CompletableFuture.runAsync(() -> execute(child, isDue), childExecutor));
            }
        }

        JobStatus outcome = runUnit(context, isDue);

        List<ExecutionContext> skipped = new ArrayList<>();
        for (ExecutionContext child : context.children()) {
            if (child.runCondition() == RunCondition.IN_PROGRESS) {
                continue;
            }
            if (child.runCondition().matches(outcome)) {
                running.add(CompletableFuture.runAsync(() -> execute(child, isDue), childExecutor));
            } else {
                skipped.add(child);
            }
        }

        if (!skipped.isEmpty()) {
            try {
                state.skip(ExecutionContexts.flatten(skipped), RUN_CONDITION_MISMATCH);
            } catch (Exception e) {
                log.error("Failed to skip children of job {}", context.jobId(), e);
            }
        }

        CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
    }

    /**
     * Run a single unit through its attempts.
     *
     * @return the terminal status reached
     */
    private JobStatus runUnit(ExecutionContext context, boolean isDue) {
        Optional<RegisteredFunction> function = functions.find(context.functionName());
        boolean child = context.kind() == JobKind.TIME && context.parentId() != null;

        if (function.isEmpty()) {
            String message = "Function '" + context.functionName() + "' is not registered";
            log.warn("{} (job {})", message, context.jobId());
            context.status(child ? JobStatus.SKIPPED : JobStatus.FAILED)
                    .exceptionDetails(child ? message : exceptionJson(message, null))
                    .executedAt(clock.instant())
                    .releasingLock();
            persist(context);
            return context.status();
        }

        CancellationHandle handle = new CancellationHandle();
        cancellations.register(context.jobId(), new CancellationRegistry.Entry(context.functionName(),
                context.kind(), handle, isDue, context.parentId()));
        try {
            if (child) {
                context.status(JobStatus.IN_PROGRESS);
                persist(context);
            }

            JobContext jobContext = new JobContext(context, isDue, handle, cancellations,
                    () -> state.payload(context));
            long started = System.nanoTime();
            context.executedAt(clock.instant());

            attempts(context, function.get(), jobContext, handle, isDue);

            context.elapsedMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            context.releasingLock();
            persist(context);
            log.debug("Job {} ({}) finished as {}", context.jobId(), context.functionName(), context.status());
            return context.status();
        } finally {
            cancellations.remove(context.jobId());
        }
    }

    private void attempts(ExecutionContext context, RegisteredFunction function, JobContext jobContext,
            CancellationHandle handle, boolean isDue) {
        for (int attempt = context.retryCount();; attempt++) {
            handle.bind();
            try {
                if (attempt > 0) {
                    context.retryCount(attempt);
                    persist(context);
                    sleeper.sleep(backoff(context, attempt));
                }
                handle.throwIfCancelled();

                function.function().execute(jobContext);
                // the job may have cancelled itself
                handle.throwIfCancelled();

                context.status(isDue ? JobStatus.DUE_DONE : JobStatus.DONE);
                return;
            } catch (TerminateExecutionException e) {
                context.status(e.status()).exceptionDetails(e.detail());
                return;
            } catch (CancellationException e) {
                cancelled(context, e);
                return;
            } catch (Throwable e) {
                if (handle.isCancelled()) {
                    cancelled(context, new CancellationException("Job was cancelled"));
                    return;
                }
                if (attempt >= context.retries()) {
                    log.warn("Job {} ({}) failed after {} retries: {}", context.jobId(), context.functionName(),
                            context.retries(), e.getMessage());
                    context.status(JobStatus.FAILED).exceptionDetails(exceptionJson(e));
                    handleQuietly(() -> exceptionHandler.onException(e, context.jobId(), context.kind()));
                    return;
                }
                log.debug("Job {} attempt {} failed, retrying: {}", context.jobId(), attempt, e.getMessage());
            } finally {
                handle.unbind();
            }
        }
    }

    private void cancelled(ExecutionContext context, CancellationException e) {
        context.status(JobStatus.CANCELLED).exceptionDetails(e.getMessage());
        handleQuietly(() -> exceptionHandler.onCancelled(e, context.jobId(), context.kind()));
    }

    /** Backoff before {@code attempt}: the configured list, clamped to its last entry */
    Duration backoff(ExecutionContext context, int attempt) {
        int[] intervals = context.retryIntervals();
        if (intervals.length == 0) {
            return defaultRetryInterval;
        }
        return Duration.ofSeconds(intervals[Math.min(attempt - 1, intervals.length - 1)]);
    }

    private void persist(ExecutionContext context) {
        try {
            state.update(context);
        } catch (Exception e) {
            log.error("Failed to persist state of job {}", context.jobId(), e);
        }
    }

    private void handleQuietly(Runnable hook) {
        try {
            hook.run();
        } catch (Exception e) {
            log.warn("Job exception handler failed: {}", e.getMessage(), e);
        }
    }

    /** {"message": top-level message, "stackTrace": first frame of the root cause} */
    String exceptionJson(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        StackTraceElement[] frames = root.getStackTrace();
        return exceptionJson(message, frames.length > 0 ? frames[0].toString() : null);
    }

    private String exceptionJson(String message, String stackTrace) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("message", message);
        details.put("stackTrace", stackTrace);
        try {
            return mapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            return message;
        }
    }

    @Override
    public void close() {
        childExecutor.shutdownNow();
    }
}
