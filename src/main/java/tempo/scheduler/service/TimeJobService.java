package tempo.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.core.CancellationRegistry;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.RunCondition;
import tempo.scheduler.model.TimeJob;
import tempo.scheduler.notify.JobNotification;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.repository.TimeJobRepository;
import tempo.scheduler.scheduler.SchedulerLoop;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Management of one-off jobs and their child trees.
 */
public class TimeJobService {

    private static final Logger log = LoggerFactory.getLogger(TimeJobService.class);

    private final TimeJobRepository repository;
    private final FunctionRegistry functions;
    private final CancellationRegistry cancellations;
    private final NotificationPublisher notifications;
    private final SchedulerLoop loop;
    private final Clock clock;

    public TimeJobService(TimeJobRepository repository, FunctionRegistry functions,
            CancellationRegistry cancellations, NotificationPublisher notifications, SchedulerLoop loop,
            Clock clock) {
        this.repository = repository;
        this.functions = functions;
        this.cancellations = cancellations;
        this.notifications = notifications;
        this.loop = loop;
        this.clock = clock;
    }

    /**
     * Schedule a job tree.
     *
     * <p>
     * Ids are assigned where missing, every node starts IDLE, and children
     * without a run condition run after any completed parent status.
     *
     * @param job root of the tree; must carry an execution time
     * @return the stored tree
     * @throws JobValidationException if a function is unknown or the root has no execution time
     */
    public TimeJob schedule(TimeJob job) {
        if (job.executionTime() == null) {
            throw new JobValidationException("Execution time is required for job '" + job.function() + "'");
        }
        validateFunctions(job);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        TimeJob stored = stamp(job, null, now);
        repository.save(stored);

        log.info("Scheduled time job {} ({}) at {}", stored.id(), stored.function(), stored.executionTime());
        notifications.added(JobNotification.of(stored));
        loop.restartIfNeeded(stored.executionTime());
        return stored;
    }

    /**
     * Change function, description, payload, execution time or retry settings
     * of a job that is not running.
     */
    public TimeJob update(TimeJob job) {
        if (job.id() == null) {
            throw new JobValidationException("Job id is required");
        }
        TimeJob existing = repository.findById(job.id())
                .orElseThrow(() -> new JobValidationException("Unknown time job: " + job.id()));
        if (existing.status() == JobStatus.IN_PROGRESS) {
            throw new JobValidationException("Time job " + job.id() + " is running");
        }
        if (existing.isRoot() && job.executionTime() == null) {
            throw new JobValidationException("Execution time is required for job '" + job.function() + "'");
        }
        validateFunction(job.function());

        TimeJob updated = existing.toBuilder()
                .function(job.function())
                .description(job.description())
                .payload(job.payload())
                .executionTime(existing.isRoot() ? job.executionTime() : null)
                .retries(job.retries())
                .retryIntervals(job.retryIntervals())
                .updatedAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                .build();
        if (!repository.update(updated)) {
            throw new JobValidationException("Unknown time job: " + job.id());
        }

        notifications.updated(JobNotification.of(updated));
        if (updated.executionTime() != null) {
            loop.restartIfNeeded(updated.executionTime());
        }
        return updated;
    }

    /**
     * Delete a job and its descendants, cancelling any of them that is running.
     */
    public boolean delete(UUID id) {
        Optional<TimeJob> existing = repository.findById(id);
        if (existing.isEmpty()) {
            return false;
        }

        for (UUID running : treeIds(existing.get())) {
            cancellations.cancel(running);
        }
        boolean deleted = repository.delete(id);
        if (deleted) {
            log.info("Deleted time job {}", id);
            notifications.removed(JobNotification.of(existing.get()));
            loop.restart();
        }
        return deleted;
    }

    /** Request cancellation of a running job; false if it is not running on this node */
    public boolean cancel(UUID id) {
        return cancellations.cancel(id);
    }

    public Optional<TimeJob> find(UUID id) {
        return repository.findById(id);
    }

    public List<TimeJob> list(int limit) {
        return repository.findRoots(limit);
    }

    private void validateFunctions(TimeJob job) {
        validateFunction(job.function());
        for (TimeJob child : job.children()) {
            validateFunctions(child);
        }
    }

    private void validateFunction(String function) {
        if (function == null || !functions.contains(function)) {
            throw new JobValidationException("Function '" + function + "' is not registered");
        }
    }

    private static TimeJob stamp(TimeJob job, UUID parentId, Instant now) {
        UUID id = job.id() != null ? job.id() : UUID.randomUUID();
        List<TimeJob> children = new ArrayList<>();
        for (TimeJob child : job.children()) {
            children.add(stamp(child, id, now));
        }

        TimeJob.Builder builder = job.toBuilder()
                .id(id)
                .parentId(parentId)
                .status(JobStatus.IDLE)
                .lockHolder(null)
                .lockedAt(null)
                .retryCount(0)
                .children(children)
                .createdAt(now)
                .updatedAt(now);
        if (parentId != null) {
            builder.executionTime(null)
                    .runCondition(job.runCondition() != null ? job.runCondition()
                            : RunCondition.ON_ANY_COMPLETED_STATUS);
        } else {
            builder.runCondition(null);
        }
        return builder.build();
    }

    private static List<UUID> treeIds(TimeJob job) {
        List<UUID> ids = new ArrayList<>();
        ids.add(job.id());
        for (TimeJob child : job.children()) {
            ids.addAll(treeIds(child));
        }
        return ids;
    }
}
