package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.notify.JobNotification;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.repository.CronJobRepository;
import tempo.scheduler.repository.IntervalJobRepository;
import tempo.scheduler.repository.OccurrenceRepository;
import tempo.scheduler.repository.TimeJobRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists state transitions of execution contexts and notifies the host.
 * Routes each context to the repository of its kind.
 */
public class JobStateManager {

    private static final Logger log = LoggerFactory.getLogger(JobStateManager.class);

    private final TimeJobRepository timeJobs;
    private final CronJobRepository cronJobs;
    private final IntervalJobRepository intervalJobs;
    private final OccurrenceRepository occurrences;
    private final NotificationPublisher notifications;
    private final String nodeId;
    private final Clock clock;

    public JobStateManager(TimeJobRepository timeJobs, CronJobRepository cronJobs,
            IntervalJobRepository intervalJobs, OccurrenceRepository occurrences,
            NotificationPublisher notifications, String nodeId, Clock clock) {
        this.timeJobs = timeJobs;
        this.cronJobs = cronJobs;
        this.intervalJobs = intervalJobs;
        this.occurrences = occurrences;
        this.notifications = notifications;
        this.nodeId = nodeId;
        this.clock = clock;
    }

    public String nodeId() {
        return nodeId;
    }

    /** Move claimed contexts to IN_PROGRESS right before they are handed to workers */
    public void setInProgress(List<ExecutionContext> contexts) {
        Instant now = clock.instant();
        timeJobs.updateStatus(ids(contexts, true), JobStatus.IN_PROGRESS, null, false, now);
        occurrences.markInProgress(ids(contexts, false), now);
        for (ExecutionContext context : contexts) {
            context.status(JobStatus.IN_PROGRESS).resetChanges();
        }
    }

    /** Give queued contexts back: IDLE with the lease cleared */
    public int release(List<ExecutionContext> contexts) {
        if (contexts.isEmpty())
            return 0;
        Instant now = clock.instant();
        int released = timeJobs.release(ids(contexts, true), nodeId, now)
                + occurrences.release(ids(contexts, false), nodeId, now);
        log.debug("Released {} queued units", released);
        return released;
    }

    /** Release everything this node holds: QUEUED to IDLE, IN_PROGRESS to CANCELLED */
    public int releaseAll() {
        Instant now = clock.instant();
        int released = timeJobs.releaseAll(nodeId, now) + occurrences.releaseAll(nodeId, now);
        if (released > 0) {
            log.info("Released {} units held by node {}", released, nodeId);
        }
        return released;
    }

    /** Return every unit held by a crashed node to IDLE */
    public int releaseDeadNode(String deadNodeId) {
        Instant now = clock.instant();
        return timeJobs.releaseNode(deadNodeId, now) + occurrences.releaseNode(deadNodeId, now);
    }

    /**
     * Persist the changed fields of a context and notify the host.
     *
     * @return true if the unit still existed
     */
    public boolean update(ExecutionContext context) {
        if (!context.hasChanges()) {
            return true;
        }
        Instant now = clock.instant();
        boolean updated = context.kind() == JobKind.TIME
                ? timeJobs.applyUpdate(context, now)
                : occurrences.applyUpdate(context, now);
        context.resetChanges();

        if (!updated) {
            log.warn("Job {} ({}) disappeared before its state could be saved", context.jobId(), context.kind());
            return false;
        }

        if (context.kind() == JobKind.INTERVAL && context.status().isSuccess()) {
            Instant executedAt = context.executedAt() != null ? context.executedAt() : now;
            intervalJobs.recordExecution(context.parentId(), executedAt, now);
        }

        notifications.updated(notificationOf(context, now));
        return true;
    }

    /** Bulk-skip one-off children whose run condition did not match */
    public int skip(List<ExecutionContext> contexts, String message) {
        if (contexts.isEmpty())
            return 0;
        Instant now = clock.instant();
        int skipped = timeJobs.updateStatus(ids(contexts, true), JobStatus.SKIPPED, message, true, now);
        for (ExecutionContext context : contexts) {
            context.status(JobStatus.SKIPPED).resetChanges();
            notifications.updated(notificationOf(context, now));
        }
        return skipped;
    }

    /** Payload of the unit, or of the owning definition for occurrences */
    public Optional<byte[]> payload(ExecutionContext context) {
        return switch (context.kind()) {
            case TIME -> timeJobs.findPayload(context.jobId());
            case CRON -> cronJobs.findById(context.parentId()).map(CronJob::payload);
            case INTERVAL -> intervalJobs.findById(context.parentId()).map(IntervalJob::payload);
        };
    }

    private static JobNotification notificationOf(ExecutionContext context, Instant now) {
        UUID definitionId = context.kind() == JobKind.TIME ? null : context.parentId();
        return new JobNotification(context.kind(), context.jobId(), definitionId, context.status(),
                context.executionTime(), now);
    }

    private static List<UUID> ids(Collection<ExecutionContext> contexts, boolean time) {
        return contexts.stream()
                .filter(c -> (c.kind() == JobKind.TIME) == time)
                .map(ExecutionContext::jobId)
                .toList();
    }
}
