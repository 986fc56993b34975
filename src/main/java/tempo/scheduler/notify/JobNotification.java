package tempo.scheduler.notify;

import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.model.TimeJob;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a unit sent to the {@link NotificationSender}.
 *
 * @param definitionId owning cron/interval definition, null for time jobs
 */
public record JobNotification(
        JobKind kind,
        UUID id,
        UUID definitionId,
        JobStatus status,
        Instant executionTime,
        Instant updatedAt) {

    public static JobNotification of(TimeJob job) {
        return new JobNotification(JobKind.TIME, job.id(), null, job.status(), job.executionTime(),
                job.updatedAt());
    }

    public static JobNotification of(Occurrence occurrence) {
        return new JobNotification(occurrence.kind(), occurrence.id(), occurrence.definitionId(),
                occurrence.status(), occurrence.executionTime(), occurrence.updatedAt());
    }
}
