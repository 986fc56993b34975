package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.model.TimeJob;
import tempo.scheduler.notify.JobNotification;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.repository.CronJobRepository;
import tempo.scheduler.repository.IntervalJobRepository;
import tempo.scheduler.repository.OccurrenceRepository;
import tempo.scheduler.repository.TimeJobRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Recovers units that missed their slot.
 *
 * Units can be left pending past their execution time if:
 * - the node that queued them crashed or was stopped
 * - the polling loop was busy or asleep when they became due
 *
 * The reclaimer finds IDLE/QUEUED units due more than the grace window ago
 * and forces them to IN_PROGRESS under this node's lease, whoever held them.
 * Reclaimed units run as due, so success is recorded as DUE_DONE.
 */
public class TimeoutReclaimer {

    private static final Logger log = LoggerFactory.getLogger(TimeoutReclaimer.class);

    private final TimeJobRepository timeJobs;
    private final CronJobRepository cronJobs;
    private final IntervalJobRepository intervalJobs;
    private final OccurrenceRepository occurrences;
    private final ExecutionContexts contexts;
    private final NotificationPublisher notifications;
    private final String nodeId;
    private final Duration grace;
    private final Clock clock;

    public TimeoutReclaimer(TimeJobRepository timeJobs, CronJobRepository cronJobs,
            IntervalJobRepository intervalJobs, OccurrenceRepository occurrences, ExecutionContexts contexts,
            NotificationPublisher notifications, String nodeId, Duration grace, Clock clock) {
        this.timeJobs = timeJobs;
        this.cronJobs = cronJobs;
        this.intervalJobs = intervalJobs;
        this.occurrences = occurrences;
        this.contexts = contexts;
        this.notifications = notifications;
        this.nodeId = nodeId;
        this.grace = grace;
        this.clock = clock;
    }

    /**
     * Find and claim timed-out units.
     *
     * @return contexts now IN_PROGRESS under this node
     */
    public List<ExecutionContext> sweepTimedOut() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(grace);

        List<ExecutionContext> reclaimed = new ArrayList<>();

        for (TimeJob job : timeJobs.findTimedOut(cutoff)) {
            Optional<TimeJob> claimed = timeJobs.tryReclaim(job, nodeId, now);
            if (claimed.isPresent()) {
                notifications.updated(JobNotification.of(claimed.get()));
                reclaimed.add(contexts.of(claimed.get()));
                log.info("Reclaimed time job {} ({}) due at {}", job.id(), job.function(), job.executionTime());
            }
        }

        List<Occurrence> cron = occurrences.findTimedOut(JobKind.CRON, cutoff);
        if (!cron.isEmpty()) {
            Map<UUID, CronJob> definitions = cronJobs.findByIds(definitionIds(cron)).stream()
                    .collect(Collectors.toMap(CronJob::id, Function.identity()));
            for (Occurrence occurrence : cron) {
                CronJob definition = definitions.get(occurrence.definitionId());
                if (definition != null) {
                    reclaim(occurrence, o -> contexts.of(o, definition), now).ifPresent(reclaimed::add);
                }
            }
        }

        List<Occurrence> interval = occurrences.findTimedOut(JobKind.INTERVAL, cutoff);
        if (!interval.isEmpty()) {
            Map<UUID, IntervalJob> definitions = intervalJobs.findByIds(definitionIds(interval)).stream()
                    .collect(Collectors.toMap(IntervalJob::id, Function.identity()));
            for (Occurrence occurrence : interval) {
                IntervalJob definition = definitions.get(occurrence.definitionId());
                if (definition != null) {
                    reclaim(occurrence, o -> contexts.of(o, definition), now).ifPresent(reclaimed::add);
                }
            }
        }

        if (!reclaimed.isEmpty()) {
            log.info("Timeout reclaimer: {} units reclaimed by node {}", reclaimed.size(), nodeId);
        }
        return reclaimed;
    }

    private Optional<ExecutionContext> reclaim(Occurrence occurrence,
            Function<Occurrence, ExecutionContext> toContext, Instant now) {
        Optional<Occurrence> claimed = occurrences.tryReclaim(occurrence, nodeId, now);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        notifications.updated(JobNotification.of(claimed.get()));
        log.info("Reclaimed {} occurrence {} due at {}", occurrence.kind(), occurrence.id(),
                occurrence.executionTime());
        return Optional.of(toContext.apply(claimed.get()));
    }

    private static List<UUID> definitionIds(List<Occurrence> occurrences) {
        return occurrences.stream().map(Occurrence::definitionId).distinct().toList();
    }
}
