package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.cron.CronOccurrenceCache;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Decides what runs next across one-off, cron and interval jobs, and claims it.
 *
 * <p>
 * Each kind reports its earliest pending instant. Every kind whose earliest
 * instant falls in the same whole second as the global minimum joins the batch,
 * and the batch is claimed optimistically. Cron and interval firings that have
 * not been materialized yet are inserted as QUEUED occurrences.
 */
public class OccurrenceResolver {

    private static final Logger log = LoggerFactory.getLogger(OccurrenceResolver.class);

    static final Duration LOST_RACE_RETRY = Duration.ofMillis(10);

    /**
     * Outcome of one resolution pass.
     *
     * @param timeRemaining time until the batch is due, null when nothing is pending
     * @param due           contexts claimed by this pass
     */
    public record NextRun(Duration timeRemaining, List<ExecutionContext> due) {

        public static NextRun infinite() {
            return new NextRun(null, List.of());
        }

        public boolean isInfinite() {
            return timeRemaining == null;
        }
    }

    /** A definition firing not yet materialized */
    private record Computed(UUID definitionId, Instant at) {
    }

    /** Earliest pending work of one recurring kind */
    private record Pending(JobKind kind, Instant at, List<Occurrence> stored, List<Computed> computed,
            Map<UUID, Function<Occurrence, ExecutionContext>> definitions) {

        Instant second() {
            return at.truncatedTo(ChronoUnit.SECONDS);
        }
    }

    private final TimeJobRepository timeJobs;
    private final CronJobRepository cronJobs;
    private final IntervalJobRepository intervalJobs;
    private final OccurrenceRepository occurrences;
    private final CronOccurrenceCache cronCache;
    private final ExecutionContexts contexts;
    private final NotificationPublisher notifications;
    private final String nodeId;
    private final Clock clock;
    private final Executor executor;

    public OccurrenceResolver(TimeJobRepository timeJobs, CronJobRepository cronJobs,
            IntervalJobRepository intervalJobs, OccurrenceRepository occurrences, CronOccurrenceCache cronCache,
            ExecutionContexts contexts, NotificationPublisher notifications, String nodeId, Clock clock,
            Executor executor) {
        this.timeJobs = timeJobs;
        this.cronJobs = cronJobs;
        this.intervalJobs = intervalJobs;
        this.occurrences = occurrences;
        this.cronCache = cronCache;
        this.contexts = contexts;
        this.notifications = notifications;
        this.nodeId = nodeId;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Find the earliest pending work of every kind and claim the batch due first.
     */
    public NextRun resolveNext() {
        Instant now = clock.instant();
        Instant second = now.truncatedTo(ChronoUnit.SECONDS);

        CompletableFuture<Optional<Instant>> timeFuture = CompletableFuture
                .supplyAsync(() -> timeJobs.findEarliestExecutionTime(nodeId, second), executor);
        CompletableFuture<Optional<Pending>> cronFuture = CompletableFuture
                .supplyAsync(() -> earliestCron(now, second), executor);
        CompletableFuture<Optional<Pending>> intervalFuture = CompletableFuture
                .supplyAsync(() -> earliestInterval(now, second), executor);

        Optional<Instant> time;
        Optional<Pending> cron;
        Optional<Pending> interval;
        try {
            time = timeFuture.join();
            cron = cronFuture.join();
            interval = intervalFuture.join();
        } catch (CompletionException e) {
            throw e.getCause() instanceof RuntimeException re ? re : e;
        }

        Instant earliest = min(time.orElse(null), cron.map(Pending::at).orElse(null),
                interval.map(Pending::at).orElse(null));
        if (earliest == null) {
            return NextRun.infinite();
        }
        Instant batchSecond = earliest.truncatedTo(ChronoUnit.SECONDS);

        List<ExecutionContext> claimed = new ArrayList<>();
        if (time.isPresent() && time.get().truncatedTo(ChronoUnit.SECONDS).equals(batchSecond)) {
            claimed.addAll(claimTimeJobs(batchSecond, now));
        }
        if (cron.isPresent() && cron.get().second().equals(batchSecond)) {
            claimed.addAll(claimOccurrences(cron.get(), now));
        }
        if (interval.isPresent() && interval.get().second().equals(batchSecond)) {
            claimed.addAll(claimOccurrences(interval.get(), now));
        }

        if (claimed.isEmpty()) {
            log.debug("Every claim for {} was lost, retrying shortly", batchSecond);
            return new NextRun(LOST_RACE_RETRY, List.of());
        }

        Duration remaining = Duration.between(now, earliest);
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        log.debug("Claimed {} units due at {}", claimed.size(), earliest);
        return new NextRun(remaining, List.copyOf(claimed));
    }

    // ---------- earliest per kind ----------

    private Optional<Pending> earliestCron(Instant now, Instant second) {
        List<Occurrence> stored = occurrences.findEarliestClaimable(JobKind.CRON, nodeId, second);
        List<CronJob> definitions = cronJobs.findAll();

        Map<UUID, Function<Occurrence, ExecutionContext>> byId = new HashMap<>();
        definitions.forEach(d -> byId.put(d.id(), o -> contexts.of(o, d)));

        Map<UUID, Instant> candidates = new HashMap<>();
        for (CronJob definition : definitions) {
            cronCache.nextOccurrence(definition.expression(), now)
                    .ifPresent(next -> candidates.put(definition.id(), next));
        }

        List<Occurrence> usable = withDefinitions(stored, byId,
                id -> cronJobs.findById(id).map(d -> o -> contexts.of(o, d)));
        return pending(JobKind.CRON, usable, candidates, byId);
    }

    private Optional<Pending> earliestInterval(Instant now, Instant second) {
        List<Occurrence> stored = occurrences.findEarliestClaimable(JobKind.INTERVAL, nodeId, second);
        List<IntervalJob> definitions = intervalJobs.findActive(now);
        Map<UUID, Instant> latest = occurrences.findLatestExecutionTimes(JobKind.INTERVAL);

        Map<UUID, Function<Occurrence, ExecutionContext>> byId = new HashMap<>();
        definitions.forEach(d -> byId.put(d.id(), o -> contexts.of(o, d)));

        Map<UUID, Instant> candidates = new HashMap<>();
        for (IntervalJob definition : definitions) {
            definition.nextExecution(second, latest.get(definition.id()))
                    .ifPresent(next -> candidates.put(definition.id(), next));
        }

        List<Occurrence> usable = withDefinitions(stored, byId,
                id -> intervalJobs.findById(id).map(d -> o -> contexts.of(o, d)));
        return pending(JobKind.INTERVAL, usable, candidates, byId);
    }

    /** Stored occurrences whose definition still exists, loading definitions not seen yet */
    private static List<Occurrence> withDefinitions(List<Occurrence> stored,
            Map<UUID, Function<Occurrence, ExecutionContext>> byId,
            Function<UUID, Optional<Function<Occurrence, ExecutionContext>>> loader) {
        List<Occurrence> usable = new ArrayList<>();
        for (Occurrence occurrence : stored) {
            if (!byId.containsKey(occurrence.definitionId())) {
                loader.apply(occurrence.definitionId()).ifPresent(d -> byId.put(occurrence.definitionId(), d));
            }
            if (byId.containsKey(occurrence.definitionId())) {
                usable.add(occurrence);
            }
        }
        return usable;
    }

    /**
     * Merge stored occurrences and computed firings of one kind.
     * A computed firing that matches a stored occurrence of the same
     * definition is dropped, so an instant is never materialized twice.
     */
    private static Optional<Pending> pending(JobKind kind, List<Occurrence> stored, Map<UUID, Instant> candidates,
            Map<UUID, Function<Occurrence, ExecutionContext>> definitions) {
        Set<String> storedKeys = new HashSet<>();
        for (Occurrence occurrence : stored) {
            storedKeys.add(occurrence.definitionId() + "@" + occurrence.executionTime());
        }

        Instant computedMin = null;
        List<Computed> computed = new ArrayList<>();
        for (Map.Entry<UUID, Instant> candidate : candidates.entrySet()) {
            if (storedKeys.contains(candidate.getKey() + "@" + candidate.getValue())) {
                continue;
            }
            Instant at = candidate.getValue();
            if (computedMin == null || at.isBefore(computedMin)) {
                computedMin = at;
                computed.clear();
            }
            if (at.equals(computedMin)) {
                computed.add(new Computed(candidate.getKey(), at));
            }
        }

        Instant storedMin = stored.isEmpty() ? null : stored.get(0).executionTime();
        if (storedMin == null && computedMin == null) {
            return Optional.empty();
        }
        if (computedMin == null) {
            return Optional.of(new Pending(kind, storedMin, stored, List.of(), definitions));
        }
        if (storedMin == null) {
            return Optional.of(new Pending(kind, computedMin, List.of(), computed, definitions));
        }

        Instant storedSecond = storedMin.truncatedTo(ChronoUnit.SECONDS);
        Instant computedSecond = computedMin.truncatedTo(ChronoUnit.SECONDS);
        if (storedSecond.isBefore(computedSecond)) {
            return Optional.of(new Pending(kind, storedMin, stored, List.of(), definitions));
        }
        if (computedSecond.isBefore(storedSecond)) {
            return Optional.of(new Pending(kind, computedMin, List.of(), computed, definitions));
        }
        return Optional.of(new Pending(kind, min(storedMin, computedMin), stored, computed, definitions));
    }

    // ---------- claiming ----------

    private List<ExecutionContext> claimTimeJobs(Instant batchSecond, Instant now) {
        List<ExecutionContext> claimed = new ArrayList<>();
        for (TimeJob job : timeJobs.findClaimable(nodeId, batchSecond, batchSecond.plusSeconds(1))) {
            Optional<TimeJob> queued = timeJobs.tryQueue(job, nodeId, now);
            if (queued.isEmpty()) {
                continue;
            }
            notifications.updated(JobNotification.of(queued.get()));
            claimed.add(contexts.of(queued.get()));
        }
        return claimed;
    }

    private List<ExecutionContext> claimOccurrences(Pending pending, Instant now) {
        List<ExecutionContext> claimed = new ArrayList<>();

        for (Occurrence stored : pending.stored()) {
            Optional<Occurrence> queued = occurrences.tryQueue(stored, nodeId, now);
            if (queued.isEmpty()) {
                continue;
            }
            notify(queued.get());
            claimed.add(pending.definitions().get(stored.definitionId()).apply(queued.get()));
        }

        Instant at = now.truncatedTo(ChronoUnit.MICROS);
        for (Computed computed : pending.computed()) {
            Occurrence occurrence = Occurrence.builder()
                    .id(UUID.randomUUID())
                    .kind(pending.kind())
                    .definitionId(computed.definitionId())
                    .executionTime(computed.at())
                    .status(JobStatus.QUEUED)
                    .lockHolder(nodeId)
                    .lockedAt(at)
                    .createdAt(at)
                    .updatedAt(at)
                    .build();
            if (!occurrences.insert(occurrence)) {
                continue;
            }
            notify(occurrence);
            claimed.add(pending.definitions().get(computed.definitionId()).apply(occurrence));
        }
        return claimed;
    }

    private void notify(Occurrence occurrence) {
        if (occurrence.isFresh()) {
            notifications.added(JobNotification.of(occurrence));
        } else {
            notifications.updated(JobNotification.of(occurrence));
        }
    }

    private static Instant min(Instant... instants) {
        Instant result = null;
        for (Instant instant : instants) {
            if (instant != null && (result == null || instant.isBefore(result))) {
                result = instant;
            }
        }
        return result;
    }
}
