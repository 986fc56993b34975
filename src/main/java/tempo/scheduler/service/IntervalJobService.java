package tempo.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.repository.IntervalJobRepository;
import tempo.scheduler.repository.OccurrenceRepository;
import tempo.scheduler.scheduler.SchedulerLoop;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Management of fixed-interval definitions.
 */
public class IntervalJobService {

    private static final Logger log = LoggerFactory.getLogger(IntervalJobService.class);

    static final int OCCURRENCE_HISTORY = 100;

    private final IntervalJobRepository repository;
    private final OccurrenceRepository occurrences;
    private final FunctionRegistry functions;
    private final SchedulerLoop loop;
    private final Clock clock;

    public IntervalJobService(IntervalJobRepository repository, OccurrenceRepository occurrences,
            FunctionRegistry functions, SchedulerLoop loop, Clock clock) {
        this.repository = repository;
        this.occurrences = occurrences;
        this.functions = functions;
        this.loop = loop;
        this.clock = clock;
    }

    /**
     * Create an interval definition.
     *
     * @throws JobValidationException for an unknown function, a non-positive
     *                                interval or an end before the start
     */
    public IntervalJob create(IntervalJob job) {
        validate(job);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        IntervalJob stored = job.toBuilder()
                .id(job.id() != null ? job.id() : UUID.randomUUID())
                .lastExecutedAt(null)
                .executionCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        repository.save(stored);

        log.info("Created interval job {} ({}) every {}", stored.id(), stored.function(), stored.interval());
        loop.restart();
        return stored;
    }

    public IntervalJob update(IntervalJob job) {
        if (job.id() == null) {
            throw new JobValidationException("Job id is required");
        }
        IntervalJob existing = repository.findById(job.id())
                .orElseThrow(() -> new JobValidationException("Unknown interval job: " + job.id()));
        validate(job);

        IntervalJob updated = job.toBuilder()
                .lastExecutedAt(existing.lastExecutedAt())
                .executionCount(existing.executionCount())
                .createdAt(existing.createdAt())
                .updatedAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                .build();
        if (!repository.update(updated)) {
            throw new JobValidationException("Unknown interval job: " + job.id());
        }

        log.info("Updated interval job {}", updated.id());
        loop.restart();
        return updated;
    }

    /** Delete a definition together with its occurrences */
    public boolean delete(UUID id) {
        boolean deleted = repository.delete(id);
        if (deleted) {
            log.info("Deleted interval job {}", id);
            loop.restart();
        }
        return deleted;
    }

    public void pause(UUID id) {
        setActive(id, false);
    }

    public void resume(UUID id) {
        setActive(id, true);
    }

    public Optional<IntervalJob> find(UUID id) {
        return repository.findById(id);
    }

    public List<IntervalJob> list() {
        return repository.findAll();
    }

    /** Most recent occurrences of a definition, newest first */
    public List<Occurrence> occurrences(UUID id) {
        return occurrences.findByDefinition(JobKind.INTERVAL, id, OCCURRENCE_HISTORY);
    }

    private void setActive(UUID id, boolean active) {
        if (!repository.setActive(id, active, clock.instant().truncatedTo(ChronoUnit.MICROS))) {
            throw new JobValidationException("Unknown interval job: " + id);
        }
        log.info("Interval job {} {}", id, active ? "resumed" : "paused");
        loop.restart();
    }

    private void validate(IntervalJob job) {
        if (job.function() == null || !functions.contains(job.function())) {
            throw new JobValidationException("Function '" + job.function() + "' is not registered");
        }
        if (job.interval() == null || job.interval().isNegative() || job.interval().isZero()) {
            throw new JobValidationException("Interval must be positive: " + job.interval());
        }
        if (job.startTime() != null && job.endTime() != null && !job.endTime().isAfter(job.startTime())) {
            throw new JobValidationException("End time " + job.endTime() + " is not after start time "
                    + job.startTime());
        }
    }
}
