package tempo.scheduler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.core.RegisteredFunction;
import tempo.scheduler.cron.CronOccurrenceCache;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.repository.CronJobRepository;
import tempo.scheduler.repository.OccurrenceRepository;
import tempo.scheduler.scheduler.SchedulerLoop;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Management of cron definitions.
 */
public class CronJobService {

    private static final Logger log = LoggerFactory.getLogger(CronJobService.class);

    static final int OCCURRENCE_HISTORY = 100;

    private final CronJobRepository repository;
    private final OccurrenceRepository occurrences;
    private final FunctionRegistry functions;
    private final CronOccurrenceCache cache;
    private final SchedulerLoop loop;
    private final Clock clock;

    public CronJobService(CronJobRepository repository, OccurrenceRepository occurrences,
            FunctionRegistry functions, CronOccurrenceCache cache, SchedulerLoop loop, Clock clock) {
        this.repository = repository;
        this.occurrences = occurrences;
        this.functions = functions;
        this.cache = cache;
        this.loop = loop;
        this.clock = clock;
    }

    /**
     * Create a cron definition.
     *
     * @throws JobValidationException for an unknown function or an unparsable expression
     */
    public CronJob create(CronJob job) {
        validate(job);

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        CronJob stored = job.toBuilder()
                .id(job.id() != null ? job.id() : UUID.randomUUID())
                .createdAt(now)
                .updatedAt(now)
                .build();
        repository.save(stored);
        cache.invalidate(stored.expression());

        log.info("Created cron job {} ({}) '{}'", stored.id(), stored.function(), stored.expression());
        loop.restart();
        return stored;
    }

    public CronJob update(CronJob job) {
        if (job.id() == null) {
            throw new JobValidationException("Job id is required");
        }
        CronJob existing = repository.findById(job.id())
                .orElseThrow(() -> new JobValidationException("Unknown cron job: " + job.id()));
        validate(job);

        CronJob updated = job.toBuilder()
                .createdAt(existing.createdAt())
                .updatedAt(clock.instant().truncatedTo(ChronoUnit.MICROS))
                .build();
        if (!repository.update(updated)) {
            throw new JobValidationException("Unknown cron job: " + job.id());
        }
        cache.invalidate(existing.expression());
        cache.invalidate(updated.expression());

        log.info("Updated cron job {} to '{}'", updated.id(), updated.expression());
        loop.restart();
        return updated;
    }

    /** Delete a definition together with its occurrences */
    public boolean delete(UUID id) {
        Optional<CronJob> existing = repository.findById(id);
        boolean deleted = repository.delete(id);
        if (deleted) {
            existing.ifPresent(job -> cache.invalidate(job.expression()));
            log.info("Deleted cron job {}", id);
            loop.restart();
        }
        return deleted;
    }

    public Optional<CronJob> find(UUID id) {
        return repository.findById(id);
    }

    public List<CronJob> list() {
        return repository.findAll();
    }

    /** Most recent occurrences of a definition, newest first */
    public List<Occurrence> occurrences(UUID id) {
        return occurrences.findByDefinition(JobKind.CRON, id, OCCURRENCE_HISTORY);
    }

    /**
     * Create a definition for every registered function that declares a cron
     * expression and has none yet.
     *
     * @return number of definitions created
     */
    public int seedFromRegistry() {
        int created = 0;
        for (RegisteredFunction function : functions.cronFunctions()) {
            if (repository.findByFunction(function.name()).isPresent()) {
                continue;
            }
            if (!cache.isValid(function.cronExpression())) {
                log.warn("Function '{}' declares an invalid cron expression '{}'", function.name(),
                        function.cronExpression());
                continue;
            }
            create(CronJob.builder()
                    .function(function.name())
                    .expression(function.cronExpression())
                    .build());
            created++;
        }
        if (created > 0) {
            log.info("Seeded {} cron jobs from registered functions", created);
        }
        return created;
    }

    private void validate(CronJob job) {
        if (job.function() == null || !functions.contains(job.function())) {
            throw new JobValidationException("Function '" + job.function() + "' is not registered");
        }
        if (!cache.isValid(job.expression())) {
            throw new JobValidationException("Invalid cron expression: '" + job.expression() + "'");
        }
    }
}
