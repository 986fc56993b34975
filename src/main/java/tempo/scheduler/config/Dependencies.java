package tempo.scheduler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.core.CancellationRegistry;
import tempo.scheduler.core.ExecutionContexts;
import tempo.scheduler.core.ExecutionEngine;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.core.JobExceptionHandler;
import tempo.scheduler.core.JobStateManager;
import tempo.scheduler.core.OccurrenceResolver;
import tempo.scheduler.core.Sleeper;
import tempo.scheduler.core.TimeoutReclaimer;
import tempo.scheduler.cron.CronOccurrenceCache;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.notify.NotificationSender;
import tempo.scheduler.notify.NotifyDebounce;
import tempo.scheduler.repository.CronJobRepository;
import tempo.scheduler.repository.IntervalJobRepository;
import tempo.scheduler.repository.OccurrenceRepository;
import tempo.scheduler.repository.TimeJobRepository;
import tempo.scheduler.scheduler.FallbackLoop;
import tempo.scheduler.scheduler.PriorityTaskScheduler;
import tempo.scheduler.scheduler.SchedulerLoop;
import tempo.scheduler.service.CronJobService;
import tempo.scheduler.service.IntervalJobService;
import tempo.scheduler.service.TimeJobService;
import tempo.scheduler.store.Database;
import tempo.scheduler.store.JdbcCronJobRepository;
import tempo.scheduler.store.JdbcIntervalJobRepository;
import tempo.scheduler.store.JdbcOccurrenceRepository;
import tempo.scheduler.store.JdbcTimeJobRepository;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manual dependency injection container.
 * Creates and wires every component of a scheduler node.
 *
 * Usage:
 *
 * <pre>
 * FunctionRegistry functions = new FunctionRegistry()
 *         .register("sendReport", ctx -&gt; reports.send(ctx.payloadAsString()));
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv(), functions);
 * deps.start(); // seed cron functions, start the loops
 * deps.timeJobService().schedule(job);
 * // ...
 * deps.close(); // stop loops, release leases, close the pool
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final FunctionRegistry functions;
    private final Clock clock;
    private final Database database;

    private final TimeJobRepository timeJobRepository;
    private final CronJobRepository cronJobRepository;
    private final IntervalJobRepository intervalJobRepository;
    private final OccurrenceRepository occurrenceRepository;

    private final CronOccurrenceCache cronCache;
    private final NotificationPublisher notifications;
    private final NotifyDebounce activeWorkersDebounce;
    private final CancellationRegistry cancellations;
    private final JobStateManager stateManager;
    private final ExecutorService resolverExecutor;
    private final OccurrenceResolver resolver;
    private final TimeoutReclaimer reclaimer;
    private final ExecutionEngine engine;
    private final PriorityTaskScheduler taskScheduler;
    private final SchedulerLoop schedulerLoop;
    private final FallbackLoop fallbackLoop;

    private final TimeJobService timeJobService;
    private final CronJobService cronJobService;
    private final IntervalJobService intervalJobService;

    private Dependencies(SchedulerConfig config, FunctionRegistry functions, NotificationSender sender,
            JobExceptionHandler exceptionHandler, Clock clock) {
        this.config = config;
        this.functions = functions;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.timeJobRepository = new JdbcTimeJobRepository(database);
        this.cronJobRepository = new JdbcCronJobRepository(database);
        this.intervalJobRepository = new JdbcIntervalJobRepository(database);
        this.occurrenceRepository = new JdbcOccurrenceRepository(database);

        // Core
        this.cronCache = new CronOccurrenceCache(config.timeZone());
        this.notifications = new NotificationPublisher(sender != null ? sender : NotificationSender.NONE);
        this.activeWorkersDebounce = new NotifyDebounce(config.notifyDebounce(), notifications::activeWorkers);
        this.cancellations = new CancellationRegistry();

        ExecutionContexts contexts = new ExecutionContexts(functions);
        this.stateManager = new JobStateManager(timeJobRepository, cronJobRepository, intervalJobRepository,
                occurrenceRepository, notifications, config.nodeId(), clock);

        AtomicInteger resolverThreads = new AtomicInteger();
        this.resolverExecutor = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "tempo-resolver-" + resolverThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.resolver = new OccurrenceResolver(timeJobRepository, cronJobRepository, intervalJobRepository,
                occurrenceRepository, cronCache, contexts, notifications, config.nodeId(), clock,
                resolverExecutor);
        this.reclaimer = new TimeoutReclaimer(timeJobRepository, cronJobRepository, intervalJobRepository,
                occurrenceRepository, contexts, notifications, config.nodeId(), config.timedOutGrace(), clock);
        this.engine = new ExecutionEngine(functions, cancellations, stateManager, exceptionHandler,
                Sleeper.SYSTEM, config.defaultRetryInterval(), clock);

        // Scheduling
        this.taskScheduler = new PriorityTaskScheduler(config.maxConcurrency(),
                activeWorkersDebounce::notifySafely);
        this.schedulerLoop = new SchedulerLoop(resolver, stateManager, engine, taskScheduler, notifications,
                config, clock);
        this.fallbackLoop = new FallbackLoop(reclaimer, schedulerLoop, config.fallbackInterval());

        // Services
        this.timeJobService = new TimeJobService(timeJobRepository, functions, cancellations, notifications,
                schedulerLoop, clock);
        this.cronJobService = new CronJobService(cronJobRepository, occurrenceRepository, functions, cronCache,
                schedulerLoop, clock);
        this.intervalJobService = new IntervalJobService(intervalJobRepository, occurrenceRepository, functions,
                schedulerLoop, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and functions.
     */
    public static Dependencies create(SchedulerConfig config, FunctionRegistry functions) {
        return create(config, functions, NotificationSender.NONE, JobExceptionHandler.NONE);
    }

    public static Dependencies create(SchedulerConfig config, FunctionRegistry functions,
            NotificationSender sender, JobExceptionHandler exceptionHandler) {
        return create(config, functions, sender, exceptionHandler, Clock.systemUTC());
    }

    public static Dependencies create(SchedulerConfig config, FunctionRegistry functions,
            NotificationSender sender, JobExceptionHandler exceptionHandler, Clock clock) {
        return new Dependencies(config, functions, sender, exceptionHandler, clock);
    }

    /**
     * Seed cron definitions declared on registered functions, then start the
     * polling and fallback loops.
     *
     * @throws IllegalStateException if the database is not reachable
     */
    public void start() {
        if (!database.isHealthy()) {
            throw new IllegalStateException("Database is not reachable: " + config.databaseUrl());
        }
        cronJobService.seedFromRegistry();
        schedulerLoop.start();
        fallbackLoop.start();
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TimeJobRepository timeJobRepository() {
        return timeJobRepository;
    }

    public CronJobRepository cronJobRepository() {
        return cronJobRepository;
    }

    public IntervalJobRepository intervalJobRepository() {
        return intervalJobRepository;
    }

    public OccurrenceRepository occurrenceRepository() {
        return occurrenceRepository;
    }

    public CronOccurrenceCache cronCache() {
        return cronCache;
    }

    public CancellationRegistry cancellations() {
        return cancellations;
    }

    public JobStateManager stateManager() {
        return stateManager;
    }

    public OccurrenceResolver resolver() {
        return resolver;
    }

    public TimeoutReclaimer reclaimer() {
        return reclaimer;
    }

    public ExecutionEngine engine() {
        return engine;
    }

    public PriorityTaskScheduler taskScheduler() {
        return taskScheduler;
    }

    public SchedulerLoop schedulerLoop() {
        return schedulerLoop;
    }

    public FallbackLoop fallbackLoop() {
        return fallbackLoop;
    }

    public TimeJobService timeJobService() {
        return timeJobService;
    }

    public CronJobService cronJobService() {
        return cronJobService;
    }

    public IntervalJobService intervalJobService() {
        return intervalJobService;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        closeQuietly("fallback loop", fallbackLoop);
        closeQuietly("scheduler loop", schedulerLoop);
        closeQuietly("task scheduler", taskScheduler);
        closeQuietly("execution engine", engine);
        closeQuietly("active worker debounce", activeWorkersDebounce);
        resolverExecutor.shutdownNow();
        cancellations.clear();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable component) {
        try {
            component.close();
        } catch (Exception e) {
            log.warn("Error stopping {}: {}", name, e.getMessage());
        }
    }
}
