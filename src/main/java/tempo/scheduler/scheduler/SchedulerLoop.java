package tempo.scheduler.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.config.SchedulerConfig;
import tempo.scheduler.core.ExecutionEngine;
import tempo.scheduler.core.JobStateManager;
import tempo.scheduler.core.OccurrenceResolver;
import tempo.scheduler.core.OccurrenceResolver.NextRun;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.util.RestartThrottle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The node's polling loop.
 *
 * Each cycle dispatches the units claimed in the previous cycle, asks the
 * resolver for the next due batch, and sleeps until that batch is due or a
 * restart is requested. A restart gives the claimed batch back and resolves
 * again, so newly scheduled earlier work is picked up.
 *
 * Runs on a single daemon thread.
 */
public class SchedulerLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    static final Duration ALREADY_DUE_SLEEP = Duration.ofMillis(1);
    static final Duration RESTART_PAUSE = Duration.ofMillis(100);
    static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);
    static final Duration RESTART_TOLERANCE = Duration.ofMillis(500);

    private final OccurrenceResolver resolver;
    private final JobStateManager state;
    private final ExecutionEngine engine;
    private final PriorityTaskScheduler scheduler;
    private final NotificationPublisher notifications;
    private final RestartThrottle throttle;
    private final Duration maxSleep;
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private boolean restartRequested;

    private volatile boolean running = false;
    private volatile Instant plannedOccurrence;
    private Thread thread;
    private List<ExecutionContext> pending = List.of();

    public SchedulerLoop(OccurrenceResolver resolver, JobStateManager state, ExecutionEngine engine,
            PriorityTaskScheduler scheduler, NotificationPublisher notifications, SchedulerConfig config,
            Clock clock) {
        this.resolver = resolver;
        this.state = state;
        this.engine = engine;
        this.scheduler = scheduler;
        this.notifications = notifications;
        this.maxSleep = config.maxSleep();
        this.shutdownTimeout = config.shutdownTimeout();
        this.clock = clock;
        this.throttle = new RestartThrottle(config.restartDebounce(), this::signalRestart);
    }

    /**
     * Start the loop. Calling it again while running does nothing.
     */
    public synchronized void start() {
        if (running) {
            log.debug("Scheduler loop already running");
            return;
        }
        running = true;
        scheduler.resume();

        thread = new Thread(this::run, "tempo-scheduler-loop");
        thread.setDaemon(true);
        thread.start();
        log.info("Scheduler loop started on node {}", state.nodeId());
    }

    /**
     * Stop the loop, let running work finish and give back everything this
     * node still holds.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        scheduler.freeze();
        running = false;
        signal();

        try {
            thread.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!scheduler.waitForRunningTasks(shutdownTimeout)) {
            log.warn("Running jobs did not finish within {}", shutdownTimeout);
        }
        state.releaseAll();
        plannedOccurrence = null;
        log.info("Scheduler loop stopped");
    }

    @Override
    public void close() {
        stop();
        throttle.close();
    }

    public boolean isRunning() {
        return running;
    }

    /** When the loop next plans to wake for due work; null when nothing is planned */
    public Instant plannedOccurrence() {
        return plannedOccurrence;
    }

    /** Request a throttled re-resolve */
    public void restart() {
        throttle.requestRestart();
    }

    /**
     * Restart only if work due at {@code executionTime} could be missed by the
     * current plan.
     */
    public void restartIfNeeded(Instant executionTime) {
        Instant planned = plannedOccurrence;
        if (planned == null || executionTime == null || !executionTime.isAfter(clock.instant())
                || Duration.between(executionTime, planned).compareTo(RESTART_TOLERANCE) > 0) {
            restart();
        }
    }

    /**
     * Queue contexts on the priority scheduler, highest priority first.
     *
     * @param contexts units already IN_PROGRESS under this node
     * @param due      true when the units were reclaimed after missing their slot
     */
    public void dispatch(List<ExecutionContext> contexts, boolean due) {
        List<ExecutionContext> ordered = new ArrayList<>(contexts);
        ordered.sort(Comparator.comparing(ExecutionContext::priority));

        for (ExecutionContext context : ordered) {
            try {
                scheduler.queue(() -> engine.execute(context, due), context.priority());
                log.debug("Dispatched {} job {} ({})", context.kind(), context.jobId(), context.functionName());
            } catch (IllegalStateException e) {
                log.warn("Job {} not dispatched: {}", context.jobId(), e.getMessage());
            }
        }
    }

    private void run() {
        while (running) {
            try {
                cycle();
            } catch (Exception e) {
                log.error("Scheduler loop error", e);
                releasePending();
                plannedOccurrence = null;
                notifications.hostException(e.getMessage() != null ? e.getMessage() : e.toString());
                pause(ERROR_BACKOFF);
            }
        }
        releasePending();
    }

    private void cycle() {
        if (!pending.isEmpty()) {
            List<ExecutionContext> due = pending;
            pending = List.of();
            if (scheduler.isFrozen()) {
                state.release(due);
            } else {
                state.setInProgress(due);
                dispatch(due, false);
            }
        }

        NextRun next = resolver.resolveNext();
        pending = next.due();

        Instant now = clock.instant();
        Duration sleep;
        if (next.isInfinite() || next.timeRemaining().compareTo(maxSleep) > 0) {
            // too far ahead to hold a claim
            releasePending();
            sleep = maxSleep;
            plannedOccurrence = null;
        } else if (next.timeRemaining().isZero()) {
            sleep = ALREADY_DUE_SLEEP;
            plannedOccurrence = now.plus(sleep);
        } else {
            sleep = next.timeRemaining();
            plannedOccurrence = now.plus(sleep);
        }
        notifications.nextOccurrence(plannedOccurrence);

        if (awaitWake(sleep)) {
            log.debug("Scheduler loop restart requested");
            releasePending();
            pause(RESTART_PAUSE);
        }
    }

    private void releasePending() {
        if (pending.isEmpty()) {
            return;
        }
        List<ExecutionContext> released = pending;
        pending = List.of();
        try {
            state.release(released);
        } catch (Exception e) {
            log.warn("Failed to release {} claimed units: {}", released.size(), e.getMessage());
        }
    }

    /**
     * Sleep until the timeout, a restart or stop.
     *
     * @return true if woken by a restart
     */
    private boolean awaitWake(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (running && !restartRequested && nanos > 0) {
                nanos = wake.awaitNanos(nanos);
            }
            boolean restarted = restartRequested;
            restartRequested = false;
            return restarted;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void pause(Duration duration) {
        long nanos = duration.toNanos();
        lock.lock();
        try {
            while (running && nanos > 0) {
                nanos = wake.awaitNanos(nanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        } finally {
            lock.unlock();
        }
    }

    private void signalRestart() {
        lock.lock();
        try {
            restartRequested = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void signal() {
        lock.lock();
        try {
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
