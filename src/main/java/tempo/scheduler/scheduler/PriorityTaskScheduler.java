package tempo.scheduler.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.JobPriority;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntConsumer;

/**
 * Bounded worker pool with three priority lanes.
 *
 * <p>
 * Workers always drain HIGH before NORMAL before LOW. Waiting work is aged
 * when a worker picks its next task so that LOW work cannot starve forever.
 * LONG_RUNNING work never occupies a pool worker: each such task gets its own
 * daemon thread.
 */
public class PriorityTaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PriorityTaskScheduler.class);

    public static final int MAX_CONCURRENCY = 64;

    static final Duration LOW_TO_NORMAL = Duration.ofMinutes(2);
    static final Duration LOW_TO_HIGH = Duration.ofMinutes(5);
    static final Duration NORMAL_TO_HIGH = Duration.ofMinutes(10);
    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private record QueuedTask(Runnable task, CompletableFuture<Void> future, Instant enqueuedAt) {
    }

    private final Map<JobPriority, Deque<QueuedTask>> lanes = new EnumMap<>(JobPriority.class);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final Condition drained = lock.newCondition();
    private final List<Thread> workers = new ArrayList<>();
    private final IntConsumer activeWorkerListener;
    private final Clock clock;
    private final int maxConcurrency;

    private int queued;
    private int active;
    private boolean frozen;
    private boolean disposed;
    private CompletableFuture<Void> disposal;

    public PriorityTaskScheduler(int maxConcurrency, IntConsumer activeWorkerListener) {
        this(maxConcurrency, activeWorkerListener, Clock.systemUTC());
    }

    PriorityTaskScheduler(int maxConcurrency, IntConsumer activeWorkerListener, Clock clock) {
        if (maxConcurrency < 1 || maxConcurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException(
                    "maxConcurrency must be between 1 and " + MAX_CONCURRENCY + ": " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.activeWorkerListener = activeWorkerListener != null ? activeWorkerListener : count -> {
        };
        this.clock = clock;

        lanes.put(JobPriority.HIGH, new ArrayDeque<>());
        lanes.put(JobPriority.NORMAL, new ArrayDeque<>());
        lanes.put(JobPriority.LOW, new ArrayDeque<>());

        for (int i = 0; i < maxConcurrency; i++) {
            Thread worker = new Thread(this::workerLoop, "tempo-worker-" + (i + 1));
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
        log.info("Priority scheduler started with {} workers", maxConcurrency);
    }

    /**
     * Queue a task.
     *
     * @throws IllegalStateException if the scheduler is frozen or disposed
     */
    public CompletableFuture<Void> queue(Runnable task, JobPriority priority) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        JobPriority lane = priority != null ? priority : JobPriority.NORMAL;

        lock.lock();
        try {
            if (disposed) {
                throw new IllegalStateException("Scheduler is disposed");
            }
            if (frozen) {
                throw new IllegalStateException("Scheduler is frozen - no new tasks can be queued");
            }
            if (lane == JobPriority.LONG_RUNNING) {
                active++;
            } else {
                lanes.get(lane).addLast(new QueuedTask(task, future, clock.instant()));
                queued++;
                workAvailable.signal();
                return future;
            }
        } finally {
            lock.unlock();
        }

        reportActive();
        Thread thread = new Thread(() -> {
            try {
                runTask(task, future);
            } finally {
                finished();
            }
        }, "tempo-long-running");
        thread.setDaemon(true);
        thread.start();
        return future;
    }

    public void freeze() {
        lock.lock();
        try {
            frozen = true;
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            frozen = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFrozen() {
        lock.lock();
        try {
            return frozen || disposed;
        } finally {
            lock.unlock();
        }
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int activeWorkers() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /** Queued plus running tasks */
    public int totalQueuedTasks() {
        lock.lock();
        try {
            return queued + active;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until nothing is queued or running.
     *
     * @return false if the timeout elapsed first
     */
    public boolean waitForRunningTasks(Duration timeout) {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (queued + active > 0) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop accepting work, let queued and running tasks finish, then stop the
     * workers. The returned future completes once long-running tasks are done
     * as well.
     */
    public CompletableFuture<Void> disposeAsync() {
        lock.lock();
        try {
            if (disposal != null) {
                return disposal;
            }
            disposed = true;
            workAvailable.signalAll();
            disposal = CompletableFuture.runAsync(() -> {
                joinWorkers();
                awaitDrained();
            }, runnable -> {
                Thread t = new Thread(runnable, "tempo-scheduler-dispose");
                t.setDaemon(true);
                t.start();
            });
            return disposal;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        try {
            disposeAsync().get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Priority scheduler stopped");
        } catch (TimeoutException e) {
            log.warn("Priority scheduler still had {} tasks after {}", totalQueuedTasks(), CLOSE_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Priority scheduler disposal failed: {}", e.getMessage(), e);
        }
    }

    private void joinWorkers() {
        for (Thread worker : workers) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void awaitDrained() {
        lock.lock();
        try {
            while (queued + active > 0) {
                drained.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    private void workerLoop() {
        while (true) {
            QueuedTask next;
            lock.lock();
            try {
                next = nextTask();
                while (next == null) {
                    if (disposed) {
                        return;
                    }
                    workAvailable.await();
                    next = nextTask();
                }
                queued--;
                active++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }

            reportActive();
            try {
                runTask(next.task(), next.future());
            } finally {
                finished();
            }
        }
    }

    /** Caller holds the lock */
    private QueuedTask nextTask() {
        age();
        for (Deque<QueuedTask> lane : lanes.values()) {
            QueuedTask task = lane.pollFirst();
            if (task != null) {
                return task;
            }
        }
        return null;
    }

    /** Caller holds the lock. Lanes are FIFO, so only the heads can be old enough. */
    private void age() {
        Instant now = clock.instant();
        Deque<QueuedTask> high = lanes.get(JobPriority.HIGH);
        Deque<QueuedTask> normal = lanes.get(JobPriority.NORMAL);
        Deque<QueuedTask> low = lanes.get(JobPriority.LOW);

        while (!normal.isEmpty() && olderThan(normal.peekFirst(), NORMAL_TO_HIGH, now)) {
            high.addLast(normal.pollFirst());
        }
        while (!low.isEmpty() && olderThan(low.peekFirst(), LOW_TO_NORMAL, now)) {
            QueuedTask task = low.pollFirst();
            if (olderThan(task, LOW_TO_HIGH, now)) {
                high.addLast(task);
            } else {
                normal.addLast(task);
            }
        }
    }

    private static boolean olderThan(QueuedTask task, Duration age, Instant now) {
        return Duration.between(task.enqueuedAt(), now).compareTo(age) > 0;
    }

    private void runTask(Runnable task, CompletableFuture<Void> future) {
        try {
            task.run();
            future.complete(null);
        } catch (Throwable t) {
            log.error("Scheduled task failed", t);
            future.completeExceptionally(t);
        }
    }

    private void finished() {
        lock.lock();
        try {
            active--;
            if (queued + active == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
        reportActive();
    }

    private void reportActive() {
        try {
            activeWorkerListener.accept(activeWorkers());
        } catch (Exception e) {
            log.warn("Active worker listener failed: {}", e.getMessage());
        }
    }

    /** For tests: how many pool workers are still alive */
    int liveWorkers() {
        return (int) workers.stream().filter(Thread::isAlive).count();
    }
}
