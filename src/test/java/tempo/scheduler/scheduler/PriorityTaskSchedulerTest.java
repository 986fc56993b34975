package tempo.scheduler.scheduler;

import org.junit.jupiter.api.*;
import tempo.scheduler.MutableClock;
import tempo.scheduler.model.JobPriority;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PriorityTaskSchedulerTest {

    private MutableClock clock;
    private PriorityTaskScheduler scheduler;
    private CountDownLatch gate;
    private List<String> ran;

    @BeforeEach
    void init() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        scheduler = new PriorityTaskScheduler(1, null, clock);
        gate = new CountDownLatch(1);
        ran = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void dispose() {
        gate.countDown();
        scheduler.disposeAsync().orTimeout(5, TimeUnit.SECONDS).join();
    }

    /** Occupy the only worker until the gate opens */
    private void blockWorker() {
        scheduler.queue(() -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, JobPriority.NORMAL);
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.activeWorkers() == 1);
    }

    private CompletableFuture<Void> record(String name, JobPriority priority) {
        return scheduler.queue(() -> ran.add(name), priority);
    }

    @Test
    void higherLanesDrainFirst() {
        blockWorker();
        record("low", JobPriority.LOW);
        record("normal", JobPriority.NORMAL);
        CompletableFuture<Void> high = record("high", JobPriority.HIGH);
        CompletableFuture<Void> normalAgain = record("normal-2", JobPriority.NORMAL);

        assertEquals(5, scheduler.totalQueuedTasks());
        gate.countDown();

        assertTrue(scheduler.waitForRunningTasks(Duration.ofSeconds(5)));
        assertEquals(List.of("high", "normal", "normal-2", "low"), ran);
        assertTrue(high.isDone());
        assertTrue(normalAgain.isDone());
        assertEquals(0, scheduler.totalQueuedTasks());
    }

    @Test
    void oldLowWorkIsPromotedAheadOfFreshNormalWork() {
        blockWorker();
        record("old-low", JobPriority.LOW);
        clock.advance(PriorityTaskScheduler.LOW_TO_HIGH.plusSeconds(1));
        record("fresh-normal", JobPriority.NORMAL);

        gate.countDown();

        assertTrue(scheduler.waitForRunningTasks(Duration.ofSeconds(5)));
        assertEquals(List.of("old-low", "fresh-normal"), ran);
    }

    @Test
    void moderatelyOldLowWorkJoinsTheNormalLane() {
        blockWorker();
        record("normal", JobPriority.NORMAL);
        record("low", JobPriority.LOW);
        clock.advance(PriorityTaskScheduler.LOW_TO_NORMAL.plusSeconds(1));
        record("high", JobPriority.HIGH);

        gate.countDown();

        assertTrue(scheduler.waitForRunningTasks(Duration.ofSeconds(5)));
        assertEquals(List.of("high", "normal", "low"), ran);
    }

    @Test
    void longRunningWorkDoesNotTakeAPoolWorker() throws Exception {
        blockWorker();
        CountDownLatch started = new CountDownLatch(1);

        scheduler.queue(started::countDown, JobPriority.LONG_RUNNING);

        assertTrue(started.await(2, TimeUnit.SECONDS));
    }

    @Test
    void failingTaskCompletesItsFutureExceptionally() {
        CompletableFuture<Void> future = scheduler.queue(() -> {
            throw new IllegalStateException("broken");
        }, JobPriority.HIGH);

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertEquals("broken", error.getCause().getMessage());

        // the worker survives
        record("after", JobPriority.NORMAL);
        assertTrue(scheduler.waitForRunningTasks(Duration.ofSeconds(2)));
        assertEquals(List.of("after"), ran);
    }

    @Test
    void frozenSchedulerRejectsWork() {
        scheduler.freeze();

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> record("rejected", JobPriority.NORMAL));
        assertEquals("Scheduler is frozen - no new tasks can be queued", error.getMessage());
        assertTrue(scheduler.isFrozen());

        scheduler.resume();
        assertFalse(scheduler.isFrozen());
        record("accepted", JobPriority.NORMAL);
        assertTrue(scheduler.waitForRunningTasks(Duration.ofSeconds(2)));
        assertEquals(List.of("accepted"), ran);
    }

    @Test
    void disposeFinishesQueuedWorkThenStopsWorkers() {
        blockWorker();
        record("queued", JobPriority.LOW);

        CompletableFuture<Void> disposal = scheduler.disposeAsync();
        assertThrows(IllegalStateException.class, () -> record("late", JobPriority.HIGH));
        gate.countDown();

        disposal.orTimeout(5, TimeUnit.SECONDS).join();
        assertEquals(List.of("queued"), ran);
        assertEquals(0, scheduler.liveWorkers());
        assertSame(disposal, scheduler.disposeAsync());
    }

    @Test
    void disposeWaitsForLongRunningWork() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Void> longRunning = scheduler.queue(() -> {
            started.countDown();
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.add("long");
        }, JobPriority.LONG_RUNNING);
        assertTrue(started.await(2, TimeUnit.SECONDS));

        CompletableFuture<Void> disposal = scheduler.disposeAsync();
        await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.liveWorkers() == 0);
        assertFalse(disposal.isDone());
        assertEquals(1, scheduler.totalQueuedTasks());

        gate.countDown();
        disposal.get(5, TimeUnit.SECONDS);

        assertTrue(longRunning.isDone());
        assertEquals(List.of("long"), ran);
        assertEquals(0, scheduler.totalQueuedTasks());
    }

    @Test
    void waitTimesOutWhileWorkIsRunning() {
        blockWorker();

        assertFalse(scheduler.waitForRunningTasks(Duration.ofMillis(50)));
    }

    @Test
    void activeWorkerCountIsReported() {
        List<Integer> reported = new CopyOnWriteArrayList<>();
        PriorityTaskScheduler reporting = new PriorityTaskScheduler(2, reported::add);
        try {
            reporting.queue(() -> {
            }, JobPriority.NORMAL);
            assertTrue(reporting.waitForRunningTasks(Duration.ofSeconds(2)));
            await().atMost(Duration.ofSeconds(2)).until(() -> reported.contains(0));
            assertTrue(reported.contains(1));
        } finally {
            reporting.close();
        }
    }

    @Test
    void concurrencyMustBeInRange() {
        assertThrows(IllegalArgumentException.class, () -> new PriorityTaskScheduler(0, null));
        assertThrows(IllegalArgumentException.class,
                () -> new PriorityTaskScheduler(PriorityTaskScheduler.MAX_CONCURRENCY + 1, null));
    }
}
