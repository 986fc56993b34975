package tempo.scheduler.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import tempo.scheduler.MutableClock;
import tempo.scheduler.TestDatabases;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.model.RunCondition;
import tempo.scheduler.model.TimeJob;
import tempo.scheduler.notify.NotificationPublisher;
import tempo.scheduler.notify.NotificationSender;
import tempo.scheduler.store.Database;
import tempo.scheduler.store.JdbcCronJobRepository;
import tempo.scheduler.store.JdbcIntervalJobRepository;
import tempo.scheduler.store.JdbcOccurrenceRepository;
import tempo.scheduler.store.JdbcTimeJobRepository;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static Database db;
    private static JdbcTimeJobRepository timeJobs;
    private static JdbcCronJobRepository cronJobs;
    private static JdbcOccurrenceRepository occurrences;
    private static JobStateManager state;
    private static MutableClock clock;

    private FunctionRegistry functions;
    private CancellationRegistry cancellations;
    private List<Duration> sleeps;
    private List<String> handled;
    private ExecutionEngine engine;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-engine");
        timeJobs = new JdbcTimeJobRepository(db);
        cronJobs = new JdbcCronJobRepository(db);
        occurrences = new JdbcOccurrenceRepository(db);
        clock = new MutableClock(NOW);
        state = new JobStateManager(timeJobs, cronJobs, new JdbcIntervalJobRepository(db), occurrences,
                new NotificationPublisher(NotificationSender.NONE), "node-a", clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        TestDatabases.clean(db);
        functions = new FunctionRegistry();
        cancellations = new CancellationRegistry();
        sleeps = new CopyOnWriteArrayList<>();
        handled = new CopyOnWriteArrayList<>();

        JobExceptionHandler handler = new JobExceptionHandler() {
            @Override
            public void onException(Throwable error, UUID jobId, JobKind kind) {
                handled.add("exception:" + error.getMessage());
            }

            @Override
            public void onCancelled(CancellationException cancellation, UUID jobId, JobKind kind) {
                handled.add("cancelled");
            }
        };
        engine = new ExecutionEngine(functions, cancellations, state, handler, sleeps::add,
                Duration.ofSeconds(30), clock);
    }

    @AfterEach
    void closeEngine() {
        engine.close();
    }

    private static TimeJob.Builder job(String function) {
        return TimeJob.builder()
                .id(UUID.randomUUID())
                .function(function)
                .executionTime(NOW)
                .createdAt(NOW)
                .updatedAt(NOW);
    }

    private static TimeJob child(String function, RunCondition condition) {
        return TimeJob.builder()
                .id(UUID.randomUUID())
                .function(function)
                .runCondition(condition)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    /** Persist the tree and execute it as loaded back from the store */
    private void run(TimeJob job, boolean due) {
        timeJobs.save(job);
        engine.execute(new ExecutionContexts(functions).of(stored(job)), due);
    }

    private static TimeJob stored(TimeJob job) {
        return timeJobs.findById(job.id()).orElseThrow();
    }

    @Test
    void backoffClampsToTheLastInterval() throws Exception {
        functions.register("flaky", ctx -> {
            throw new IllegalStateException("boom");
        });
        TimeJob job = job("flaky").retries(5).retryIntervals(1, 2, 3).build();

        run(job, false);

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3),
                Duration.ofSeconds(3), Duration.ofSeconds(3)), sleeps);

        TimeJob result = stored(job);
        assertEquals(JobStatus.FAILED, result.status());
        assertEquals(5, result.retryCount());
        assertNull(result.lockHolder());

        JsonNode details = new ObjectMapper().readTree(result.exception());
        assertEquals("boom", details.get("message").asText());
        assertTrue(details.get("stackTrace").asText().contains("ExecutionEngineTest"));
        assertEquals(List.of("exception:boom"), handled);
    }

    @Test
    void retriesUseTheDefaultIntervalWithoutAList() {
        AtomicInteger calls = new AtomicInteger();
        functions.register("eventually", ctx -> {
            if (calls.incrementAndGet() < 3) {
                throw new RuntimeException("not yet");
            }
        });
        TimeJob job = job("eventually").retries(3).build();

        run(job, false);

        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(30)), sleeps);
        assertEquals(JobStatus.DONE, stored(job).status());
        assertEquals(2, stored(job).retryCount());
        assertTrue(handled.isEmpty());
    }

    @Test
    void reclaimedSuccessIsDueDone() {
        functions.register("ok", ctx -> assertTrue(ctx.isDue()));
        TimeJob job = job("ok").build();

        run(job, true);

        TimeJob result = stored(job);
        assertEquals(JobStatus.DUE_DONE, result.status());
        assertEquals(NOW, result.executedAt());
        assertNotNull(result.elapsedMs());
    }

    @Test
    void failedParentSkipsSuccessChildAndRunsFailureChild() {
        functions.register("parent", ctx -> {
            throw new RuntimeException("parent failed");
        });
        functions.register("child", ctx -> {
        });
        TimeJob onSuccess = child("child", RunCondition.ON_SUCCESS);
        TimeJob onFailure = child("child", RunCondition.ON_FAILURE);
        TimeJob job = job("parent").child(onSuccess).child(onFailure).build();

        run(job, false);

        assertEquals(JobStatus.FAILED, stored(job).status());
        TimeJob skipped = timeJobs.findById(onSuccess.id()).orElseThrow();
        assertEquals(JobStatus.SKIPPED, skipped.status());
        assertEquals(ExecutionEngine.RUN_CONDITION_MISMATCH, skipped.exception());
        assertEquals(JobStatus.DONE, timeJobs.findById(onFailure.id()).orElseThrow().status());
    }

    @Test
    void twoChildrenDoneDoneSkipped() {
        List<String> ran = new CopyOnWriteArrayList<>();
        functions.register("parent", ctx -> ran.add("parent"));
        functions.register("first", ctx -> ran.add("first"));
        functions.register("second", ctx -> ran.add("second"));

        TimeJob first = child("first", RunCondition.ON_SUCCESS);
        TimeJob grandchild = child("second", RunCondition.ON_SUCCESS);
        TimeJob second = child("second", RunCondition.ON_FAILURE).toBuilder().child(grandchild).build();
        TimeJob job = job("parent").child(first).child(second).build();

        run(job, false);

        assertEquals(JobStatus.DONE, stored(job).status());
        assertEquals(JobStatus.DONE, timeJobs.findById(first.id()).orElseThrow().status());
        assertEquals(JobStatus.SKIPPED, timeJobs.findById(second.id()).orElseThrow().status());
        // the whole subtree of a skipped child is skipped
        assertEquals(JobStatus.SKIPPED, timeJobs.findById(grandchild.id()).orElseThrow().status());
        assertEquals(List.of("parent", "first"), ran);
    }

    @Test
    void inProgressChildOverlapsItsParent() {
        CountDownLatch childStarted = new CountDownLatch(1);
        functions.register("parent", ctx -> {
            if (!childStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("child did not start alongside the parent");
            }
        });
        functions.register("watcher", ctx -> childStarted.countDown());

        TimeJob watcher = child("watcher", RunCondition.IN_PROGRESS);
        TimeJob job = job("parent").child(watcher).build();

        run(job, false);

        assertEquals(JobStatus.DONE, stored(job).status());
        assertEquals(JobStatus.DONE, timeJobs.findById(watcher.id()).orElseThrow().status());
    }

    @Test
    void terminateSignalSetsItsStatus() {
        functions.register("skipper", ctx -> {
            throw new TerminateExecutionException("nothing to do");
        });
        functions.register("stopper", ctx -> {
            throw new TerminateExecutionException("stop", JobStatus.CANCELLED);
        });
        TimeJob skipper = job("skipper").retries(3).build();
        TimeJob stopper = job("stopper").build();

        run(skipper, false);
        run(stopper, false);

        assertEquals(JobStatus.SKIPPED, stored(skipper).status());
        assertEquals(0, stored(skipper).retryCount());
        assertTrue(sleeps.isEmpty());
        assertEquals(JobStatus.CANCELLED, stored(stopper).status());
    }

    @Test
    void cancellationEndsARunningJob() {
        functions.register("slow", ctx -> Thread.sleep(10_000));
        TimeJob job = job("slow").retries(2).build();
        timeJobs.save(job);

        CompletableFuture<Void> running = CompletableFuture.runAsync(
                () -> engine.execute(new ExecutionContexts(functions).of(stored(job)), false));
        await().atMost(Duration.ofSeconds(2)).until(() -> cancellations.runningIds().contains(job.id()));

        assertTrue(cancellations.cancel(job.id()));
        running.join();

        assertEquals(JobStatus.CANCELLED, stored(job).status());
        assertEquals(List.of("cancelled"), handled);
        assertTrue(sleeps.isEmpty());
        assertEquals(0, cancellations.size());
    }

    @Test
    void missingDelegateFailsRootWithoutRetry() {
        TimeJob job = job("unknown").retries(3).build();

        run(job, false);

        assertEquals(JobStatus.FAILED, stored(job).status());
        assertTrue(stored(job).exception().contains("unknown"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void missingDelegateSkipsChild() {
        functions.register("parent", ctx -> {
        });
        TimeJob orphan = child("unknown", RunCondition.ON_SUCCESS);
        TimeJob job = job("parent").child(orphan).build();

        run(job, false);

        assertEquals(JobStatus.DONE, stored(job).status());
        assertEquals(JobStatus.SKIPPED, timeJobs.findById(orphan.id()).orElseThrow().status());
    }

    @Test
    void payloadIsLoadedLazily() {
        List<String> seen = new CopyOnWriteArrayList<>();
        functions.register("reader", ctx -> seen.add(ctx.payloadAsString()));
        TimeJob job = job("reader").payload("report-42".getBytes()).build();

        run(job, false);

        assertEquals(List.of("report-42"), seen);
    }

    @Test
    void errorThrownByJobFailsTheUnitAndGatesChildren() {
        functions.register("asserting", ctx -> {
            throw new AssertionError("boom");
        });
        functions.register("child", ctx -> {
        });
        TimeJob onFailure = child("child", RunCondition.ON_FAILURE);
        TimeJob job = job("asserting").retries(1).retryIntervals(2).child(onFailure).build();

        assertDoesNotThrow(() -> run(job, false));

        TimeJob result = stored(job);
        assertEquals(JobStatus.FAILED, result.status());
        assertNull(result.lockHolder());
        assertTrue(result.exception().contains("boom"));
        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
        assertEquals(List.of("exception:boom"), handled);
        assertEquals(JobStatus.DONE, timeJobs.findById(onFailure.id()).orElseThrow().status());
        assertEquals(0, cancellations.size());
    }

    @Test
    void jobCancellingItselfEndsCancelled() {
        functions.register("quitter", JobContext::requestCancel);
        TimeJob job = job("quitter").retries(3).build();

        run(job, false);

        assertEquals(JobStatus.CANCELLED, stored(job).status());
        assertNull(stored(job).lockHolder());
        assertEquals(List.of("cancelled"), handled);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void overlappingOccurrenceOfTheSameDefinitionSkipsItself() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        functions.register("exclusive", ctx -> {
            ctx.skipIfAlreadyRunning();
            firstStarted.countDown();
            releaseFirst.await(5, TimeUnit.SECONDS);
        });
        CronJob definition = CronJob.builder()
                .id(UUID.randomUUID())
                .function("exclusive")
                .expression("* * * * * *")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
        cronJobs.save(definition);
        ExecutionContexts contexts = new ExecutionContexts(functions);
        ExecutionContext first = contexts.of(runningOccurrence(definition, NOW), definition);
        ExecutionContext second = contexts.of(runningOccurrence(definition, NOW.plusSeconds(1)), definition);

        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> engine.execute(first, false));
        assertTrue(firstStarted.await(2, TimeUnit.SECONDS));

        engine.execute(second, false);

        Occurrence skipped = occurrences.findById(second.jobId()).orElseThrow();
        assertEquals(JobStatus.SKIPPED, skipped.status());
        assertEquals("Another occurrence of exclusive is already running", skipped.exception());

        releaseFirst.countDown();
        running.join();
        assertEquals(JobStatus.DONE, occurrences.findById(first.jobId()).orElseThrow().status());
    }

    private static Occurrence runningOccurrence(CronJob definition, Instant at) {
        Occurrence occurrence = Occurrence.builder()
                .id(UUID.randomUUID())
                .kind(JobKind.CRON)
                .definitionId(definition.id())
                .executionTime(at)
                .status(JobStatus.IN_PROGRESS)
                .lockHolder("node-a")
                .lockedAt(NOW)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
        occurrences.insert(occurrence);
        return occurrence;
    }

    @Test
    void exceptionDetailsKeepTheTopLevelMessage() throws Exception {
        IOException root = new IOException("disk full");
        RuntimeException wrapped = new RuntimeException("report export failed", root);

        JsonNode details = new ObjectMapper().readTree(engine.exceptionJson(wrapped));

        assertEquals("report export failed", details.get("message").asText());
        assertEquals(root.getStackTrace()[0].toString(), details.get("stackTrace").asText());
    }

    @Test
    void backoffHelperClamps() {
        var context = new ExecutionContexts(functions).of(job("x").retries(4).retryIntervals(5, 7).build());
        assertEquals(Duration.ofSeconds(5), engine.backoff(context, 1));
        assertEquals(Duration.ofSeconds(7), engine.backoff(context, 2));
        assertEquals(Duration.ofSeconds(7), engine.backoff(context, 4));
    }
}
