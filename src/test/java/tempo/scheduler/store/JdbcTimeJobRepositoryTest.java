package tempo.scheduler.store;

import org.junit.jupiter.api.*;
import tempo.scheduler.TestDatabases;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.RunCondition;
import tempo.scheduler.model.TimeJob;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTimeJobRepositoryTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T11:00:00Z");
    private static final Instant DUE = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant CLAIM = Instant.parse("2024-05-01T11:59:59.500Z");

    private static Database db;
    private static JdbcTimeJobRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.open("test-time-jobs");
        repo = new JdbcTimeJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDatabases.clean(db);
    }

    private static TimeJob root(String function) {
        return TimeJob.builder()
                .id(UUID.randomUUID())
                .function(function)
                .executionTime(DUE)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
    }

    @Test
    void saveAndFindTree() {
        UUID rootId = UUID.randomUUID();
        TimeJob child = TimeJob.builder()
                .id(UUID.randomUUID())
                .function("notify")
                .runCondition(RunCondition.ON_FAILURE)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
        TimeJob job = root("report").toBuilder()
                .id(rootId)
                .payload("hello".getBytes(StandardCharsets.UTF_8))
                .retries(3)
                .retryIntervals(1, 2, 3)
                .child(child)
                .build();

        repo.save(job);

        TimeJob found = repo.findById(rootId).orElseThrow();
        assertEquals("report", found.function());
        assertEquals(DUE, found.executionTime());
        assertArrayEquals(new int[] { 1, 2, 3 }, found.retryIntervals());
        assertEquals(1, found.children().size());
        assertEquals(rootId, found.children().get(0).parentId());
        assertEquals(RunCondition.ON_FAILURE, found.children().get(0).runCondition());
        assertEquals("hello", new String(repo.findPayload(rootId).orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void onlyOneNodeWinsAClaim() {
        TimeJob job = root("report");
        repo.save(job);

        Optional<TimeJob> first = repo.tryQueue(job, "node-a", CLAIM);
        Optional<TimeJob> second = repo.tryQueue(job, "node-b", CLAIM);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());

        TimeJob stored = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.QUEUED, stored.status());
        assertEquals("node-a", stored.lockHolder());
        assertEquals(first.get().updatedAt(), stored.updatedAt());
    }

    @Test
    void leaseHidesJobFromOtherNodes() {
        TimeJob job = root("report");
        repo.save(job);
        repo.tryQueue(job, "node-a", CLAIM).orElseThrow();

        Instant second = DUE;
        assertEquals(1, repo.findClaimable("node-a", second, second.plusSeconds(1)).size());
        assertTrue(repo.findClaimable("node-b", second, second.plusSeconds(1)).isEmpty());
        assertTrue(repo.findEarliestExecutionTime("node-b", CREATED).isEmpty());
        assertEquals(DUE, repo.findEarliestExecutionTime("node-a", CREATED).orElseThrow());
    }

    @Test
    void reclaimIgnoresTheLease() {
        TimeJob job = root("report");
        repo.save(job);
        TimeJob queued = repo.tryQueue(job, "node-a", CLAIM).orElseThrow();

        List<TimeJob> timedOut = repo.findTimedOut(DUE.plusSeconds(5));
        assertEquals(1, timedOut.size());

        TimeJob reclaimed = repo.tryReclaim(timedOut.get(0), "node-b", DUE.plusSeconds(6)).orElseThrow();
        assertEquals(JobStatus.IN_PROGRESS, reclaimed.status());
        assertEquals("node-b", repo.findById(job.id()).orElseThrow().lockHolder());

        // the stale observation can no longer win
        assertTrue(repo.tryReclaim(queued, "node-c", DUE.plusSeconds(7)).isEmpty());
    }

    @Test
    void releaseAllIdlesQueuedAndCancelsRunning() {
        TimeJob queued = root("a");
        TimeJob running = root("b");
        repo.save(queued);
        repo.save(running);
        repo.tryQueue(queued, "node-a", CLAIM).orElseThrow();
        repo.tryQueue(running, "node-a", CLAIM).orElseThrow();
        repo.updateStatus(List.of(running.id()), JobStatus.IN_PROGRESS, null, false, CLAIM);

        assertEquals(2, repo.releaseAll("node-a", DUE));

        TimeJob idle = repo.findById(queued.id()).orElseThrow();
        assertEquals(JobStatus.IDLE, idle.status());
        assertNull(idle.lockHolder());
        assertNull(idle.lockedAt());
        assertEquals(JobStatus.CANCELLED, repo.findById(running.id()).orElseThrow().status());
    }

    @Test
    void releaseDeadNodeReturnsEverythingToIdle() {
        TimeJob running = root("b");
        repo.save(running);
        repo.tryQueue(running, "node-dead", CLAIM).orElseThrow();
        repo.updateStatus(List.of(running.id()), JobStatus.IN_PROGRESS, null, false, CLAIM);

        assertEquals(1, repo.releaseNode("node-dead", DUE));
        assertEquals(JobStatus.IDLE, repo.findById(running.id()).orElseThrow().status());
    }

    @Test
    void bulkStatusCarriesMessageAndReleasesLease() {
        TimeJob job = root("report");
        repo.save(job);
        repo.tryQueue(job, "node-a", CLAIM).orElseThrow();

        assertEquals(1, repo.updateStatus(List.of(job.id()), JobStatus.SKIPPED, "skipped", true, DUE));

        TimeJob stored = repo.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.SKIPPED, stored.status());
        assertEquals("skipped", stored.exception());
        assertNull(stored.lockHolder());
    }

    @Test
    void deleteCascadesToChildren() {
        TimeJob child = TimeJob.builder()
                .id(UUID.randomUUID())
                .function("child")
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
        TimeJob job = root("parent").toBuilder().child(child).build();
        repo.save(job);

        assertTrue(repo.delete(job.id()));
        assertTrue(repo.findById(job.id()).isEmpty());
        assertTrue(repo.findById(child.id()).isEmpty());
    }
}
