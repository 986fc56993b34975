package tempo.scheduler.service;

import org.junit.jupiter.api.*;
import tempo.scheduler.MutableClock;
import tempo.scheduler.TestDatabases;
import tempo.scheduler.config.Dependencies;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.core.JobExceptionHandler;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.RunCondition;
import tempo.scheduler.model.TimeJob;
import tempo.scheduler.notify.JobNotification;
import tempo.scheduler.notify.NotificationSender;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for scheduling and managing one-off jobs. The loop is never started.
 */
class TimeJobServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.123456789Z");

    private static List<String> events;
    private static Dependencies deps;
    private static TimeJobService service;

    @BeforeAll
    static void setup() {
        events = new CopyOnWriteArrayList<>();
        NotificationSender sender = new NotificationSender() {
            @Override
            public void jobAdded(JobNotification notification) {
                events.add("added:" + notification.id());
            }

            @Override
            public void jobUpdated(JobNotification notification) {
                events.add("updated:" + notification.id());
            }

            @Override
            public void jobRemoved(JobNotification notification) {
                events.add("removed:" + notification.id());
            }
        };
        FunctionRegistry functions = new FunctionRegistry()
                .register("report", ctx -> {
                })
                .register("cleanup", ctx -> {
                });
        deps = Dependencies.create(TestDatabases.config("test-time-service"), functions, sender,
                JobExceptionHandler.NONE, new MutableClock(NOW));
        service = deps.timeJobService();
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDatabases.clean(deps.database());
        events.clear();
    }

    private static TimeJob.Builder report() {
        return TimeJob.builder()
                .function("report")
                .executionTime(NOW.plusSeconds(60));
    }

    @Test
    void scheduleStampsTheWholeTree() {
        TimeJob grandchild = TimeJob.builder().function("cleanup").build();
        TimeJob child = TimeJob.builder()
                .function("cleanup")
                .executionTime(NOW.plusSeconds(999))
                .child(grandchild)
                .build();
        TimeJob failureChild = TimeJob.builder()
                .function("cleanup")
                .runCondition(RunCondition.ON_FAILURE)
                .build();

        TimeJob stored = service.schedule(report()
                .runCondition(RunCondition.ON_SUCCESS)
                .child(child)
                .child(failureChild)
                .build());

        assertNotNull(stored.id());
        assertNull(stored.runCondition());
        assertEquals(JobStatus.IDLE, stored.status());
        assertEquals(NOW.minusNanos(789), stored.createdAt());

        TimeJob loaded = service.find(stored.id()).orElseThrow();
        assertEquals(2, loaded.children().size());
        TimeJob loadedChild = loaded.children().stream()
                .filter(c -> c.runCondition() == RunCondition.ON_ANY_COMPLETED_STATUS)
                .findFirst().orElseThrow();
        assertEquals(stored.id(), loadedChild.parentId());
        assertNull(loadedChild.executionTime());
        assertEquals(1, loadedChild.children().size());
        assertEquals(loadedChild.id(), loadedChild.children().get(0).parentId());
        assertTrue(loaded.children().stream().anyMatch(c -> c.runCondition() == RunCondition.ON_FAILURE));

        assertEquals(List.of("added:" + stored.id()), events);
    }

    @Test
    void scheduleRequiresAnExecutionTime() {
        JobValidationException error = assertThrows(JobValidationException.class,
                () -> service.schedule(TimeJob.builder().function("report").build()));
        assertTrue(error.getMessage().contains("Execution time is required"));
    }

    @Test
    void scheduleRejectsUnknownFunctionsAnywhereInTheTree() {
        TimeJob job = report()
                .child(TimeJob.builder().function("missing").build())
                .build();

        JobValidationException error = assertThrows(JobValidationException.class, () -> service.schedule(job));
        assertEquals("Function 'missing' is not registered", error.getMessage());
        assertTrue(service.list(10).isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    void updateChangesTheSchedule() {
        TimeJob stored = service.schedule(report().build());

        TimeJob updated = service.update(stored.toBuilder()
                .function("cleanup")
                .executionTime(NOW.plusSeconds(120))
                .retries(2)
                .build());

        TimeJob loaded = service.find(stored.id()).orElseThrow();
        assertEquals("cleanup", loaded.function());
        assertEquals(NOW.plusSeconds(120), loaded.executionTime());
        assertEquals(2, loaded.retries());
        assertEquals(updated.updatedAt(), loaded.updatedAt());
        assertEquals("updated:" + stored.id(), events.get(events.size() - 1));
    }

    @Test
    void updateRejectsUnknownAndRunningJobs() {
        assertThrows(JobValidationException.class,
                () -> service.update(report().id(UUID.randomUUID()).build()));

        TimeJob stored = service.schedule(report().build());
        deps.timeJobRepository().updateStatus(List.of(stored.id()), JobStatus.IN_PROGRESS, null, false, NOW);

        JobValidationException error = assertThrows(JobValidationException.class,
                () -> service.update(stored.toBuilder().retries(1).build()));
        assertTrue(error.getMessage().contains("is running"));
    }

    @Test
    void deleteRemovesTheTree() {
        TimeJob child = TimeJob.builder().function("cleanup").build();
        TimeJob stored = service.schedule(report().child(child).build());
        UUID childId = service.find(stored.id()).orElseThrow().children().get(0).id();

        assertTrue(service.delete(stored.id()));

        assertTrue(service.find(stored.id()).isEmpty());
        assertTrue(service.find(childId).isEmpty());
        assertEquals("removed:" + stored.id(), events.get(events.size() - 1));
        assertFalse(service.delete(stored.id()));
    }

    @Test
    void cancelOfAJobThatIsNotRunningIsFalse() {
        TimeJob stored = service.schedule(report().build());

        assertFalse(service.cancel(stored.id()));
    }

    @Test
    void listReturnsRootsOnly() {
        service.schedule(report().child(TimeJob.builder().function("cleanup").build()).build());
        service.schedule(report().build());

        List<TimeJob> roots = service.list(10);

        assertEquals(2, roots.size());
        assertTrue(roots.stream().allMatch(TimeJob::isRoot));
    }
}
