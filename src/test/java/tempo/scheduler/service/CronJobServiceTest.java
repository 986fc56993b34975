package tempo.scheduler.service;

import org.junit.jupiter.api.*;
import tempo.scheduler.MutableClock;
import tempo.scheduler.TestDatabases;
import tempo.scheduler.config.Dependencies;
import tempo.scheduler.core.FunctionRegistry;
import tempo.scheduler.core.JobExceptionHandler;
import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.JobPriority;
import tempo.scheduler.notify.NotificationSender;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CronJobServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private static Dependencies deps;
    private static CronJobService service;

    @BeforeAll
    static void setup() {
        FunctionRegistry functions = new FunctionRegistry()
                .register("nightly", JobPriority.LOW, "0 0 3 * * *", ctx -> {
                })
                .register("hourly", JobPriority.NORMAL, "0 * * * *", ctx -> {
                })
                .register("broken", JobPriority.NORMAL, "every tuesday", ctx -> {
                })
                .register("plain", ctx -> {
                });
        deps = Dependencies.create(TestDatabases.config("test-cron-service"), functions, NotificationSender.NONE,
                JobExceptionHandler.NONE, new MutableClock(NOW));
        service = deps.cronJobService();
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDatabases.clean(deps.database());
    }

    @Test
    void createAssignsIdAndTimestamps() {
        CronJob stored = service.create(CronJob.builder()
                .function("plain")
                .expression("*/10 * * * * *")
                .retries(2)
                .retryIntervals(5, 10)
                .build());

        assertNotNull(stored.id());
        assertEquals(NOW, stored.createdAt());
        CronJob loaded = service.find(stored.id()).orElseThrow();
        assertEquals("*/10 * * * * *", loaded.expression());
        assertArrayEquals(new int[] { 5, 10 }, loaded.retryIntervals());
    }

    @Test
    void invalidExpressionIsRejected() {
        JobValidationException error = assertThrows(JobValidationException.class,
                () -> service.create(CronJob.builder().function("plain").expression("not a cron").build()));
        assertEquals("Invalid cron expression: 'not a cron'", error.getMessage());
        assertTrue(service.list().isEmpty());
    }

    @Test
    void unknownFunctionIsRejected() {
        assertThrows(JobValidationException.class,
                () -> service.create(CronJob.builder().function("nope").expression("0 * * * * *").build()));
    }

    @Test
    void updateReplacesTheExpression() {
        CronJob stored = service.create(CronJob.builder().function("plain").expression("0 * * * * *").build());

        service.update(stored.toBuilder().expression("0 0 * * * *").build());

        CronJob loaded = service.find(stored.id()).orElseThrow();
        assertEquals("0 0 * * * *", loaded.expression());
        assertEquals(stored.createdAt(), loaded.createdAt());
    }

    @Test
    void updateOfUnknownJobFails() {
        assertThrows(JobValidationException.class, () -> service.update(CronJob.builder()
                .id(UUID.randomUUID())
                .function("plain")
                .expression("0 * * * * *")
                .build()));
    }

    @Test
    void deleteRemovesTheDefinition() {
        CronJob stored = service.create(CronJob.builder().function("plain").expression("0 * * * * *").build());

        assertTrue(service.delete(stored.id()));
        assertTrue(service.find(stored.id()).isEmpty());
        assertTrue(service.occurrences(stored.id()).isEmpty());
        assertFalse(service.delete(stored.id()));
    }

    @Test
    void seedingCreatesOneDefinitionPerValidCronFunction() {
        assertEquals(2, service.seedFromRegistry());

        assertEquals("0 0 3 * * *", deps.cronJobRepository().findByFunction("nightly").orElseThrow().expression());
        assertEquals("0 * * * *", deps.cronJobRepository().findByFunction("hourly").orElseThrow().expression());
        assertTrue(deps.cronJobRepository().findByFunction("broken").isEmpty());
        assertTrue(deps.cronJobRepository().findByFunction("plain").isEmpty());

        // a second start seeds nothing new
        assertEquals(0, service.seedFromRegistry());
        assertEquals(2, service.list().size());
    }
}
