package tempo.scheduler.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaultsAreUsable() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertNotNull(config.nodeId());
        assertFalse(config.nodeId().isBlank());
        assertTrue(config.maxConcurrency() >= 1 && config.maxConcurrency() <= 64);
        assertEquals(Duration.ofSeconds(1), config.timedOutGrace());
        assertEquals(Duration.ofSeconds(30), config.defaultRetryInterval());
        assertEquals(Duration.ofDays(1), config.maxSleep());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:"));
    }

    @Test
    void fluentSettersOverrideDefaults() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .withNodeId("node-7")
                .withMaxConcurrency(4)
                .withTimeZone(ZoneId.of("Europe/Berlin"))
                .withFallbackInterval(Duration.ofMillis(250))
                .withRestartDebounce(Duration.ofMillis(10));

        assertEquals("node-7", config.nodeId());
        assertEquals(4, config.maxConcurrency());
        assertEquals(ZoneId.of("Europe/Berlin"), config.timeZone());
        assertEquals(Duration.ofMillis(250), config.fallbackInterval());
        assertEquals(Duration.ofMillis(10), config.restartDebounce());
        assertTrue(config.toString().contains("node-7"));
    }
}
