package tempo.scheduler.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/tempo;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Node settings
    private String nodeId = defaultNodeId();
    private ZoneId timeZone = ZoneId.systemDefault();

    // Execution settings
    private int maxConcurrency = Math.min(64, Math.max(1, Runtime.getRuntime().availableProcessors()));
    private Duration defaultRetryInterval = Duration.ofSeconds(30);
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    // Polling settings
    private Duration timedOutGrace = Duration.ofSeconds(1);
    private Duration fallbackInterval = Duration.ofMillis(500);
    private Duration maxSleep = Duration.ofDays(1);
    private Duration restartDebounce = Duration.ofMillis(50);
    private Duration notifyDebounce = Duration.ofMillis(100);

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        // Override from environment variables
        String dbUrl = System.getenv("TEMPO_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String nodeId = System.getenv("TEMPO_NODE_ID");
        if (nodeId != null && !nodeId.isBlank()) {
            config.nodeId = nodeId;
        }

        String concurrency = System.getenv("TEMPO_MAX_CONCURRENCY");
        if (concurrency != null && !concurrency.isBlank()) {
            config.maxConcurrency = Integer.parseInt(concurrency);
        }

        String zone = System.getenv("TEMPO_TIME_ZONE");
        if (zone != null && !zone.isBlank()) {
            config.timeZone = ZoneId.of(zone);
        }

        return config;
    }

    private static String defaultNodeId() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "tempo-node";
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String nodeId() {
        return nodeId;
    }

    public ZoneId timeZone() {
        return timeZone;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public Duration defaultRetryInterval() {
        return defaultRetryInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration timedOutGrace() {
        return timedOutGrace;
    }

    public Duration fallbackInterval() {
        return fallbackInterval;
    }

    public Duration maxSleep() {
        return maxSleep;
    }

    public Duration restartDebounce() {
        return restartDebounce;
    }

    public Duration notifyDebounce() {
        return notifyDebounce;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public SchedulerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public SchedulerConfig withNodeId(String nodeId) {
        this.nodeId = nodeId;
        return this;
    }

    public SchedulerConfig withTimeZone(ZoneId zone) {
        this.timeZone = zone;
        return this;
    }

    public SchedulerConfig withMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
        return this;
    }

    public SchedulerConfig withDefaultRetryInterval(Duration interval) {
        this.defaultRetryInterval = interval;
        return this;
    }

    public SchedulerConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public SchedulerConfig withTimedOutGrace(Duration grace) {
        this.timedOutGrace = grace;
        return this;
    }

    public SchedulerConfig withFallbackInterval(Duration interval) {
        this.fallbackInterval = interval;
        return this;
    }

    public SchedulerConfig withMaxSleep(Duration maxSleep) {
        this.maxSleep = maxSleep;
        return this;
    }

    public SchedulerConfig withRestartDebounce(Duration debounce) {
        this.restartDebounce = debounce;
        return this;
    }

    public SchedulerConfig withNotifyDebounce(Duration debounce) {
        this.notifyDebounce = debounce;
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", maxConcurrency=" + maxConcurrency +
                ", timeZone=" + timeZone +
                '}';
    }
}
