package tempo.scheduler.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing debounce for restart requests: a burst of requests results in
 * a single run of the action, {@code delay} after the last request.
 */
public final class RestartThrottle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RestartThrottle.class);

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tempo-restart-throttle");
        t.setDaemon(true);
        return t;
    });
    private final long delayMs;
    private final Runnable action;
    private ScheduledFuture<?> future;

    public RestartThrottle(Duration delay, Runnable action) {
        this.delayMs = delay.toMillis();
        this.action = action;
    }

    public synchronized void requestRestart() {
        if (ses.isShutdown()) {
            return;
        }
        if (future != null) {
            future.cancel(false);
        }
        future = ses.schedule(this::fire, delayMs, TimeUnit.MILLISECONDS);
    }

    private void fire() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Restart action failed", e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
