package tempo.scheduler.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * Trailing debounce for integer signals such as the active-worker count.
 * Only the latest value of a burst is delivered, and a non-zero value equal
 * to the last delivered one is dropped. Zero is always delivered.
 */
public final class NotifyDebounce implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotifyDebounce.class);

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tempo-notify-debounce");
        t.setDaemon(true);
        return t;
    });
    private final long delayMs;
    private final IntConsumer target;

    private ScheduledFuture<?> future;
    private Integer pending;
    private Integer lastDelivered;

    public NotifyDebounce(Duration delay, IntConsumer target) {
        this.delayMs = delay.toMillis();
        this.target = target;
    }

    /** Schedule delivery of {@code value}, replacing any pending one */
    public synchronized void notifySafely(int value) {
        pending = value;
        if (future != null) {
            future.cancel(false);
        }
        future = ses.schedule(this::deliver, delayMs, TimeUnit.MILLISECONDS);
    }

    /** Deliver the pending value now */
    public void flush() {
        synchronized (this) {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
        deliver();
    }

    private void deliver() {
        int value;
        synchronized (this) {
            if (pending == null) {
                return;
            }
            value = pending;
            pending = null;
            if (value != 0 && lastDelivered != null && lastDelivered == value) {
                return;
            }
            lastDelivered = value;
        }
        try {
            target.accept(value);
        } catch (Exception e) {
            log.warn("Debounced notification failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
