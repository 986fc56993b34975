package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation token for one running unit.
 * Cancelling sets a flag, runs the registered callbacks and interrupts the
 * thread currently bound to the unit, if any.
 */
public final class CancellationHandle {

    private static final Logger log = LoggerFactory.getLogger(CancellationHandle.class);

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;
    private Thread boundThread;

    public boolean isCancelled() {
        return cancelled;
    }

    /** Run {@code callback} on cancellation, immediately if already cancelled */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled) {
            runQuietly(callback);
        }
    }

    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
        synchronized (this) {
            if (boundThread != null) {
                boundThread.interrupt();
            }
        }
    }

    /** Bind the calling thread so a cancel can interrupt it */
    public synchronized void bind() {
        boundThread = Thread.currentThread();
    }

    /**
     * Unbind the calling thread and clear any interrupt raised by a cancel,
     * so pooled threads are handed back clean.
     */
    public synchronized void unbind() {
        if (boundThread == Thread.currentThread()) {
            boundThread = null;
            Thread.interrupted();
        }
    }

    /** Throws if cancellation was requested */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Job was cancelled");
        }
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
