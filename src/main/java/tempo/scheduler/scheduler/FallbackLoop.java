package tempo.scheduler.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.core.TimeoutReclaimer;
import tempo.scheduler.model.ExecutionContext;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that keeps sweeping for units nobody ran on time.
 *
 * Reclaimed units are dispatched as due. After a productive sweep the loop
 * looks again almost immediately; otherwise it waits the fallback interval.
 */
public class FallbackLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FallbackLoop.class);

    static final Duration BUSY_INTERVAL = Duration.ofMillis(10);

    private final TimeoutReclaimer reclaimer;
    private final SchedulerLoop dispatcher;
    private final Duration interval;

    private volatile boolean running = false;
    private volatile CountDownLatch stopSignal;
    private Thread thread;

    public FallbackLoop(TimeoutReclaimer reclaimer, SchedulerLoop dispatcher, Duration interval) {
        this.reclaimer = reclaimer;
        this.dispatcher = dispatcher;
        this.interval = interval;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Fallback loop already running");
            return;
        }
        running = true;
        stopSignal = new CountDownLatch(1);

        thread = new Thread(this::run, "tempo-fallback-loop");
        thread.setDaemon(true);
        thread.start();
        log.info("Fallback loop started, sweeping every {}ms", interval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        stopSignal.countDown();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Fallback loop stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One sweep: reclaim timed-out units and dispatch them.
     *
     * @return number of units dispatched
     */
    public int sweepOnce() {
        List<ExecutionContext> reclaimed = reclaimer.sweepTimedOut();
        if (!reclaimed.isEmpty()) {
            dispatcher.dispatch(reclaimed, true);
        }
        return reclaimed.size();
    }

    private void run() {
        while (running) {
            Duration wait;
            try {
                wait = sweepOnce() > 0 ? BUSY_INTERVAL : interval;
            } catch (Exception e) {
                log.error("Fallback loop error", e);
                wait = interval;
            }

            try {
                if (stopSignal.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
