package tempo.scheduler.notify;

import java.time.Instant;

/**
 * Host-provided sink for scheduler events (dashboards, metrics, push channels).
 * Every callback defaults to a no-op so a host implements only what it needs.
 * Delivery is best effort: exceptions thrown here are logged, never propagated.
 */
public interface NotificationSender {

    NotificationSender NONE = new NotificationSender() {
    };

    default void jobAdded(JobNotification notification) {
    }

    default void jobUpdated(JobNotification notification) {
    }

    default void jobRemoved(JobNotification notification) {
    }

    default void activeWorkersChanged(int activeWorkers) {
    }

    /**
     * @param plannedAt next planned wake-up, null when nothing is planned
     */
    default void nextOccurrencePlanned(Instant plannedAt) {
    }

    default void hostException(String message) {
    }
}
