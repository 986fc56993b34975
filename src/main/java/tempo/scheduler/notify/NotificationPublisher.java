package tempo.scheduler.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * Guards every call into the host's {@link NotificationSender}.
 * A failing sender is logged and the scheduler carries on.
 */
public final class NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(NotificationPublisher.class);

    private final NotificationSender sender;

    public NotificationPublisher(NotificationSender sender) {
        this.sender = sender != null ? sender : NotificationSender.NONE;
    }

    public void added(JobNotification notification) {
        fire("jobAdded", s -> s.jobAdded(notification));
    }

    public void updated(JobNotification notification) {
        fire("jobUpdated", s -> s.jobUpdated(notification));
    }

    public void removed(JobNotification notification) {
        fire("jobRemoved", s -> s.jobRemoved(notification));
    }

    public void activeWorkers(int count) {
        fire("activeWorkersChanged", s -> s.activeWorkersChanged(count));
    }

    public void nextOccurrence(Instant plannedAt) {
        fire("nextOccurrencePlanned", s -> s.nextOccurrencePlanned(plannedAt));
    }

    public void hostException(String message) {
        fire("hostException", s -> s.hostException(message));
    }

    private void fire(String event, Consumer<NotificationSender> call) {
        try {
            call.accept(sender);
        } catch (Exception e) {
            log.warn("Notification sender failed on {}: {}", event, e.getMessage(), e);
        }
    }
}
