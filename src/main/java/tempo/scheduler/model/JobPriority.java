package tempo.scheduler.model;

/**
 * Priority class used when dispatching work to the worker pool.
 * Declaration order is dispatch order.
 */
public enum JobPriority {
    /** Runs on a dedicated thread, outside the bounded pool */
    LONG_RUNNING,
    HIGH,
    NORMAL,
    LOW
}
