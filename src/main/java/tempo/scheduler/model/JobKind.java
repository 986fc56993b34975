package tempo.scheduler.model;

/**
 * Schedule kind of a unit.
 */
public enum JobKind {
    /** One-off job with an explicit execution time */
    TIME,
    /** Occurrence of a cron definition */
    CRON,
    /** Occurrence of an interval definition */
    INTERVAL
}
