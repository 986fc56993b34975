package tempo.scheduler.model;

/**
 * Lifecycle status shared by one-off jobs and occurrences.
 */
public enum JobStatus {
    /** Waiting to be claimed */
    IDLE,
    /** Claimed by a node, waiting for its execution instant */
    QUEUED,
    /** Handed to a worker */
    IN_PROGRESS,
    /** Completed successfully on time */
    DONE,
    /** Completed successfully after being reclaimed as timed out */
    DUE_DONE,
    /** Failed after exhausting retries */
    FAILED,
    /** Cancelled cooperatively */
    CANCELLED,
    /** Not executed: run condition mismatch or terminated by the job itself */
    SKIPPED;

    /** Check if a node may still claim a unit in this status */
    public boolean isClaimable() {
        return this == IDLE || this == QUEUED;
    }

    /** Check if status is terminal */
    public boolean isTerminal() {
        return this == DONE || this == DUE_DONE || this == FAILED
                || this == CANCELLED || this == SKIPPED;
    }

    /** Check if status counts as a successful completion */
    public boolean isSuccess() {
        return this == DONE || this == DUE_DONE;
    }
}
