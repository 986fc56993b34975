package tempo.scheduler.model;

/**
 * Rule deciding whether a child job runs, based on its parent's outcome.
 */
public enum RunCondition {
    ON_SUCCESS,
    ON_FAILURE,
    ON_CANCELLED,
    ON_FAILURE_OR_CANCELLED,
    ON_ANY_COMPLETED_STATUS,
    /** Starts together with the parent instead of after it */
    IN_PROGRESS;

    public boolean matches(JobStatus parentStatus) {
        return switch (this) {
            case IN_PROGRESS -> parentStatus == JobStatus.IN_PROGRESS;
            case ON_SUCCESS -> parentStatus == JobStatus.DONE || parentStatus == JobStatus.DUE_DONE;
            case ON_FAILURE -> parentStatus == JobStatus.FAILED;
            case ON_CANCELLED -> parentStatus == JobStatus.CANCELLED;
            case ON_FAILURE_OR_CANCELLED -> parentStatus == JobStatus.FAILED || parentStatus == JobStatus.CANCELLED;
            case ON_ANY_COMPLETED_STATUS -> parentStatus == JobStatus.DONE
                    || parentStatus == JobStatus.DUE_DONE
                    || parentStatus == JobStatus.FAILED
                    || parentStatus == JobStatus.CANCELLED;
        };
    }
}
