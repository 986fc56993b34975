package tempo.scheduler.core;

import tempo.scheduler.model.JobStatus;

/**
 * Thrown from job code to stop a run early with a chosen status
 * (SKIPPED by default) instead of failing it.
 */
public class TerminateExecutionException extends RuntimeException {

    private final JobStatus status;

    public TerminateExecutionException(String message) {
        this(message, JobStatus.SKIPPED, null);
    }

    public TerminateExecutionException(String message, JobStatus status) {
        this(message, status, null);
    }

    public TerminateExecutionException(String message, JobStatus status, Throwable cause) {
        super(message, cause);
        this.status = status != null ? status : JobStatus.SKIPPED;
    }

    public JobStatus status() {
        return status;
    }

    /** Message persisted for the run: the inner cause's if any, else this one's */
    public String detail() {
        Throwable cause = getCause();
        if (cause != null && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return getMessage();
    }
}
