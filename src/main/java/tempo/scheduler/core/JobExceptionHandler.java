package tempo.scheduler.core;

import tempo.scheduler.model.JobKind;

import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Optional host hook for failed and cancelled runs.
 */
public interface JobExceptionHandler {

    JobExceptionHandler NONE = new JobExceptionHandler() {
        @Override
        public void onException(Throwable error, UUID jobId, JobKind kind) {
        }

        @Override
        public void onCancelled(CancellationException cancellation, UUID jobId, JobKind kind) {
        }
    };

    /** Called once a run has failed for good */
    void onException(Throwable error, UUID jobId, JobKind kind);

    void onCancelled(CancellationException cancellation, UUID jobId, JobKind kind);
}
