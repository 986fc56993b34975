package tempo.scheduler.core;

/**
 * A named unit of host code the scheduler can run.
 */
@FunctionalInterface
public interface JobFunction {

    /**
     * Run the job. Throwing marks the attempt as failed (and retried while
     * retries remain); throwing {@link TerminateExecutionException} ends the
     * run with the status it carries.
     */
    void execute(JobContext context) throws Exception;
}
