package tempo.scheduler.service;

/**
 * Rejected management request: unknown function, bad cron expression,
 * missing execution time and the like.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }
}
