package tempo.scheduler.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunConditionTest {

    @Test
    void onSuccessMatchesDoneAndDueDone() {
        assertTrue(RunCondition.ON_SUCCESS.matches(JobStatus.DONE));
        assertTrue(RunCondition.ON_SUCCESS.matches(JobStatus.DUE_DONE));
        assertFalse(RunCondition.ON_SUCCESS.matches(JobStatus.FAILED));
    }

    @Test
    void failureAndCancellationConditions() {
        assertTrue(RunCondition.ON_FAILURE.matches(JobStatus.FAILED));
        assertFalse(RunCondition.ON_FAILURE.matches(JobStatus.CANCELLED));
        assertTrue(RunCondition.ON_CANCELLED.matches(JobStatus.CANCELLED));
        assertTrue(RunCondition.ON_FAILURE_OR_CANCELLED.matches(JobStatus.FAILED));
        assertTrue(RunCondition.ON_FAILURE_OR_CANCELLED.matches(JobStatus.CANCELLED));
        assertFalse(RunCondition.ON_FAILURE_OR_CANCELLED.matches(JobStatus.DONE));
    }

    @Test
    void skippedParentMatchesNothing() {
        for (RunCondition condition : RunCondition.values()) {
            assertFalse(condition.matches(JobStatus.SKIPPED), condition.name());
        }
    }

    @Test
    void anyCompletedStatus() {
        assertTrue(RunCondition.ON_ANY_COMPLETED_STATUS.matches(JobStatus.DONE));
        assertTrue(RunCondition.ON_ANY_COMPLETED_STATUS.matches(JobStatus.CANCELLED));
        assertFalse(RunCondition.ON_ANY_COMPLETED_STATUS.matches(JobStatus.IDLE));
    }
}
