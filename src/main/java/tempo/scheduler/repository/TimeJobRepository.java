package tempo.scheduler.repository;

import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobStatus;
import tempo.scheduler.model.TimeJob;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for one-off job persistence.
 * Every claim is optimistic: a write commits only if the stored
 * {@code updatedAt} still equals the value that was read.
 */
public interface TimeJobRepository {

    /**
     * Save a job together with its whole child tree.
     *
     * @param job root job, with ids and timestamps already assigned
     */
    void save(TimeJob job);

    /**
     * Overwrite the schedulable fields of an existing job (function, payload,
     * execution time, retry policy, description).
     *
     * @param job the job with new values
     * @return true if a row was updated
     */
    boolean update(TimeJob job);

    /**
     * Find a job by ID, children loaded.
     *
     * @param id the job ID
     * @return the job if found
     */
    Optional<TimeJob> findById(UUID id);

    /**
     * List root jobs ordered by execution time, children loaded.
     *
     * @param limit maximum number of results
     * @return list of root jobs
     */
    List<TimeJob> findRoots(int limit);

    /**
     * Delete a job and, by cascade, its descendants.
     *
     * @param id the job ID
     * @return true if deleted
     */
    boolean delete(UUID id);

    /**
     * Earliest execution time among root jobs claimable by the node and
     * scheduled at or after {@code from}.
     *
     * @param nodeId the node asking
     * @param from   lower bound (inclusive)
     * @return the earliest execution time, if any
     */
    Optional<Instant> findEarliestExecutionTime(String nodeId, Instant from);

    /**
     * Claimable root jobs with execution time in [from, to).
     *
     * @param nodeId the node asking
     * @param from   lower bound (inclusive)
     * @param to     upper bound (exclusive)
     * @return jobs as read, children loaded
     */
    List<TimeJob> findClaimable(String nodeId, Instant from, Instant to);

    /**
     * Move an observed job to QUEUED under the node's lease.
     *
     * @param observed the job as previously read
     * @param nodeId   the claiming node
     * @param now      claim time, becomes lockedAt and updatedAt
     * @return the job after the claim, empty if another writer got there first
     */
    Optional<TimeJob> tryQueue(TimeJob observed, String nodeId, Instant now);

    /**
     * Idle or queued root jobs scheduled at or before the cutoff, regardless of holder.
     *
     * @param cutoff jobs due at or before this instant are timed out
     * @return timed-out jobs, children loaded
     */
    List<TimeJob> findTimedOut(Instant cutoff);

    /**
     * Force a timed-out job to IN_PROGRESS under the node's lease.
     *
     * @param observed the job as previously read
     * @param nodeId   the reclaiming node
     * @param now      write time
     * @return the job after the write, empty if it changed meanwhile
     */
    Optional<TimeJob> tryReclaim(TimeJob observed, String nodeId, Instant now);

    /**
     * Write the changed fields of a context to its job.
     *
     * @param context the execution context
     * @param now     becomes updatedAt
     * @return true if a row was updated
     */
    boolean applyUpdate(ExecutionContext context, Instant now);

    /**
     * Set a status on many jobs at once.
     *
     * @param ids     job IDs
     * @param status  new status
     * @param message exception text to store, may be null
     * @param releaseLock clear the lease as part of the write
     * @param now     becomes updatedAt
     * @return number of rows updated
     */
    int updateStatus(Collection<UUID> ids, JobStatus status, String message, boolean releaseLock, Instant now);

    /**
     * Return queued jobs held by the node to IDLE and clear their lease.
     *
     * @param ids    job IDs
     * @param nodeId the holder
     * @param now    becomes updatedAt
     * @return number of rows released
     */
    int release(Collection<UUID> ids, String nodeId, Instant now);

    /**
     * Release everything the node holds: QUEUED becomes IDLE, IN_PROGRESS becomes CANCELLED.
     *
     * @param nodeId the holder
     * @param now    becomes updatedAt
     * @return number of rows released
     */
    int releaseAll(String nodeId, Instant now);

    /**
     * Return every QUEUED or IN_PROGRESS job held by a dead node to IDLE.
     *
     * @param nodeId the dead node
     * @param now    becomes updatedAt
     * @return number of rows released
     */
    int releaseNode(String nodeId, Instant now);

    /**
     * Load the opaque payload of a job.
     *
     * @param id the job ID
     * @return payload bytes if present
     */
    Optional<byte[]> findPayload(UUID id);
}
