package tempo.scheduler.repository;

import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.Occurrence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for materialized cron and interval occurrences.
 * At most one occurrence exists per (kind, definition, execution time).
 */
public interface OccurrenceRepository {

    /**
     * Insert a new occurrence.
     *
     * @param occurrence the occurrence to insert
     * @return true if inserted, false if one already exists for the same instant
     */
    boolean insert(Occurrence occurrence);

    Optional<Occurrence> findById(UUID id);

    /**
     * Occurrences of one definition, newest first.
     *
     * @param kind         CRON or INTERVAL
     * @param definitionId the definition
     * @param limit        maximum number of results
     * @return list of occurrences
     */
    List<Occurrence> findByDefinition(JobKind kind, UUID definitionId, int limit);

    /**
     * Occurrences of the kind claimable by the node, at or after {@code from},
     * that fall in the same whole second as the earliest of them.
     *
     * @param kind   CRON or INTERVAL
     * @param nodeId the node asking
     * @param from   lower bound (inclusive)
     * @return the earliest occurrences ordered by execution time, empty if none
     */
    List<Occurrence> findEarliestClaimable(JobKind kind, String nodeId, Instant from);

    /**
     * Latest execution time per definition of the kind, any status.
     *
     * @param kind CRON or INTERVAL
     * @return definition id to latest execution time
     */
    Map<UUID, Instant> findLatestExecutionTimes(JobKind kind);

    /**
     * Move an observed occurrence to QUEUED under the node's lease.
     *
     * @return the occurrence after the claim, empty if another writer got there first
     */
    Optional<Occurrence> tryQueue(Occurrence observed, String nodeId, Instant now);

    /**
     * Idle or queued occurrences scheduled at or before the cutoff, regardless of holder.
     */
    List<Occurrence> findTimedOut(JobKind kind, Instant cutoff);

    /**
     * Force a timed-out occurrence to IN_PROGRESS under the node's lease.
     *
     * @return the occurrence after the write, empty if it changed meanwhile
     */
    Optional<Occurrence> tryReclaim(Occurrence observed, String nodeId, Instant now);

    boolean applyUpdate(ExecutionContext context, Instant now);

    /**
     * Move occurrences to IN_PROGRESS.
     *
     * @return number of rows updated
     */
    int markInProgress(Collection<UUID> ids, Instant now);

    int release(Collection<UUID> ids, String nodeId, Instant now);

    int releaseAll(String nodeId, Instant now);

    int releaseNode(String nodeId, Instant now);
}
