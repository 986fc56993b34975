package tempo.scheduler.repository;

import tempo.scheduler.model.IntervalJob;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for interval definitions.
 */
public interface IntervalJobRepository {

    void save(IntervalJob job);

    boolean update(IntervalJob job);

    Optional<IntervalJob> findById(UUID id);

    List<IntervalJob> findByIds(Collection<UUID> ids);

    List<IntervalJob> findAll();

    /**
     * Active definitions whose window contains the given instant or starts after it.
     *
     * @param now current time
     * @return active definitions
     */
    List<IntervalJob> findActive(Instant now);

    /**
     * Toggle the active flag.
     *
     * @return true if updated
     */
    boolean setActive(UUID id, boolean active, Instant now);

    /**
     * Record a successful execution: sets lastExecutedAt and increments executionCount.
     *
     * @param id         the definition ID
     * @param executedAt when the occurrence completed
     * @param now        becomes updatedAt
     * @return true if updated
     */
    boolean recordExecution(UUID id, Instant executedAt, Instant now);

    /**
     * Delete a definition and all of its occurrences.
     *
     * @param id the definition ID
     * @return true if deleted
     */
    boolean delete(UUID id);
}
