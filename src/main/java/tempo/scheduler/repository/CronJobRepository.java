package tempo.scheduler.repository;

import tempo.scheduler.model.CronJob;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for cron definitions.
 */
public interface CronJobRepository {

    void save(CronJob job);

    boolean update(CronJob job);

    Optional<CronJob> findById(UUID id);

    List<CronJob> findByIds(Collection<UUID> ids);

    Optional<CronJob> findByFunction(String function);

    List<CronJob> findAll();

    /**
     * Delete a definition and all of its occurrences.
     *
     * @param id the definition ID
     * @return true if deleted
     */
    boolean delete(UUID id);
}
