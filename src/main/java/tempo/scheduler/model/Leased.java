package tempo.scheduler.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit that nodes claim through a lease (lock holder + lock timestamp).
 * The stored {@code updatedAt} doubles as the optimistic version.
 */
public interface Leased {

    UUID id();

    JobStatus status();

    String lockHolder();

    Instant lockedAt();

    Instant updatedAt();

    /**
     * A unit is claimable by a node when it is idle or queued and either
     * already held by that node or not locked at all.
     */
    default boolean isClaimableBy(String nodeId) {
        return status().isClaimable()
                && (nodeId.equals(lockHolder()) || lockedAt() == null);
    }
}
