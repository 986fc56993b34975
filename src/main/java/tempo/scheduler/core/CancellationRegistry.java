package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.JobKind;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live cancellation handles of the units running on this node, by unit id.
 */
public final class CancellationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CancellationRegistry.class);

    /**
     * @param parentId parent time job, or the definition id for occurrences
     */
    public record Entry(String functionName, JobKind kind, CancellationHandle handle, boolean due, UUID parentId) {
    }

    private final Map<UUID, Entry> entries = new ConcurrentHashMap<>();

    public void register(UUID id, Entry entry) {
        entries.put(id, entry);
    }

    public Entry get(UUID id) {
        return entries.get(id);
    }

    public boolean remove(UUID id) {
        return entries.remove(id) != null;
    }

    /**
     * Cancel a running unit, then forget it.
     *
     * @return true if the unit was running here
     */
    public boolean cancel(UUID id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return false;
        }
        entry.handle().cancel();
        entries.remove(id);
        log.debug("Cancelled running job {} ({})", id, entry.functionName());
        return true;
    }

    public boolean isParentRunning(UUID parentId) {
        if (parentId == null)
            return false;
        return entries.values().stream()
                .anyMatch(e -> Objects.equals(parentId, e.parentId()));
    }

    public boolean isParentRunningExcludingSelf(UUID parentId, UUID selfId) {
        if (parentId == null)
            return false;
        return entries.entrySet().stream()
                .anyMatch(e -> !e.getKey().equals(selfId) && Objects.equals(parentId, e.getValue().parentId()));
    }

    public Set<UUID> runningIds() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
