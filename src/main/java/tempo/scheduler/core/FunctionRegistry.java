package tempo.scheduler.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tempo.scheduler.model.JobPriority;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to function lookup populated by the host before the scheduler starts.
 */
public final class FunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, RegisteredFunction> functions = new ConcurrentHashMap<>();

    public FunctionRegistry register(String name, JobFunction function) {
        return register(name, JobPriority.NORMAL, null, function);
    }

    public FunctionRegistry register(String name, JobPriority priority, JobFunction function) {
        return register(name, priority, null, function);
    }

    /**
     * Register a function.
     *
     * @param name           unique function name
     * @param priority       lane on the priority scheduler
     * @param cronExpression optional expression seeded as a cron definition on start
     * @param function       the code to run
     * @return this registry
     */
    public FunctionRegistry register(String name, JobPriority priority, String cronExpression,
            JobFunction function) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(function, "function is required");
        RegisteredFunction previous = functions.put(name,
                new RegisteredFunction(name, function, priority != null ? priority : JobPriority.NORMAL,
                        cronExpression));
        if (previous != null) {
            log.warn("Function {} registered twice, keeping the latest", name);
        }
        return this;
    }

    public Optional<RegisteredFunction> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return name != null && functions.containsKey(name);
    }

    public JobPriority priorityOf(String name) {
        return find(name).map(RegisteredFunction::priority).orElse(JobPriority.NORMAL);
    }

    /** Functions that declare a cron expression */
    public List<RegisteredFunction> cronFunctions() {
        return functions.values().stream()
                .filter(RegisteredFunction::hasCron)
                .toList();
    }

    public Collection<RegisteredFunction> all() {
        return List.copyOf(functions.values());
    }
}
