package tempo.scheduler.core;

import tempo.scheduler.model.JobPriority;

/**
 * A function entry in the {@link FunctionRegistry}.
 *
 * @param cronExpression expression to seed a cron definition from, may be null
 */
public record RegisteredFunction(
        String name,
        JobFunction function,
        JobPriority priority,
        String cronExpression) {

    public boolean hasCron() {
        return cronExpression != null && !cronExpression.isBlank();
    }
}
