package tempo.scheduler.core;

import tempo.scheduler.model.CronJob;
import tempo.scheduler.model.ExecutionContext;
import tempo.scheduler.model.IntervalJob;
import tempo.scheduler.model.JobKind;
import tempo.scheduler.model.Occurrence;
import tempo.scheduler.model.TimeJob;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds execution contexts from claimed units.
 */
public final class ExecutionContexts {

    private final FunctionRegistry functions;

    public ExecutionContexts(FunctionRegistry functions) {
        this.functions = functions;
    }

    /** A time job with its whole child tree */
    public ExecutionContext of(TimeJob job) {
        ExecutionContext context = new ExecutionContext(job.id(), JobKind.TIME, job.function(), job.parentId(),
                job.executionTime(), job.retries(), job.retryCount(), job.retryIntervals(), job.runCondition(),
                job.status())
                .priority(functions.priorityOf(job.function()));
        for (TimeJob child : job.children()) {
            context.addChild(of(child));
        }
        return context;
    }

    public ExecutionContext of(Occurrence occurrence, CronJob definition) {
        return new ExecutionContext(occurrence.id(), JobKind.CRON, definition.function(), definition.id(),
                occurrence.executionTime(), definition.retries(), occurrence.retryCount(),
                definition.retryIntervals(), null, occurrence.status())
                .priority(functions.priorityOf(definition.function()));
    }

    public ExecutionContext of(Occurrence occurrence, IntervalJob definition) {
        return new ExecutionContext(occurrence.id(), JobKind.INTERVAL, definition.function(), definition.id(),
                occurrence.executionTime(), definition.retries(), occurrence.retryCount(),
                definition.retryIntervals(), null, occurrence.status())
                .priority(functions.priorityOf(definition.function()));
    }

    /** The given contexts followed by all of their descendants */
    public static List<ExecutionContext> flatten(List<ExecutionContext> roots) {
        List<ExecutionContext> all = new ArrayList<>();
        for (ExecutionContext root : roots) {
            all.add(root);
            all.addAll(flatten(root.children()));
        }
        return all;
    }
}
