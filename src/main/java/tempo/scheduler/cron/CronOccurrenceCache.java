package tempo.scheduler.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses and memoizes cron expressions, and computes the next fire time
 * after a given instant on the wall clock of the configured zone.
 *
 * <p>
 * Expressions have six fields (second, minute, hour, day-of-month, month,
 * day-of-week). A five-field expression fires at second 0.
 *
 * <p>
 * DST handling:
 * <ul>
 * <li>a fire time inside a spring-forward gap resolves to the instant the gap ends</li>
 * <li>a fire time inside a fall-back overlap resolves to the earliest offset that
 * is still after the requested instant</li>
 * </ul>
 */
public class CronOccurrenceCache {

    private static final Logger log = LoggerFactory.getLogger(CronOccurrenceCache.class);

    private static final int MAX_RESOLVE_STEPS = 8;

    private final CronParser parser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    private final Map<String, Optional<ExecutionTime>> cache = new ConcurrentHashMap<>();
    private final ZoneId zone;

    public CronOccurrenceCache(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Next fire time strictly after {@code after}.
     *
     * @param expression cron expression
     * @param after      lower bound (exclusive)
     * @return next fire time, empty for an invalid or exhausted expression
     */
    public Optional<Instant> nextOccurrence(String expression, Instant after) {
        Optional<ExecutionTime> executionTime = lookup(expression);
        if (executionTime.isEmpty()) {
            return Optional.empty();
        }

        // Evaluate on wall-clock time, then map back through the zone rules
        LocalDateTime cursor = LocalDateTime.ofInstant(after, zone).minusSeconds(1);
        for (int step = 0; step < MAX_RESOLVE_STEPS; step++) {
            Optional<ZonedDateTime> next = executionTime.get().nextExecution(cursor.atZone(ZoneOffset.UTC));
            if (next.isEmpty()) {
                return Optional.empty();
            }

            LocalDateTime local = next.get().toLocalDateTime();
            Instant resolved = resolve(local, after);
            if (resolved.isAfter(after)) {
                return Optional.of(resolved);
            }
            cursor = local;
        }

        log.warn("No fire time found for '{}' after {}", expression, after);
        return Optional.empty();
    }

    public boolean isValid(String expression) {
        return expression != null && lookup(expression).isPresent();
    }

    /** Drop a cached entry, e.g. after a definition changed */
    public void invalidate(String expression) {
        if (expression != null) {
            cache.remove(normalize(expression));
        }
    }

    public int size() {
        return cache.size();
    }

    private Optional<ExecutionTime> lookup(String expression) {
        return cache.computeIfAbsent(normalize(expression), this::parse);
    }

    private Optional<ExecutionTime> parse(String normalized) {
        String[] fields = normalized.split(" ");
        String sixFields = fields.length == 5 ? "0 " + normalized : normalized;
        try {
            Cron cron = parser.parse(sixFields).validate();
            return Optional.of(ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            log.debug("Invalid cron expression '{}': {}", normalized, e.getMessage());
            return Optional.empty();
        }
    }

    private Instant resolve(LocalDateTime local, Instant after) {
        ZoneOffsetTransition transition = zone.getRules().getTransition(local);
        if (transition == null) {
            return local.atZone(zone).toInstant();
        }
        if (transition.isGap()) {
            return transition.getInstant();
        }
        Instant earlier = local.atOffset(transition.getOffsetBefore()).toInstant();
        if (earlier.isAfter(after)) {
            return earlier;
        }
        return local.atOffset(transition.getOffsetAfter()).toInstant();
    }

    static String normalize(String expression) {
        return expression.trim().replaceAll("\\s+", " ");
    }
}
