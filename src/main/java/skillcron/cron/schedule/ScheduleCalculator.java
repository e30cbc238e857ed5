package skillcron.cron.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import skillcron.cron.model.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes when a schedule fires next.
 *
 * Stateless apart from the injected clock and a cache of parsed cron
 * expressions; safe to share between threads.
 */
public class ScheduleCalculator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleCalculator.class);

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final Clock clock;
    private final ZoneId defaultZone;
    private final Map<String, ExecutionTime> parsed = new ConcurrentHashMap<>();

    public ScheduleCalculator(Clock clock, ZoneId defaultZone) {
        this.clock = clock;
        this.defaultZone = defaultZone;
    }

    public Clock clock() {
        return clock;
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }

    /**
     * Next fire time for a schedule that has never run.
     */
    public Long computeNextRunAtMs(Schedule schedule) {
        return computeNextRunAtMs(schedule, null);
    }

    /**
     * Next fire time of a schedule.
     *
     * For an interval schedule whose naive next time has already passed
     * (the process was down for one or more intervals) the result is
     * re-anchored to one interval from now; missed intervals are not
     * caught up.
     *
     * @param schedule    the schedule
     * @param lastRunAtMs when the job last ran, or null
     * @return epoch millis of the next run, or null if the schedule never fires again
     */
    public Long computeNextRunAtMs(Schedule schedule, Long lastRunAtMs) {
        long now = clock.millis();

        if (schedule instanceof Schedule.At at) {
            return at.atMs() > now ? at.atMs() : null;
        }

        if (schedule instanceof Schedule.Every every) {
            long base = lastRunAtMs != null ? lastRunAtMs : now;
            long next = base + every.everyMs();
            return next > now ? next : now + every.everyMs();
        }

        Schedule.Cron cron = (Schedule.Cron) schedule;
        ZonedDateTime zonedNow = Instant.ofEpochMilli(now).atZone(zoneOf(cron));
        Optional<ZonedDateTime> next = executionTime(cron.expr()).nextExecution(zonedNow);
        return next.map(t -> t.toInstant().toEpochMilli()).orElse(null);
    }

    /**
     * Check a cron expression.
     *
     * @return null if the expression is valid, otherwise a description of the problem
     */
    public static String validateCronExpr(String expr) {
        if (expr == null || expr.isBlank()) {
            return "cron expression is required";
        }
        try {
            PARSER.parse(expr.trim()).validate();
            return null;
        } catch (IllegalArgumentException e) {
            return e.getMessage() != null ? e.getMessage() : "invalid cron expression";
        }
    }

    private ExecutionTime executionTime(String expr) {
        return parsed.computeIfAbsent(expr, e -> {
            Cron cron = PARSER.parse(e);
            return ExecutionTime.forCron(cron.validate());
        });
    }

    private ZoneId zoneOf(Schedule.Cron cron) {
        if (cron.tz() == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(cron.tz());
        } catch (DateTimeException e) {
            log.warn("Unknown time zone '{}' on cron schedule, using {}", cron.tz(), defaultZone);
            return defaultZone;
        }
    }
}
