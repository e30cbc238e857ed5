package skillcron.cron.schedule;

import skillcron.cron.model.Schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Human-readable schedule descriptions for list views.
 * Cosmetic only; nothing in the scheduler reads these strings.
 */
public final class ScheduleDescriber {

    private static final long SECOND = 1_000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private static final DateTimeFormatter AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Map<String, String> COMMON_CRONS = Map.of(
            "0 * * * *", "every hour on the hour",
            "0 0 * * *", "every day at 00:00",
            "0 9 * * *", "every day at 09:00",
            "0 9 * * 1-5", "weekdays at 09:00",
            "0 0 * * 0", "every Sunday at 00:00",
            "0 0 1 * *", "on the 1st of every month at 00:00");

    private final ZoneId zone;

    public ScheduleDescriber(ZoneId zone) {
        this.zone = zone;
    }

    public String describe(Schedule schedule) {
        if (schedule instanceof Schedule.At at) {
            return "once at " + AT_FORMAT.format(Instant.ofEpochMilli(at.atMs()).atZone(zone));
        }

        if (schedule instanceof Schedule.Every every) {
            long ms = every.everyMs();
            if (ms < MINUTE)
                return every(Math.round((double) ms / SECOND), "second");
            if (ms < HOUR)
                return every(Math.round((double) ms / MINUTE), "minute");
            if (ms < DAY)
                return every(Math.round((double) ms / HOUR), "hour");
            return every(Math.round((double) ms / DAY), "day");
        }

        Schedule.Cron cron = (Schedule.Cron) schedule;
        String known = COMMON_CRONS.get(cron.expr());
        return known != null ? known : "Cron: " + cron.expr();
    }

    private static String every(long n, String unit) {
        return n == 1 ? "every " + unit : "every " + n + " " + unit + "s";
    }
}
