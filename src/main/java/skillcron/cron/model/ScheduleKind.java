package skillcron.cron.model;

import java.util.Locale;

/**
 * Discriminant of a {@link Schedule}.
 */
public enum ScheduleKind {
    /** Fires once at a fixed instant */
    AT,
    /** Fires at a fixed interval */
    EVERY,
    /** Fires on a five-field cron expression */
    CRON;

    /** Lower-case name used in JSON and the database. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduleKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("schedule kind is required");
        }
        try {
            return ScheduleKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown schedule kind: " + value);
        }
    }
}
