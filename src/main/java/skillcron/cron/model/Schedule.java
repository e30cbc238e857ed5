package skillcron.cron.model;

/**
 * When a job fires. Exactly one of three variants; the variant is the
 * discriminant, so a schedule can never carry fields of two kinds at once.
 */
public sealed interface Schedule permits Schedule.At, Schedule.Every, Schedule.Cron {

    ScheduleKind kind();

    static Schedule at(long atMs) {
        return new At(atMs);
    }

    static Schedule every(long everyMs) {
        return new Every(everyMs);
    }

    static Schedule cron(String expr, String tz) {
        return new Cron(expr, tz);
    }

    /** One-shot schedule. */
    record At(long atMs) implements Schedule {
        @Override
        public ScheduleKind kind() {
            return ScheduleKind.AT;
        }
    }

    /** Fixed interval schedule. */
    record Every(long everyMs) implements Schedule {
        public Every {
            if (everyMs <= 0) {
                throw new IllegalArgumentException("everyMs must be positive");
            }
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.EVERY;
        }
    }

    /**
     * Cron expression schedule.
     *
     * @param expr five-field expression (minute hour day-of-month month day-of-week)
     * @param tz   IANA zone id, or null for the configured default zone
     */
    record Cron(String expr, String tz) implements Schedule {
        public Cron {
            if (expr == null || expr.isBlank()) {
                throw new IllegalArgumentException("cron expression is required");
            }
            expr = expr.trim();
            if (tz != null && tz.isBlank()) {
                tz = null;
            }
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.CRON;
        }
    }
}
