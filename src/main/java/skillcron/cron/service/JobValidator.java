package skillcron.cron.service;

import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Schedule;
import skillcron.cron.model.TargetKind;
import skillcron.cron.schedule.ScheduleCalculator;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Validates job definitions before they are persisted.
 * Every problem is reported as an {@link IllegalArgumentException}.
 */
public final class JobValidator {

    private JobValidator() {
    }

    public static void validate(String name, Schedule schedule, JobTarget target, RetryPolicy retryPolicy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        validateSchedule(schedule);
        validateTarget(target);
        validateRetryPolicy(retryPolicy);
    }

    public static void validateSchedule(Schedule schedule) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule is required");
        }

        if (schedule instanceof Schedule.At at) {
            if (at.atMs() < 0) {
                throw new IllegalArgumentException("atMs must not be negative");
            }
        } else if (schedule instanceof Schedule.Every every) {
            if (every.everyMs() <= 0) {
                throw new IllegalArgumentException("everyMs must be positive");
            }
        } else if (schedule instanceof Schedule.Cron cron) {
            String problem = ScheduleCalculator.validateCronExpr(cron.expr());
            if (problem != null) {
                throw new IllegalArgumentException("invalid cron expression '" + cron.expr() + "': " + problem);
            }
            if (cron.tz() != null) {
                try {
                    ZoneId.of(cron.tz());
                } catch (DateTimeException e) {
                    throw new IllegalArgumentException("unknown time zone: " + cron.tz());
                }
            }
        }
    }

    public static void validateTarget(JobTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
        if (target.kind() != TargetKind.SKILL) {
            throw new IllegalArgumentException("unsupported target type: " + target.kind().wireName());
        }
        if (target.targetId() == null || target.targetId().isBlank()) {
            throw new IllegalArgumentException("target id is required");
        }
    }

    public static void validateRetryPolicy(RetryPolicy retryPolicy) {
        if (retryPolicy == null) {
            return;
        }
        if (retryPolicy.maxRetries() < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (retryPolicy.backoffMs() < 0) {
            throw new IllegalArgumentException("backoffMs must not be negative");
        }
    }
}
