package skillcron.cron.service;

import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Schedule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobValidatorTest {

    private static final JobTarget TARGET = JobTarget.skill("report", "q");

    private static String rejection(Runnable validation) {
        return assertThrows(IllegalArgumentException.class, validation::run).getMessage();
    }

    @Test
    void acceptsValidDefinitions() {
        assertDoesNotThrow(() -> JobValidator.validate("a", Schedule.at(0), TARGET, RetryPolicy.none()));
        assertDoesNotThrow(() -> JobValidator.validate("a", Schedule.every(1), TARGET, null));
        assertDoesNotThrow(() -> JobValidator.validate("a",
                Schedule.cron("0 9 * * 1-5", "Europe/Berlin"), TARGET, RetryPolicy.of(3, 0)));
    }

    @Test
    void rejectsMissingParts() {
        assertEquals("name is required", rejection(() -> JobValidator.validate(" ", Schedule.every(1), TARGET, null)));
        assertEquals("schedule is required", rejection(() -> JobValidator.validate("a", null, TARGET, null)));
        assertEquals("target is required", rejection(() -> JobValidator.validate("a", Schedule.every(1), null, null)));
        assertEquals("target id is required",
                rejection(() -> JobValidator.validateTarget(JobTarget.skill(" ", "q"))));
    }

    @Test
    void rejectsBadSchedules() {
        assertEquals("atMs must not be negative", rejection(() -> JobValidator.validateSchedule(Schedule.at(-1))));
        assertTrue(rejection(() -> JobValidator.validateSchedule(Schedule.cron("99 * * * *", null)))
                .startsWith("invalid cron expression '99 * * * *'"));
        assertEquals("unknown time zone: Nowhere/City",
                rejection(() -> JobValidator.validateSchedule(Schedule.cron("0 9 * * *", "Nowhere/City"))));
    }

    @Test
    void rejectsNegativeRetryPolicy() {
        assertEquals("maxRetries must not be negative",
                rejection(() -> JobValidator.validateRetryPolicy(RetryPolicy.of(-1, 0))));
        assertEquals("backoffMs must not be negative",
                rejection(() -> JobValidator.validateRetryPolicy(RetryPolicy.of(1, -5))));
    }
}
