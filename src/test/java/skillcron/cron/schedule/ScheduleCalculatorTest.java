package skillcron.cron.schedule;

import skillcron.cron.model.Schedule;
import skillcron.cron.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleCalculatorTest {

    // 13:30 in Shanghai, 05:30 UTC
    private static final Instant NOW = Instant.parse("2026-03-10T05:30:00Z");

    private MutableClock clock;
    private ScheduleCalculator calculator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        calculator = new ScheduleCalculator(clock, ZoneId.of("Asia/Shanghai"));
    }

    @Test
    void atInFutureFiresAtThatInstant() {
        long at = NOW.plus(Duration.ofHours(2)).toEpochMilli();
        assertEquals(at, calculator.computeNextRunAtMs(Schedule.at(at)));
    }

    @Test
    void atInPastNeverFires() {
        long at = NOW.minus(Duration.ofMinutes(1)).toEpochMilli();
        assertNull(calculator.computeNextRunAtMs(Schedule.at(at)));
        assertNull(calculator.computeNextRunAtMs(Schedule.at(NOW.toEpochMilli())));
    }

    @Test
    void everyWithoutHistoryFiresOneIntervalFromNow() {
        assertEquals(NOW.toEpochMilli() + 60_000, calculator.computeNextRunAtMs(Schedule.every(60_000)));
    }

    @Test
    void everyFollowsLastRun() {
        long lastRun = NOW.toEpochMilli() - 10_000;
        assertEquals(lastRun + 60_000, calculator.computeNextRunAtMs(Schedule.every(60_000), lastRun));
    }

    @Test
    void everyReanchorsAfterDowntime() {
        long lastRun = NOW.toEpochMilli() - Duration.ofHours(5).toMillis();
        assertEquals(NOW.toEpochMilli() + 60_000, calculator.computeNextRunAtMs(Schedule.every(60_000), lastRun));
    }

    @Test
    void cronUsesDefaultZone() {
        // 09:00 Shanghai has passed today, next is tomorrow 09:00 +08:00
        Long next = calculator.computeNextRunAtMs(Schedule.cron("0 9 * * *", null));
        assertEquals(Instant.parse("2026-03-11T01:00:00Z").toEpochMilli(), next);
    }

    @Test
    void cronUsesScheduleZone() {
        Long next = calculator.computeNextRunAtMs(Schedule.cron("0 9 * * *", "UTC"));
        assertEquals(Instant.parse("2026-03-10T09:00:00Z").toEpochMilli(), next);
    }

    @Test
    void cronFallsBackToDefaultZoneForUnknownZone() {
        Long next = calculator.computeNextRunAtMs(Schedule.cron("0 9 * * *", "Mars/Olympus_Mons"));
        assertEquals(Instant.parse("2026-03-11T01:00:00Z").toEpochMilli(), next);
    }

    @Test
    void cronFollowsClock() {
        Long first = calculator.computeNextRunAtMs(Schedule.cron("*/15 * * * *", "UTC"));
        assertEquals(Instant.parse("2026-03-10T05:45:00Z").toEpochMilli(), first);

        clock.advance(Duration.ofMinutes(20));
        Long second = calculator.computeNextRunAtMs(Schedule.cron("*/15 * * * *", "UTC"));
        assertEquals(Instant.parse("2026-03-10T06:00:00Z").toEpochMilli(), second);
    }

    @Test
    void cronNextIsAlwaysInFuture() {
        clock.set(Instant.parse("2026-03-10T09:00:00Z"));
        Long next = calculator.computeNextRunAtMs(Schedule.cron("0 9 * * *", "UTC"));
        assertTrue(next > clock.millis());
    }

    @Test
    void validateCronExpr() {
        assertNull(ScheduleCalculator.validateCronExpr("0 9 * * 1-5"));
        assertNull(ScheduleCalculator.validateCronExpr("*/5 * * * *"));

        assertNotNull(ScheduleCalculator.validateCronExpr(null));
        assertNotNull(ScheduleCalculator.validateCronExpr("  "));
        assertNotNull(ScheduleCalculator.validateCronExpr("not a cron"));
        assertNotNull(ScheduleCalculator.validateCronExpr("61 * * * *"));
        assertNotNull(ScheduleCalculator.validateCronExpr("* * * *"));
    }
}
