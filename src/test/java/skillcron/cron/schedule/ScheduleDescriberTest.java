package skillcron.cron.schedule;

import skillcron.cron.model.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleDescriberTest {

    private final ScheduleDescriber describer = new ScheduleDescriber(ZoneId.of("Asia/Shanghai"));

    @Test
    void describesOneShotInZone() {
        long at = Instant.parse("2026-03-10T01:00:00Z").toEpochMilli();
        assertEquals("once at 2026-03-10 09:00:00", describer.describe(Schedule.at(at)));
    }

    @Test
    void describesIntervals() {
        assertEquals("every second", describer.describe(Schedule.every(1_000)));
        assertEquals("every 30 seconds", describer.describe(Schedule.every(30_000)));
        assertEquals("every minute", describer.describe(Schedule.every(60_000)));
        assertEquals("every 5 minutes", describer.describe(Schedule.every(300_000)));
        assertEquals("every 2 hours", describer.describe(Schedule.every(7_200_000)));
        assertEquals("every day", describer.describe(Schedule.every(86_400_000)));
        assertEquals("every 7 days", describer.describe(Schedule.every(7 * 86_400_000L)));
    }

    @Test
    void describesCommonCrons() {
        assertEquals("weekdays at 09:00", describer.describe(Schedule.cron("0 9 * * 1-5", null)));
        assertEquals("every hour on the hour", describer.describe(Schedule.cron("0 * * * *", "UTC")));
    }

    @Test
    void fallsBackToRawCron() {
        assertEquals("Cron: 15 3 * * 2", describer.describe(Schedule.cron("15 3 * * 2", null)));
    }
}
