package skillcron.cron.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTest {

    @Test
    void everyMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> Schedule.every(0));
        assertThrows(IllegalArgumentException.class, () -> Schedule.every(-1));
    }

    @Test
    void cronIsNormalised() {
        Schedule.Cron cron = (Schedule.Cron) Schedule.cron("  0 9 * * *  ", " ");
        assertEquals("0 9 * * *", cron.expr());
        assertNull(cron.tz());
        assertThrows(IllegalArgumentException.class, () -> Schedule.cron(" ", null));
    }

    @Test
    void kindsRoundTripThroughWireNames() {
        for (ScheduleKind kind : ScheduleKind.values()) {
            assertEquals(kind, ScheduleKind.fromWire(kind.wireName()));
        }
        assertEquals(ScheduleKind.CRON, ScheduleKind.fromWire(" Cron "));
        assertThrows(IllegalArgumentException.class, () -> ScheduleKind.fromWire("weekly"));
    }
}
