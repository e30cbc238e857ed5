package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.Schedule;
import skillcron.cron.model.ScheduleKind;

/**
 * Wire form of a schedule.
 *
 * <pre>
 * {"kind":"at","atMs":1767225600000}
 * {"kind":"every","everyMs":3600000}
 * {"kind":"cron","expr":"0 9 * * 1-5","tz":"Europe/Berlin"}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleDto(
        @JsonProperty("kind") String kind,
        @JsonProperty("atMs") Long atMs,
        @JsonProperty("everyMs") Long everyMs,
        @JsonProperty("expr") String expr,
        @JsonProperty("tz") String tz) {

    /**
     * @throws IllegalArgumentException if the kind is unknown or its fields are missing
     */
    public Schedule toSchedule() {
        ScheduleKind scheduleKind = ScheduleKind.fromWire(kind);
        return switch (scheduleKind) {
            case AT -> {
                if (atMs == null)
                    throw new IllegalArgumentException("atMs is required for an 'at' schedule");
                yield Schedule.at(atMs);
            }
            case EVERY -> {
                if (everyMs == null)
                    throw new IllegalArgumentException("everyMs is required for an 'every' schedule");
                yield Schedule.every(everyMs);
            }
            case CRON -> Schedule.cron(expr, tz);
        };
    }

    public static ScheduleDto from(Schedule schedule) {
        if (schedule instanceof Schedule.At at) {
            return new ScheduleDto(ScheduleKind.AT.wireName(), at.atMs(), null, null, null);
        }
        if (schedule instanceof Schedule.Every every) {
            return new ScheduleDto(ScheduleKind.EVERY.wireName(), null, every.everyMs(), null, null);
        }
        Schedule.Cron cron = (Schedule.Cron) schedule;
        return new ScheduleDto(ScheduleKind.CRON.wireName(), null, null, cron.expr(), cron.tz());
    }
}
