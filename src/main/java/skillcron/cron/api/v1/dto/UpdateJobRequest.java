package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.service.JobPatch;

/**
 * Request DTO for a partial job update. Absent fields are left unchanged.
 * PATCH /api/v1/cron/jobs/{id}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("schedule") ScheduleDto schedule,
        @JsonProperty("target") TargetDto target,
        @JsonProperty("retry") RetryDto retry,
        @JsonProperty("notify") ChannelDto notifyChannel) {

    public JobPatch toPatch() {
        return new JobPatch(
                name,
                description,
                enabled,
                schedule != null ? schedule.toSchedule() : null,
                target != null ? target.toTarget() : null,
                retry != null ? retry.toPolicy() : null,
                notifyChannel != null ? notifyChannel.toChannel() : null);
    }
}
