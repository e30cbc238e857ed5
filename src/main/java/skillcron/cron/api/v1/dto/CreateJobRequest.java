package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.service.NewJob;

/**
 * Request DTO for creating a scheduled job.
 * POST /api/v1/cron/jobs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateJobRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("schedule") ScheduleDto schedule,
        @JsonProperty("target") TargetDto target,
        @JsonProperty("retry") RetryDto retry,
        @JsonProperty("source") ChannelDto source,
        @JsonProperty("notify") ChannelDto notifyChannel) {

    /** Validate the shape of the request; field values are checked by the service */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule is required");
        }
        if (target == null) {
            throw new IllegalArgumentException("target is required");
        }
    }

    public NewJob toNewJob() {
        return new NewJob(
                name,
                description,
                enabled,
                schedule.toSchedule(),
                target.toTarget(),
                retry != null ? retry.toPolicy() : null,
                source != null ? source.toChannel() : null,
                notifyChannel != null ? notifyChannel.toChannel() : null);
    }
}
