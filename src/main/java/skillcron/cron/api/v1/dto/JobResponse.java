package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.Job;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for job details.
 * GET /api/v1/cron/jobs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("schedule") ScheduleDto schedule,
        @JsonProperty("scheduleDescription") String scheduleDescription,
        @JsonProperty("target") TargetDto target,
        @JsonProperty("retry") RetryDto retry,
        @JsonProperty("source") ChannelDto source,
        @JsonProperty("notify") ChannelDto notifyChannel,
        @JsonProperty("nextRunAtMs") Long nextRunAtMs,
        @JsonProperty("lastRunAtMs") Long lastRunAtMs,
        @JsonProperty("lastStatus") String lastStatus,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("running") boolean running,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    /** Create response from domain model */
    public static JobResponse from(Job job, String scheduleDescription) {
        return new JobResponse(
                job.id(),
                job.name(),
                job.description(),
                job.enabled(),
                ScheduleDto.from(job.schedule()),
                scheduleDescription,
                TargetDto.from(job.target()),
                RetryDto.from(job.retryPolicy()),
                ChannelDto.from(job.source()),
                ChannelDto.from(job.notifyChannel()),
                job.nextRunAtMs(),
                job.lastRunAtMs(),
                job.lastStatus() != null ? job.lastStatus().name().toLowerCase(Locale.ROOT) : null,
                job.lastError(),
                job.isRunning(),
                job.retryCount(),
                job.createdAt(),
                job.updatedAt());
    }
}
