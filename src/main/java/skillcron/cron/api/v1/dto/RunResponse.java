package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.Run;

import java.time.Instant;
import java.util.Locale;

/**
 * Response DTO for one entry of a job's run history.
 * GET /api/v1/cron/jobs/{id}/runs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("id") long id,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static RunResponse from(Run run) {
        return new RunResponse(
                run.id(),
                run.jobId(),
                run.sessionId(),
                run.status() != null ? run.status().name().toLowerCase(Locale.ROOT) : "running",
                run.error(),
                run.durationMs(),
                run.startedAt(),
                run.completedAt());
    }
}
