package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.scheduler.PollerStatus;

/**
 * Response DTO for scheduler status.
 * GET /api/v1/cron/status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
        @JsonProperty("running") boolean running,
        @JsonProperty("pollIntervalMs") long pollIntervalMs,
        @JsonProperty("nextWakeAtMs") Long nextWakeAtMs) {

    public static StatusResponse from(PollerStatus status) {
        return new StatusResponse(status.running(), status.intervalMs(), status.nextWakeAtMs());
    }
}
