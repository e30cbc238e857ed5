package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.TriggerResult;

/**
 * Response DTO for a manual run.
 * POST /api/v1/cron/jobs/{id}/run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("error") String error) {

    public static TriggerResponse from(TriggerResult result) {
        return new TriggerResponse(result.success(), result.sessionId(), result.error());
    }
}
