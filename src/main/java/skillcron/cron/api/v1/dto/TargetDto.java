package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.JobTarget;
import skillcron.cron.model.TargetKind;

/**
 * Wire form of a job target: {@code {"type":"skill","id":"daily-report","query":"..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TargetDto(
        @JsonProperty("type") String type,
        @JsonProperty("id") String id,
        @JsonProperty("query") String query,
        @JsonProperty("profileId") String profileId) {

    public JobTarget toTarget() {
        return new JobTarget(TargetKind.fromWire(type), id, query, profileId);
    }

    public static TargetDto from(JobTarget target) {
        return new TargetDto(target.kind().wireName(), target.targetId(), target.query(), target.profileId());
    }
}
