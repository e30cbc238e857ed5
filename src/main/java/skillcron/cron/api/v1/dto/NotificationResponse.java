package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.Notification;

import java.time.Instant;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationResponse(
        @JsonProperty("id") long id,
        @JsonProperty("type") String type,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("read") boolean read,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("createdAt") Instant createdAt) {

    public static NotificationResponse from(Notification n) {
        return new NotificationResponse(
                n.id(),
                n.type().name().toLowerCase(Locale.ROOT),
                n.title(),
                n.content(),
                n.read(),
                n.jobId(),
                n.sessionId(),
                n.createdAt());
    }
}
