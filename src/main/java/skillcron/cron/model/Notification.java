package skillcron.cron.model;

import java.time.Instant;

/**
 * In-app notification describing a finished job.
 */
public record Notification(
        long id,
        NotificationType type,
        String title,
        String content,
        boolean read,
        String jobId,
        String sessionId,
        Instant createdAt) {
}
