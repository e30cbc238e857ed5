package skillcron.cron.model;

import java.time.Instant;

/**
 * Audit record of one execution attempt.
 * A run is open (status and completedAt null) until it is closed exactly once.
 */
public record Run(
        long id,
        String jobId,
        String sessionId,
        RunStatus status,
        String error,
        Long durationMs,
        Instant startedAt,
        Instant completedAt) {

    public boolean isOpen() {
        return completedAt == null;
    }
}
