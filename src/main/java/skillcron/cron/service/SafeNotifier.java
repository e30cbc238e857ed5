package skillcron.cron.service;

import skillcron.cron.model.Job;
import skillcron.cron.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a dispatcher so that a failing notification never affects the job
 * that triggered it.
 */
public class SafeNotifier implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SafeNotifier.class);

    private final NotificationDispatcher delegate;

    public SafeNotifier(NotificationDispatcher delegate) {
        this.delegate = delegate;
    }

    @Override
    public void notify(Job job, RunStatus status, String sessionId, String error) {
        try {
            delegate.notify(job, status, sessionId, error);
        } catch (Exception e) {
            log.error("Failed to send notification for job {} (session {})", job.id(), sessionId, e);
        }
    }
}
