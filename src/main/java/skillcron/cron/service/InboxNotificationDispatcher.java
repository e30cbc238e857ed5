package skillcron.cron.service;

import skillcron.cron.model.Job;
import skillcron.cron.model.NotificationType;
import skillcron.cron.model.RunStatus;
import skillcron.cron.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an in-app notification for every finished execution the
 * configuration asks to be told about.
 */
public class InboxNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InboxNotificationDispatcher.class);

    private final NotificationRepository notifications;
    private final boolean notifyOnSuccess;
    private final boolean notifyOnError;

    public InboxNotificationDispatcher(NotificationRepository notifications,
            boolean notifyOnSuccess, boolean notifyOnError) {
        this.notifications = notifications;
        this.notifyOnSuccess = notifyOnSuccess;
        this.notifyOnError = notifyOnError;
    }

    @Override
    public void notify(Job job, RunStatus status, String sessionId, String error) {
        if (status == RunStatus.OK && !notifyOnSuccess) {
            return;
        }
        if (status == RunStatus.ERROR && !notifyOnError) {
            return;
        }

        String title = job.name() + (status == RunStatus.OK ? " succeeded" : " failed");
        String content = error != null ? error : "Job completed";

        long id = notifications.create(NotificationType.of(status), title, content, job.id(), sessionId);
        log.debug("Notification {} created for job {} ({})", id, job.id(), status);
    }
}
