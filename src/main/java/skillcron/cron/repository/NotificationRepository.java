package skillcron.cron.repository;

import skillcron.cron.model.Notification;
import skillcron.cron.model.NotificationType;

import java.util.List;

/**
 * Repository interface for the notification inbox.
 */
public interface NotificationRepository {

    /**
     * @return the new notification id
     */
    long create(NotificationType type, String title, String content, String jobId, String sessionId);

    /**
     * Most recent notifications, newest first.
     */
    List<Notification> findRecent(int limit);

    int countUnread();

    /**
     * @return true if the notification exists
     */
    boolean markRead(long id);

    /**
     * @return number of notifications that were unread
     */
    int markAllRead();
}
