package skillcron.cron.service;

import skillcron.cron.model.Notification;
import skillcron.cron.repository.NotificationRepository;

import java.util.List;

/**
 * Read side of the notification inbox.
 */
public class NotificationService {

    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    public List<Notification> recent(int limit) {
        return notificationRepository.findRecent(limit);
    }

    public int unreadCount() {
        return notificationRepository.countUnread();
    }

    public boolean markRead(long id) {
        return notificationRepository.markRead(id);
    }

    public int markAllRead() {
        return notificationRepository.markAllRead();
    }
}
