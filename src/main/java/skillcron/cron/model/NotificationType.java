package skillcron.cron.model;

public enum NotificationType {
    CRON_SUCCESS,
    CRON_ERROR;

    public static NotificationType of(RunStatus status) {
        return status == RunStatus.OK ? CRON_SUCCESS : CRON_ERROR;
    }
}
