package skillcron.cron.model;

/**
 * A conversation endpoint: where a job was created from, or where its
 * completion is reported to.
 *
 * @param channel channel name, e.g. "web" or "feishu"
 * @param userId  user identifier on that channel, may be null
 * @param chatId  conversation identifier on that channel, may be null
 */
public record JobChannel(String channel, String userId, String chatId) {

    public static JobChannel of(String channel, String userId, String chatId) {
        if (channel == null || channel.isBlank()) {
            return null;
        }
        return new JobChannel(channel, userId, chatId);
    }
}
