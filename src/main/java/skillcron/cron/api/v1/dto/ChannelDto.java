package skillcron.cron.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import skillcron.cron.model.JobChannel;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelDto(
        @JsonProperty("channel") String channel,
        @JsonProperty("userId") String userId,
        @JsonProperty("chatId") String chatId) {

    public JobChannel toChannel() {
        return JobChannel.of(channel, userId, chatId);
    }

    public static ChannelDto from(JobChannel channel) {
        return channel == null ? null : new ChannelDto(channel.channel(), channel.userId(), channel.chatId());
    }
}
