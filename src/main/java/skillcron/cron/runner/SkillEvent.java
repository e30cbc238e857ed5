package skillcron.cron.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One event streamed by a running skill.
 *
 * @param type    "text", "error", "done" or any other type the agent emits
 * @param content event payload, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillEvent(
        @JsonProperty("type") String type,
        @JsonProperty("content") String content) {

    public static final String TEXT = "text";
    public static final String ERROR = "error";
    public static final String DONE = "done";

    public static SkillEvent text(String content) {
        return new SkillEvent(TEXT, content);
    }

    public static SkillEvent error(String content) {
        return new SkillEvent(ERROR, content);
    }

    public boolean isError() {
        return ERROR.equals(type);
    }
}
