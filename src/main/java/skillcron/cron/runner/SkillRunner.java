package skillcron.cron.runner;

import java.util.function.Consumer;

/**
 * Invokes a skill and streams its events back.
 */
public interface SkillRunner {

    /**
     * Run a skill to completion.
     * Returns normally when the skill finished; error events reported through
     * {@code onEvent} do not make this method throw.
     *
     * @param target    the resolved skill
     * @param query     prompt handed to the skill
     * @param profileId execution profile, may be null
     * @param sessionId session id of this execution
     * @param signal    cooperative cancellation flag
     * @param onEvent   receives every event in order
     * @throws Exception if the invocation itself failed
     */
    void execute(Target target, String query, String profileId, String sessionId,
            AbortSignal signal, Consumer<SkillEvent> onEvent) throws Exception;
}
