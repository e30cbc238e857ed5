package skillcron.cron.runner;

import java.nio.file.Path;

/**
 * A resolved, runnable skill.
 *
 * @param id        skill id
 * @param name      display name
 * @param directory skill directory, null when not backed by the filesystem
 */
public record Target(String id, String name, Path directory) {
}
