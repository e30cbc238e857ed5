package skillcron.cron.scheduler;

/**
 * Snapshot of the poller for status endpoints.
 *
 * @param running      whether the poller is started
 * @param intervalMs   poll interval
 * @param nextWakeAtMs earliest nextRunAtMs over enabled, unlocked jobs, or null
 */
public record PollerStatus(boolean running, long intervalMs, Long nextWakeAtMs) {
}
