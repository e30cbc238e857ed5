package skillcron.cron.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Configuration holder for the scheduler process.
 * All settings have sensible defaults; an optional INI file and then
 * environment variables override them.
 */
public final class CronConfig {

    private static final Logger log = LoggerFactory.getLogger(CronConfig.class);

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/skillcron;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8090;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, clients must provide X-SkillCron-Key header

    // Scheduler settings
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration triggerDelay = Duration.ofMillis(100);
    private int maxConcurrentRuns = 0; // 0 = unbounded
    private String defaultTimeZone = "Asia/Shanghai";

    // Notification settings
    private boolean notifyOnSuccess = true;
    private boolean notifyOnError = true;

    // Agent settings
    private String agentUrl = "http://127.0.0.1:3620/api/agent/execute";
    private String skillsDir = "./skills";
    private Duration agentTimeout = Duration.ofMinutes(30);

    private CronConfig() {
    }

    public static CronConfig defaults() {
        return new CronConfig();
    }

    /**
     * Defaults, then the INI file named by SKILLCRON_CONFIG (if any), then
     * environment variables.
     */
    public static CronConfig load() {
        String path = System.getenv("SKILLCRON_CONFIG");
        CronConfig config = (path != null && !path.isBlank())
                ? fromIni(new File(path))
                : defaults();
        config.applyEnv(System.getenv());
        return config;
    }

    public static CronConfig fromEnv() {
        CronConfig config = new CronConfig();
        config.applyEnv(System.getenv());
        return config;
    }

    /**
     * Read settings from an INI file. Recognised sections: [database],
     * [server], [scheduler], [notifications], [agent]. Missing keys keep their
     * defaults.
     *
     * @throws IllegalArgumentException if the file cannot be read or a value is malformed
     */
    public static CronConfig fromIni(File file) {
        CronConfig config = new CronConfig();
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file: " + file, e);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = str(database, "url", config.databaseUrl);
            config.databasePoolSize = integer(database, "pool_size", config.databasePoolSize);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = str(server, "host", config.serverHost);
            config.serverPort = integer(server, "port", config.serverPort);
            config.apiKey = str(server, "api_key", config.apiKey);
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            config.pollInterval = Duration.ofMillis(
                    longValue(scheduler, "poll_interval_ms", config.pollInterval.toMillis()));
            config.triggerDelay = Duration.ofMillis(
                    longValue(scheduler, "trigger_delay_ms", config.triggerDelay.toMillis()));
            config.maxConcurrentRuns = integer(scheduler, "max_concurrent_runs", config.maxConcurrentRuns);
            config.defaultTimeZone = str(scheduler, "timezone", config.defaultTimeZone);
        }

        Profile.Section notifications = ini.get("notifications");
        if (notifications != null) {
            config.notifyOnSuccess = bool(notifications, "on_success", config.notifyOnSuccess);
            config.notifyOnError = bool(notifications, "on_error", config.notifyOnError);
        }

        Profile.Section agent = ini.get("agent");
        if (agent != null) {
            config.agentUrl = str(agent, "url", config.agentUrl);
            config.skillsDir = str(agent, "skills_dir", config.skillsDir);
            config.agentTimeout = Duration.ofSeconds(
                    longValue(agent, "timeout_seconds", config.agentTimeout.toSeconds()));
        }

        config.validate();
        log.info("Loaded configuration from {}", file);
        return config;
    }

    void applyEnv(Map<String, String> env) {
        String dbUrl = env.get("SKILLCRON_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("SKILLCRON_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String key = env.get("SKILLCRON_API_KEY");
        if (key != null && !key.isBlank()) {
            apiKey = key;
        }

        String interval = env.get("SKILLCRON_POLL_INTERVAL_MS");
        if (interval != null && !interval.isBlank()) {
            pollInterval = Duration.ofMillis(Long.parseLong(interval.trim()));
        }

        String maxRuns = env.get("SKILLCRON_MAX_CONCURRENT_RUNS");
        if (maxRuns != null && !maxRuns.isBlank()) {
            maxConcurrentRuns = Integer.parseInt(maxRuns.trim());
        }

        String tz = env.get("SKILLCRON_DEFAULT_TZ");
        if (tz != null && !tz.isBlank()) {
            defaultTimeZone = tz.trim();
        }

        String agent = env.get("SKILLCRON_AGENT_URL");
        if (agent != null && !agent.isBlank()) {
            agentUrl = agent;
        }

        String skills = env.get("SKILLCRON_SKILLS_DIR");
        if (skills != null && !skills.isBlank()) {
            skillsDir = skills;
        }

        // Notifications are on unless explicitly switched off
        if ("false".equalsIgnoreCase(env.get("NOTIFY_ON_SUCCESS"))) {
            notifyOnSuccess = false;
        }
        if ("false".equalsIgnoreCase(env.get("NOTIFY_ON_ERROR"))) {
            notifyOnError = false;
        }

        validate();
    }

    private void validate() {
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
        if (maxConcurrentRuns < 0) {
            throw new IllegalArgumentException("max concurrent runs must be >= 0");
        }
        try {
            defaultZone();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown time zone: " + defaultTimeZone, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration triggerDelay() {
        return triggerDelay;
    }

    public int maxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public String defaultTimeZone() {
        return defaultTimeZone;
    }

    public ZoneId defaultZone() {
        return ZoneId.of(defaultTimeZone);
    }

    public boolean notifyOnSuccess() {
        return notifyOnSuccess;
    }

    public boolean notifyOnError() {
        return notifyOnError;
    }

    public String agentUrl() {
        return agentUrl;
    }

    public String skillsDir() {
        return skillsDir;
    }

    public Duration agentTimeout() {
        return agentTimeout;
    }

    // Fluent setters for testing/customization
    public CronConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CronConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CronConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public CronConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public CronConfig withTriggerDelay(Duration delay) {
        this.triggerDelay = delay;
        return this;
    }

    public CronConfig withMaxConcurrentRuns(int maxRuns) {
        this.maxConcurrentRuns = maxRuns;
        return this;
    }

    public CronConfig withDefaultTimeZone(String zoneId) {
        this.defaultTimeZone = zoneId;
        return this;
    }

    public CronConfig withNotifyOnSuccess(boolean notify) {
        this.notifyOnSuccess = notify;
        return this;
    }

    public CronConfig withNotifyOnError(boolean notify) {
        this.notifyOnError = notify;
        return this;
    }

    public CronConfig withSkillsDir(String dir) {
        this.skillsDir = dir;
        return this;
    }

    public CronConfig withAgentUrl(String url) {
        this.agentUrl = url;
        return this;
    }

    // --- INI helpers ---

    private static String str(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int integer(Profile.Section s, String key, int def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v);
        }
    }

    private static long longValue(Profile.Section s, String key, long def) {
        String v = s.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + v);
        }
    }

    private static boolean bool(Profile.Section s, String key, boolean def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Boolean.parseBoolean(v.trim());
    }

    @Override
    public String toString() {
        return "CronConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", pollInterval=" + pollInterval +
                ", maxConcurrentRuns=" + maxConcurrentRuns +
                ", defaultTimeZone=" + defaultTimeZone +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
