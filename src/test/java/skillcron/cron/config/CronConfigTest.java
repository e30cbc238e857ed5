package skillcron.cron.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        CronConfig config = CronConfig.defaults();
        assertEquals(8090, config.serverPort());
        assertEquals(Duration.ofSeconds(30), config.pollInterval());
        assertEquals(0, config.maxConcurrentRuns());
        assertEquals(ZoneId.of("Asia/Shanghai"), config.defaultZone());
        assertTrue(config.notifyOnSuccess());
        assertTrue(config.notifyOnError());
        assertFalse(config.hasApiKey());
    }

    @Test
    void readsIniFile() throws Exception {
        Path ini = dir.resolve("skillcron.ini");
        Files.writeString(ini, """
                [database]
                url = jdbc:h2:mem:from-ini
                pool_size = 4

                [server]
                port = 9999
                api_key = secret

                [scheduler]
                poll_interval_ms = 5000
                max_concurrent_runs = 3
                timezone = Europe/Berlin

                [notifications]
                on_success = false

                [agent]
                url = http://agent:1234/run
                skills_dir = /srv/skills
                timeout_seconds = 90
                """);

        CronConfig config = CronConfig.fromIni(ini.toFile());

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(4, config.databasePoolSize());
        assertEquals(9999, config.serverPort());
        assertEquals("secret", config.apiKey());
        assertTrue(config.hasApiKey());
        assertEquals(Duration.ofMillis(5000), config.pollInterval());
        assertEquals(3, config.maxConcurrentRuns());
        assertEquals(ZoneId.of("Europe/Berlin"), config.defaultZone());
        assertFalse(config.notifyOnSuccess());
        assertTrue(config.notifyOnError());
        assertEquals("http://agent:1234/run", config.agentUrl());
        assertEquals("/srv/skills", config.skillsDir());
        assertEquals(Duration.ofSeconds(90), config.agentTimeout());
    }

    @Test
    void rejectsMalformedIni() throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[server]\nport = eighty\n");
        assertThrows(IllegalArgumentException.class, () -> CronConfig.fromIni(ini.toFile()));

        Files.writeString(ini, "[scheduler]\ntimezone = Atlantis/Capital\n");
        assertThrows(IllegalArgumentException.class, () -> CronConfig.fromIni(ini.toFile()));

        assertThrows(IllegalArgumentException.class, () -> CronConfig.fromIni(dir.resolve("missing.ini").toFile()));
    }

    @Test
    void environmentOverrides() {
        CronConfig config = CronConfig.defaults();
        config.applyEnv(Map.of(
                "SKILLCRON_PORT", "7000",
                "SKILLCRON_POLL_INTERVAL_MS", "1500",
                "SKILLCRON_DEFAULT_TZ", "UTC",
                "SKILLCRON_API_KEY", "k",
                "NOTIFY_ON_ERROR", "FALSE"));

        assertEquals(7000, config.serverPort());
        assertEquals(Duration.ofMillis(1500), config.pollInterval());
        assertEquals(ZoneId.of("UTC"), config.defaultZone());
        assertEquals("k", config.apiKey());
        assertFalse(config.notifyOnError());
        assertTrue(config.notifyOnSuccess());
    }

    @Test
    void environmentValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> CronConfig.defaults().applyEnv(Map.of("SKILLCRON_POLL_INTERVAL_MS", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> CronConfig.defaults().applyEnv(Map.of("SKILLCRON_DEFAULT_TZ", "Nowhere/Town")));
        assertThrows(IllegalArgumentException.class,
                () -> CronConfig.defaults().applyEnv(Map.of("SKILLCRON_MAX_CONCURRENT_RUNS", "-1")));
    }
}
