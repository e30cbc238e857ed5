package skillcron;

import skillcron.cron.config.CronConfig;
import skillcron.cron.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point: loads configuration, wires the scheduler and serves
 * the REST API until the JVM is asked to shut down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        CronConfig config = CronConfig.load();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "skillcron-shutdown"));

        try {
            deps.start();
        } catch (RuntimeException | InterruptedException e) {
            log.error("Failed to start", e);
            deps.close();
            throw e;
        }

        log.info("SkillCron started on port {}", config.serverPort());
        stopped.await();
    }
}
