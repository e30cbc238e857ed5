package skillcron.cron.config;

import skillcron.cron.api.v1.CronJobController;
import skillcron.cron.api.v1.CronStatusController;
import skillcron.cron.api.v1.HealthController;
import skillcron.cron.api.v1.NotificationController;
import skillcron.cron.repository.JobRepository;
import skillcron.cron.repository.NotificationRepository;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.runner.DirectoryTargetResolver;
import skillcron.cron.runner.HttpSkillRunner;
import skillcron.cron.runner.SkillRunner;
import skillcron.cron.runner.TargetResolver;
import skillcron.cron.schedule.ScheduleCalculator;
import skillcron.cron.schedule.ScheduleDescriber;
import skillcron.cron.scheduler.JobExecutor;
import skillcron.cron.scheduler.Poller;
import skillcron.cron.server.CronHttpServer;
import skillcron.cron.server.RouterHandler;
import skillcron.cron.service.InboxNotificationDispatcher;
import skillcron.cron.service.JobService;
import skillcron.cron.service.NotificationService;
import skillcron.cron.service.SafeNotifier;
import skillcron.cron.store.Database;
import skillcron.cron.store.JdbcJobRepository;
import skillcron.cron.store.JdbcNotificationRepository;
import skillcron.cron.store.JdbcRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CronConfig.load());
 * deps.start();   // recover, start poller and HTTP server
 * ...
 * deps.close();   // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CronConfig config;
    private final Database database;
    private final ScheduleCalculator calculator;
    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final NotificationRepository notificationRepository;
    private final JobExecutor executor;
    private final Poller poller;
    private final JobService jobService;
    private final NotificationService notificationService;
    private final RouterHandler routerHandler;

    // Server (lazy-initialized)
    private CronHttpServer server;

    private Dependencies(CronConfig config, Clock clock, TargetResolver targetResolver, SkillRunner skillRunner) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.calculator = new ScheduleCalculator(clock, config.defaultZone());

        // Repositories
        this.jobRepository = new JdbcJobRepository(database, calculator);
        this.runRepository = new JdbcRunRepository(database, clock);
        this.notificationRepository = new JdbcNotificationRepository(database, clock);

        // Execution
        SafeNotifier notifier = new SafeNotifier(new InboxNotificationDispatcher(
                notificationRepository, config.notifyOnSuccess(), config.notifyOnError()));
        this.executor = new JobExecutor(jobRepository, runRepository, targetResolver, skillRunner, notifier);
        this.poller = new Poller(jobRepository, executor, config);

        // Services
        this.jobService = new JobService(jobRepository, runRepository, calculator,
                new ScheduleDescriber(config.defaultZone()), executor, poller);
        this.notificationService = new NotificationService(notificationRepository);

        // Router with all controllers
        this.routerHandler = new RouterHandler(config)
                .registerController(new HealthController(database, poller))
                .registerController(new CronJobController(jobService))
                .registerController(new CronStatusController(jobService))
                .registerController(new NotificationController(notificationService));

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the system clock and the
     * filesystem/HTTP skill collaborators.
     */
    public static Dependencies create(CronConfig config) {
        return new Dependencies(config, Clock.systemUTC(),
                new DirectoryTargetResolver(config.skillsDir()),
                new HttpSkillRunner(config.agentUrl(), config.agentTimeout()));
    }

    /**
     * Create dependencies with explicit collaborators (tests, embedding).
     */
    public static Dependencies create(CronConfig config, Clock clock,
            TargetResolver targetResolver, SkillRunner skillRunner) {
        return new Dependencies(config, clock, targetResolver, skillRunner);
    }

    // Getters
    public CronConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public NotificationRepository notificationRepository() {
        return notificationRepository;
    }

    public JobExecutor executor() {
        return executor;
    }

    public Poller poller() {
        return poller;
    }

    public JobService jobService() {
        return jobService;
    }

    public NotificationService notificationService() {
        return notificationService;
    }

    public RouterHandler routerHandler() {
        return routerHandler;
    }

    /**
     * Release locks left by a previous process, then start the poller and
     * the HTTP server.
     */
    public void start() throws InterruptedException {
        jobService.recoverAfterRestart();
        poller.start();
        server = new CronHttpServer(routerHandler, config.serverHost(), config.serverPort());
        server.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (Exception e) {
                log.warn("Error stopping HTTP server: {}", e.getMessage());
            }
        }

        try {
            poller.close();
        } catch (Exception e) {
            log.warn("Error stopping poller: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
