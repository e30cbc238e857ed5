package skillcron.cron.service;

import skillcron.cron.model.Job;
import skillcron.cron.model.JobChannel;
import skillcron.cron.model.JobStatus;
import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Run;
import skillcron.cron.model.RunStatus;
import skillcron.cron.model.Schedule;
import skillcron.cron.model.TriggerResult;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.schedule.ScheduleCalculator;
import skillcron.cron.schedule.ScheduleDescriber;
import skillcron.cron.scheduler.JobExecutor;
import skillcron.cron.scheduler.Poller;
import skillcron.cron.store.Database;
import skillcron.cron.store.JdbcJobRepository;
import skillcron.cron.store.JdbcRunRepository;
import skillcron.cron.support.FakeSkillRunner;
import skillcron.cron.support.FakeTargetResolver;
import skillcron.cron.support.Jobs;
import skillcron.cron.support.MutableClock;
import skillcron.cron.support.RecordingNotifier;
import skillcron.cron.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private static final Instant START = Instant.parse("2026-03-10T05:30:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcJobRepository jobs;
    private static JdbcRunRepository runs;
    private static Poller poller;
    private static JobService service;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("test-service");
        clock = new MutableClock(START);
        ScheduleCalculator calculator = new ScheduleCalculator(clock, ZoneId.of("UTC"));
        jobs = new JdbcJobRepository(db, calculator);
        runs = new JdbcRunRepository(db, clock);
        JobExecutor executor = new JobExecutor(jobs, runs, new FakeTargetResolver("report"),
                FakeSkillRunner.succeeding(), new RecordingNotifier());
        // Never started: triggerPoll is a no-op
        poller = new Poller(jobs, executor, 60_000, 10, 0);
        service = new JobService(jobs, runs, calculator, new ScheduleDescriber(ZoneId.of("UTC")), executor, poller);
    }

    @AfterAll
    static void teardown() {
        if (poller != null)
            poller.close();
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestDatabases.clean(db);
        clock.set(START);
    }

    private static NewJob newJob(String name, Schedule schedule) {
        return new NewJob(name, null, null, schedule, JobTarget.skill("report", "summarise"), null,
                JobChannel.of("feishu", "u-1", "c-1"), null);
    }

    @Test
    void createAssignsIdAndNextRun() {
        Job job = service.create(newJob("  hourly  ", Schedule.every(3_600_000)));

        assertTrue(job.id().startsWith("cron-"));
        assertEquals("hourly", job.name());
        assertTrue(job.enabled());
        assertEquals(RetryPolicy.none(), job.retryPolicy());
        assertEquals(clock.millis() + 3_600_000, job.nextRunAtMs());

        Job stored = service.findById(job.id()).orElseThrow();
        assertEquals(job.nextRunAtMs(), stored.nextRunAtMs());
        assertEquals(List.of(job.id()), service.findBySource("feishu", "u-1").stream().map(Job::id).toList());
    }

    @Test
    void createWithPastOneShotNeverFires() {
        Job job = service.create(newJob("late", Schedule.at(clock.millis() - 1)));
        assertNull(job.nextRunAtMs());
    }

    @Test
    void createRejectsInvalidDefinition() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create(newJob("bad", Schedule.cron("not cron", null))));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(newJob("", Schedule.every(1_000))));
        assertTrue(service.findAll().isEmpty());
    }

    @Test
    void updateScheduleRecomputesNextRunAndResetsRetries() {
        jobs.save(Jobs.every("job-1", 60_000, clock.millis() + 60_000).retryCount(2).build());

        Optional<Job> updated = service.update("job-1",
                new JobPatch(null, null, null, Schedule.cron("0 9 * * *", "UTC"), null, null, null));

        assertTrue(updated.isPresent());
        assertEquals(Instant.parse("2026-03-10T09:00:00Z").toEpochMilli(), updated.get().nextRunAtMs());
        assertEquals(0, updated.get().retryCount());
    }

    @Test
    void updateWithoutScheduleKeepsNextRun() {
        long next = clock.millis() + 60_000;
        jobs.save(Jobs.every("job-1", 60_000, next).build());

        Job updated = service.update("job-1",
                new JobPatch("renamed", "desc", false, null, null, RetryPolicy.of(2, 1_000), null)).orElseThrow();

        assertEquals("renamed", updated.name());
        assertEquals("desc", updated.description());
        assertFalse(updated.enabled());
        assertEquals(RetryPolicy.of(2, 1_000), updated.retryPolicy());
        assertEquals(next, updated.nextRunAtMs());
    }

    @Test
    void renameDuringRunKeepsNextRunComputedByCompletion() {
        jobs.save(Jobs.every("job-1", 60_000, clock.millis() - 1_000).build());
        assertTrue(jobs.markJobRunning("job-1", "s-1"));

        // The run completes between the edit's read and its write
        JdbcJobRepository racing = new JdbcJobRepository(db, new ScheduleCalculator(clock, ZoneId.of("UTC"))) {
            private boolean completed;

            @Override
            public Optional<Job> findById(String jobId) {
                Optional<Job> found = super.findById(jobId);
                if (!completed) {
                    completed = true;
                    markJobCompleted(jobId, JobStatus.OK, null);
                }
                return found;
            }
        };
        JobService racingService = new JobService(racing, runs, new ScheduleCalculator(clock, ZoneId.of("UTC")),
                new ScheduleDescriber(ZoneId.of("UTC")), null, poller);

        racingService.update("job-1", new JobPatch("renamed", null, null, null, null, null, null));

        Job job = jobs.findById("job-1").orElseThrow();
        assertEquals("renamed", job.name());
        assertFalse(job.isRunning());
        assertEquals(clock.millis(), job.lastRunAtMs());
        assertEquals(clock.millis() + 60_000, job.nextRunAtMs());
        assertTrue(jobs.findDueJobs().isEmpty());
    }

    @Test
    void updateUnknownJob() {
        assertTrue(service.update("ghost", new JobPatch("x", null, null, null, null, null, null)).isEmpty());
    }

    @Test
    void updateRejectsInvalidPatch() {
        jobs.save(Jobs.every("job-1", 60_000, null).build());

        assertThrows(IllegalArgumentException.class, () -> service.update("job-1",
                new JobPatch(null, null, null, null, null, RetryPolicy.of(-1, 0), null)));
        assertEquals(RetryPolicy.none(), jobs.findById("job-1").orElseThrow().retryPolicy());
    }

    @Test
    void deleteRemovesJob() {
        Job job = service.create(newJob("temp", Schedule.every(60_000)));

        assertTrue(service.delete(job.id()));
        assertFalse(service.delete(job.id()));
        assertTrue(service.findById(job.id()).isEmpty());
    }

    @Test
    void triggerRecordsRun() {
        Job job = service.create(newJob("manual", Schedule.every(60_000)));

        TriggerResult result = service.trigger(job.id());

        assertTrue(result.success());
        List<Run> history = service.runs(job.id(), 10);
        assertEquals(1, history.size());
        assertEquals(RunStatus.OK, history.get(0).status());
    }

    @Test
    void recoverAfterRestartClearsLocksAndRuns() {
        jobs.save(Jobs.every("job-1", 60_000, clock.millis()).build());
        jobs.markJobRunning("job-1", "s-1");
        long runId = runs.createRun("job-1", "s-1");

        assertEquals(1, service.recoverAfterRestart());

        Job job = jobs.findById("job-1").orElseThrow();
        assertFalse(job.isRunning());
        assertEquals(JobStatus.ERROR, job.lastStatus());
        Run run = runs.findById(runId).orElseThrow();
        assertEquals(RunRepository.INTERRUPTED_BY_RESTART, run.error());
        assertFalse(run.isOpen());
    }

    @Test
    void describeAndStatus() {
        assertEquals("every 5 minutes", service.describe(Schedule.every(300_000)));
        assertFalse(service.status().running());
    }
}
