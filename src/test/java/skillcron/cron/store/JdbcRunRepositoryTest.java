package skillcron.cron.store;

import skillcron.cron.model.Run;
import skillcron.cron.model.RunStatus;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.schedule.ScheduleCalculator;
import skillcron.cron.support.Jobs;
import skillcron.cron.support.MutableClock;
import skillcron.cron.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRunRepositoryTest {

    private static Database db;
    private static JdbcRunRepository runs;
    private static JdbcJobRepository jobs;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("test-runs");
        MutableClock clock = new MutableClock(Instant.parse("2026-03-10T05:30:00Z"));
        runs = new JdbcRunRepository(db, clock);
        jobs = new JdbcJobRepository(db, new ScheduleCalculator(clock, ZoneId.of("UTC")));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestDatabases.clean(db);
        jobs.save(Jobs.every("job-1", 60_000, null).build());
        jobs.save(Jobs.every("job-2", 60_000, null).build());
    }

    @Test
    void createRunIsOpen() {
        long id = runs.createRun("job-1", "s-1");

        Run run = runs.findById(id).orElseThrow();
        assertEquals("job-1", run.jobId());
        assertEquals("s-1", run.sessionId());
        assertTrue(run.isOpen());
        assertNull(run.status());
        assertNull(run.durationMs());
        assertNotNull(run.startedAt());
    }

    @Test
    void completeRunClosesOnce() {
        long id = runs.createRun("job-1", "s-1");

        assertTrue(runs.completeRun(id, RunStatus.ERROR, "boom", 1234));
        assertFalse(runs.completeRun(id, RunStatus.OK, null, 1));

        Run run = runs.findById(id).orElseThrow();
        assertFalse(run.isOpen());
        assertEquals(RunStatus.ERROR, run.status());
        assertEquals("boom", run.error());
        assertEquals(1234L, run.durationMs());
    }

    @Test
    void findByJobIdNewestFirstWithLimit() {
        long first = runs.createRun("job-1", "s-1");
        long second = runs.createRun("job-1", "s-2");
        long third = runs.createRun("job-1", "s-3");
        runs.createRun("job-2", "other");

        List<Run> latest = runs.findByJobId("job-1", 2);
        assertEquals(List.of(third, second), latest.stream().map(Run::id).toList());

        assertEquals(3, runs.findByJobId("job-1", 10).size());
        assertTrue(first < second);
    }

    @Test
    void closeOpenRunsMarksThemInterrupted() {
        long open = runs.createRun("job-1", "s-1");
        long closed = runs.createRun("job-2", "s-2");
        runs.completeRun(closed, RunStatus.OK, null, 10);

        assertEquals(1, runs.closeOpenRuns(RunRepository.INTERRUPTED_BY_RESTART));

        Run interrupted = runs.findById(open).orElseThrow();
        assertEquals(RunStatus.ERROR, interrupted.status());
        assertEquals(RunRepository.INTERRUPTED_BY_RESTART, interrupted.error());
        assertFalse(interrupted.isOpen());

        assertEquals(RunStatus.OK, runs.findById(closed).orElseThrow().status());
        assertEquals(0, runs.closeOpenRuns(RunRepository.INTERRUPTED_BY_RESTART));
    }
}
