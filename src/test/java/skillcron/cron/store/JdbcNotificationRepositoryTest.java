package skillcron.cron.store;

import skillcron.cron.model.Notification;
import skillcron.cron.model.NotificationType;
import skillcron.cron.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcNotificationRepositoryTest {

    private static Database db;
    private static JdbcNotificationRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("test-notifications");
        repo = new JdbcNotificationRepository(db, Clock.systemUTC());
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestDatabases.clean(db);
    }

    @Test
    void createAndFindRecent() {
        repo.create(NotificationType.CRON_SUCCESS, "a succeeded", "Job completed", "job-a", "s-1");
        long second = repo.create(NotificationType.CRON_ERROR, "b failed", "boom", "job-b", "s-2");

        List<Notification> recent = repo.findRecent(10);
        assertEquals(2, recent.size());

        Notification newest = recent.get(0);
        assertEquals(second, newest.id());
        assertEquals(NotificationType.CRON_ERROR, newest.type());
        assertEquals("b failed", newest.title());
        assertEquals("boom", newest.content());
        assertEquals("job-b", newest.jobId());
        assertEquals("s-2", newest.sessionId());
        assertFalse(newest.read());
        assertNotNull(newest.createdAt());

        assertEquals(1, repo.findRecent(1).size());
    }

    @Test
    void unreadAndMarkRead() {
        long a = repo.create(NotificationType.CRON_SUCCESS, "a", "ok", "job-a", "s-1");
        repo.create(NotificationType.CRON_SUCCESS, "b", "ok", "job-b", "s-2");
        repo.create(NotificationType.CRON_ERROR, "c", "bad", "job-c", "s-3");

        assertEquals(3, repo.countUnread());

        assertTrue(repo.markRead(a));
        assertEquals(2, repo.countUnread());
        assertFalse(repo.markRead(999_999));

        assertEquals(2, repo.markAllRead());
        assertEquals(0, repo.countUnread());
        assertTrue(repo.findRecent(10).stream().allMatch(Notification::read));
    }
}
