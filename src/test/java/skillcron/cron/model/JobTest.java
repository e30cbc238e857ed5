package skillcron.cron.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    private static Job.Builder base() {
        return Job.builder()
                .id("job-1")
                .name("n")
                .schedule(Schedule.every(1_000))
                .target(JobTarget.skill("report", null));
    }

    @Test
    void defaults() {
        Job job = base().build();
        assertTrue(job.enabled());
        assertEquals(RetryPolicy.none(), job.retryPolicy());
        assertEquals("", job.target().query());
        assertEquals(TargetKind.SKILL, job.target().kind());
        assertFalse(job.isRunning());
    }

    @Test
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> base().id(null).build());
        assertThrows(NullPointerException.class, () -> base().schedule(null).build());
        assertThrows(NullPointerException.class, () -> base().target(null).build());
    }

    @Test
    void canRetryWhileBelowMaxRetries() {
        Job job = base().retryPolicy(RetryPolicy.of(2, 100)).build();
        assertTrue(job.canRetry());
        assertTrue(job.toBuilder().retryCount(1).build().canRetry());
        assertFalse(job.toBuilder().retryCount(2).build().canRetry());
        assertFalse(base().build().canRetry());
    }

    @Test
    void toBuilderKeepsState() {
        Job job = base().runningSessionId("s-1").retryCount(1).lastStatus(JobStatus.RUNNING).build();
        Job copy = job.toBuilder().build();
        assertEquals(job, copy);
        assertTrue(copy.isRunning());
        assertEquals(1, copy.retryCount());
        assertEquals(JobStatus.RUNNING, copy.lastStatus());
    }

    @Test
    void emptyChannelIsAbsent() {
        assertNull(JobChannel.of(null, "u", "c"));
        assertNull(JobChannel.of(" ", "u", "c"));
        assertEquals("web", JobChannel.of("web", null, null).channel());
    }
}
