package skillcron.cron.scheduler;

import skillcron.cron.model.Job;
import skillcron.cron.model.JobStatus;
import skillcron.cron.model.RunStatus;
import skillcron.cron.model.TriggerResult;
import skillcron.cron.repository.JobRepository;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.runner.AbortSignal;
import skillcron.cron.runner.SkillRunner;
import skillcron.cron.runner.Target;
import skillcron.cron.runner.TargetResolver;
import skillcron.cron.service.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Executes one job end to end: takes the run lock, records a run, invokes
 * the skill, then either completes the job, schedules a retry, or fails it
 * terminally.
 *
 * Execution failures never propagate out of {@link #runJob(Job)}; they end
 * up in the job row, the run history and (for terminal outcomes) a
 * notification.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final TargetResolver targetResolver;
    private final SkillRunner skillRunner;
    private final NotificationDispatcher notifier;

    public JobExecutor(JobRepository jobRepository, RunRepository runRepository,
            TargetResolver targetResolver, SkillRunner skillRunner, NotificationDispatcher notifier) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.targetResolver = targetResolver;
        this.skillRunner = skillRunner;
        this.notifier = notifier;
    }

    /**
     * Run a due job. Skips silently (apart from a log line) if another
     * execution holds the job's lock.
     *
     * @param job snapshot read by the poller; its retryCount decides retry eligibility
     */
    public void runJob(Job job) {
        String sessionId = newSessionId("cron-", job.id());

        if (!jobRepository.markJobRunning(job.id(), sessionId)) {
            log.info("Job {} ({}) is already running, skipping", job.name(), job.id());
            return;
        }

        log.info("Running job {} ({}), session {}", job.name(), job.id(), sessionId);
        boolean released = false;
        try {
            long runId = runRepository.createRun(job.id(), sessionId);
            long start = System.nanoTime();

            String error = invoke(job, sessionId);
            long durationMs = elapsedMs(start);

            if (error == null) {
                jobRepository.markJobCompleted(job.id(), JobStatus.OK, null);
                released = true;
                runRepository.completeRun(runId, RunStatus.OK, null, durationMs);
                log.info("Job {} completed in {}ms", job.id(), durationMs);
                notifier.notify(job, RunStatus.OK, sessionId, null);
                return;
            }

            runRepository.completeRun(runId, RunStatus.ERROR, error, durationMs);

            if (job.canRetry()) {
                jobRepository.scheduleRetry(job.id(), job.retryCount(), error);
                released = true;
                log.warn("Job {} failed, retry {} of {} in {}ms: {}",
                        job.id(), job.retryCount() + 1, job.retryPolicy().maxRetries(),
                        job.retryPolicy().backoffMs(), error);
            } else {
                jobRepository.markJobCompleted(job.id(), JobStatus.ERROR, error);
                released = true;
                log.warn("Job {} failed: {}", job.id(), error);
                notifier.notify(job, RunStatus.ERROR, sessionId, error);
            }
        } catch (RuntimeException e) {
            log.error("Store failure while running job {} (session {})", job.id(), sessionId, e);
            if (!released) {
                releaseLock(job.id(), e);
            }
        }
    }

    /**
     * Run a job now, on the caller's thread, and report the outcome.
     *
     * A manual run does not take the run lock and leaves the schedule state
     * (nextRunAtMs, retryCount, lock) alone; it may overlap a scheduled run
     * of the same job. It records a run and sends a notification like any
     * other execution.
     */
    public TriggerResult triggerJob(String jobId) {
        Optional<Job> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            return TriggerResult.notFound();
        }

        Job job = found.get();
        String sessionId = newSessionId("cron-manual-", job.id());
        log.info("Manually triggering job {} ({}), session {}", job.name(), job.id(), sessionId);

        long runId = runRepository.createRun(job.id(), sessionId);
        long start = System.nanoTime();
        String error = invoke(job, sessionId);
        long durationMs = elapsedMs(start);

        if (error == null) {
            runRepository.completeRun(runId, RunStatus.OK, null, durationMs);
            notifier.notify(job, RunStatus.OK, sessionId, null);
            return TriggerResult.completed(sessionId);
        }

        runRepository.completeRun(runId, RunStatus.ERROR, error, durationMs);
        notifier.notify(job, RunStatus.ERROR, sessionId, error);
        return TriggerResult.failed(sessionId, error);
    }

    /**
     * Resolve and run the job's target.
     *
     * @return null on success, otherwise the failure message
     */
    private String invoke(Job job, String sessionId) {
        Target target = targetResolver.loadTargetById(job.target().targetId());
        if (target == null) {
            return "Skill not found: " + job.target().targetId();
        }

        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        try {
            skillRunner.execute(target, job.target().query(), job.target().profileId(), sessionId,
                    new AbortSignal(), event -> {
                        if (event.isError()) {
                            errors.add(event.content() != null ? event.content() : "unknown error");
                        }
                    });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Interrupted";
        } catch (Exception e) {
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        return errors.isEmpty() ? null : String.join("; ", errors);
    }

    private void releaseLock(String jobId, RuntimeException cause) {
        try {
            jobRepository.markJobCompleted(jobId, JobStatus.ERROR, cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not release lock of job {}; it stays locked until restart", jobId, e);
        }
    }

    private static String newSessionId(String prefix, String jobId) {
        return prefix + jobId + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
