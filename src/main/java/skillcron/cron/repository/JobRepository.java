package skillcron.cron.repository;

import skillcron.cron.model.Job;
import skillcron.cron.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for scheduled job persistence.
 * Every mutation is a single statement or a single short transaction; no
 * transaction is held while a job executes.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Find all jobs, newest first.
     */
    List<Job> findAll();

    /**
     * Find jobs created from a given conversation endpoint.
     *
     * @param channel  source channel name
     * @param sourceId source user or chat identifier
     * @return matching jobs, newest first
     */
    List<Job> findBySource(String channel, String sourceId);

    /**
     * Replace the definition of an existing job (name, schedule, target,
     * retry policy, channels, enabled flag, retryCount).
     * Run-state columns owned by the executor are left untouched, and so is
     * nextRunAtMs unless {@code rescheduled} is set.
     *
     * @param job         the edited job
     * @param rescheduled true if the schedule changed and job.nextRunAtMs() must be stored
     * @return true if the job existed
     */
    boolean update(Job job, boolean rescheduled);

    /**
     * Delete a job and its run history.
     *
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Take the run lock.
     * Succeeds only if no other execution currently holds it; at most one of
     * any number of concurrent callers gets true for the same job.
     *
     * @param jobId     the job
     * @param sessionId session that will own the lock
     * @return true if this caller now owns the lock
     */
    boolean markJobRunning(String jobId, String sessionId);

    /**
     * Record the outcome of an execution, release the lock and compute the
     * next fire time from the new lastRunAtMs. A one-shot job gets a null
     * nextRunAtMs. On OK the retry counter is reset.
     */
    void markJobCompleted(String jobId, JobStatus status, String error);

    /**
     * Release the lock and make the job due again after its backoff.
     *
     * @param jobId              the job
     * @param previousRetryCount retry count read before the failed attempt
     * @param error              error of the failed attempt
     */
    void scheduleRetry(String jobId, int previousRetryCount, String error);

    /**
     * Enabled, unlocked jobs whose nextRunAtMs is at or before now.
     */
    List<Job> findDueJobs();

    /**
     * Earliest nextRunAtMs over enabled, unlocked jobs.
     *
     * @return epoch millis, or null if nothing is scheduled
     */
    Long nextWakeAtMs();

    /**
     * Clear every run lock. Called once at startup, when no execution of
     * this process can be in flight.
     *
     * @return number of jobs unlocked
     */
    int releaseStaleLocks();

    /**
     * Generate a new unique job ID.
     */
    String generateId();
}
