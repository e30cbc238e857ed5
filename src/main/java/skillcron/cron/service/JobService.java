package skillcron.cron.service;

import skillcron.cron.model.Job;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Run;
import skillcron.cron.model.Schedule;
import skillcron.cron.model.TriggerResult;
import skillcron.cron.repository.JobRepository;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.schedule.ScheduleCalculator;
import skillcron.cron.schedule.ScheduleDescriber;
import skillcron.cron.scheduler.JobExecutor;
import skillcron.cron.scheduler.Poller;
import skillcron.cron.scheduler.PollerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Business logic for scheduled job management.
 * Every change to a job nudges the poller so that an earlier fire time takes
 * effect without waiting out the poll interval.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final ScheduleCalculator calculator;
    private final ScheduleDescriber describer;
    private final JobExecutor executor;
    private final Poller poller;

    public JobService(JobRepository jobRepository, RunRepository runRepository,
            ScheduleCalculator calculator, ScheduleDescriber describer,
            JobExecutor executor, Poller poller) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.calculator = calculator;
        this.describer = describer;
        this.executor = executor;
        this.poller = poller;
    }

    /**
     * Create a job.
     *
     * @throws IllegalArgumentException if the definition is invalid
     */
    public Job create(NewJob request) {
        RetryPolicy retryPolicy = request.retryPolicy() != null ? request.retryPolicy() : RetryPolicy.none();
        JobValidator.validate(request.name(), request.schedule(), request.target(), retryPolicy);

        Job job = Job.builder()
                .id(jobRepository.generateId())
                .name(request.name().trim())
                .description(request.description())
                .enabled(request.enabled() == null || request.enabled())
                .schedule(request.schedule())
                .target(request.target())
                .retryPolicy(retryPolicy)
                .source(request.source())
                .notifyChannel(request.notifyChannel())
                .nextRunAtMs(calculator.computeNextRunAtMs(request.schedule()))
                .createdAt(calculator.clock().instant())
                .build();

        jobRepository.save(job);
        log.info("Created job {} ({}), next run at {}", job.id(), job.name(), job.nextRunAtMs());

        poller.triggerPoll();
        return job;
    }

    /**
     * Apply a partial edit. A schedule change recomputes the next fire time;
     * any edit resets the retry counter.
     *
     * @return the updated job, or empty if it does not exist
     * @throws IllegalArgumentException if the resulting definition is invalid
     */
    public Optional<Job> update(String jobId, JobPatch patch) {
        Optional<Job> existing = jobRepository.findById(jobId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (patch.isEmpty()) {
            return existing;
        }

        Job current = existing.get();
        Job.Builder builder = current.toBuilder().retryCount(0);

        if (patch.name() != null)
            builder.name(patch.name().trim());
        if (patch.description() != null)
            builder.description(patch.description());
        if (patch.enabled() != null)
            builder.enabled(patch.enabled());
        if (patch.target() != null)
            builder.target(patch.target());
        if (patch.retryPolicy() != null)
            builder.retryPolicy(patch.retryPolicy());
        if (patch.notifyChannel() != null)
            builder.notifyChannel(patch.notifyChannel());
        if (patch.schedule() != null) {
            builder.schedule(patch.schedule())
                    .nextRunAtMs(calculator.computeNextRunAtMs(patch.schedule()));
        }

        Job updated = builder.build();
        JobValidator.validate(updated.name(), updated.schedule(), updated.target(), updated.retryPolicy());

        if (!jobRepository.update(updated, patch.schedule() != null)) {
            return Optional.empty();
        }
        log.info("Updated job {}", jobId);

        poller.triggerPoll();
        return jobRepository.findById(jobId);
    }

    public boolean delete(String jobId) {
        boolean deleted = jobRepository.delete(jobId);
        if (deleted) {
            log.info("Deleted job {}", jobId);
            poller.triggerPoll();
        }
        return deleted;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * All jobs, most recent first.
     */
    public List<Job> findAll() {
        return jobRepository.findAll();
    }

    public List<Job> findBySource(String channel, String sourceId) {
        return jobRepository.findBySource(channel, sourceId);
    }

    /**
     * Run history of a job, newest first.
     */
    public List<Run> runs(String jobId, int limit) {
        return runRepository.findByJobId(jobId, limit);
    }

    /**
     * Run a job now and wait for the outcome.
     */
    public TriggerResult trigger(String jobId) {
        return executor.triggerJob(jobId);
    }

    /**
     * Clear run locks and close runs left behind by a previous process.
     * Must be called before the poller starts.
     *
     * @return number of jobs that were locked
     */
    public int recoverAfterRestart() {
        int closed = runRepository.closeOpenRuns(RunRepository.INTERRUPTED_BY_RESTART);
        int released = jobRepository.releaseStaleLocks();
        if (released > 0 || closed > 0) {
            log.warn("Recovered after restart: {} locks released, {} runs closed", released, closed);
        }
        return released;
    }

    public String describe(Schedule schedule) {
        return describer.describe(schedule);
    }

    public PollerStatus status() {
        return poller.status();
    }
}
