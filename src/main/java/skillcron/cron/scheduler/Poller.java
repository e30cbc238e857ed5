package skillcron.cron.scheduler;

import skillcron.cron.config.CronConfig;
import skillcron.cron.model.Job;
import skillcron.cron.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives scheduled execution.
 *
 * A single timer thread runs ticks: each tick loads the due jobs, hands each
 * one to a worker pool, waits for all of them to settle and re-arms itself.
 * Because ticks only ever run on the timer thread, two ticks are never in
 * flight at once.
 *
 * Every arm/cancel bumps a generation counter; a tick only re-arms if the
 * generation it was scheduled under is still current, so a timer replaced
 * by {@link #triggerPoll()} or cancelled by {@link #stop()} never comes back.
 */
public class Poller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Poller.class);

    private final JobRepository jobRepository;
    private final JobExecutor executor;
    private final long intervalMs;
    private final long triggerDelayMs;

    private final ScheduledExecutorService timer;
    private final ExecutorService workers;

    // Guarded by this
    private boolean running = false;
    private long generation = 0;
    private ScheduledFuture<?> pending;

    public Poller(JobRepository jobRepository, JobExecutor executor, CronConfig config) {
        this(jobRepository, executor, config.pollInterval().toMillis(), config.triggerDelay().toMillis(),
                config.maxConcurrentRuns());
    }

    /**
     * @param maxConcurrentRuns worker pool size; 0 for an unbounded pool
     */
    public Poller(JobRepository jobRepository, JobExecutor executor,
            long intervalMs, long triggerDelayMs, int maxConcurrentRuns) {
        this.jobRepository = jobRepository;
        this.executor = executor;
        this.intervalMs = intervalMs;
        this.triggerDelayMs = triggerDelayMs;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skillcron-poller");
            t.setDaemon(true);
            return t;
        });
        this.workers = maxConcurrentRuns > 0
                ? Executors.newFixedThreadPool(maxConcurrentRuns, workerFactory())
                : Executors.newCachedThreadPool(workerFactory());
    }

    /**
     * Start polling. The first tick runs immediately so that jobs which
     * became due while the process was down are picked up.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Poller already running");
            return;
        }
        running = true;
        arm(0);
        log.info("Poller started, interval {}ms", intervalMs);
    }

    /**
     * Stop polling. Executions already dispatched keep running to completion.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        generation++;
        cancelPending();
        log.info("Poller stopped");
    }

    /**
     * Poll soon instead of waiting out the interval, e.g. after a job was
     * created or edited. Repeated calls within the trigger delay collapse
     * into one tick. No-op when stopped.
     */
    public synchronized void triggerPoll() {
        if (!running) {
            return;
        }
        cancelPending();
        arm(triggerDelayMs);
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public PollerStatus status() {
        return new PollerStatus(isRunning(), intervalMs, jobRepository.nextWakeAtMs());
    }

    /**
     * Run one tick on the calling thread, ignoring the timer.
     *
     * @return number of jobs dispatched
     */
    int pollOnce() {
        List<Job> due = jobRepository.findDueJobs();
        if (due.isEmpty()) {
            return 0;
        }

        log.info("Found {} due jobs", due.size());
        CompletableFuture<?>[] futures = due.stream()
                .map(job -> CompletableFuture.runAsync(wrapRunnable(job), workers))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
        return due.size();
    }

    @Override
    public void close() {
        stop();
        shutdown(timer, "poller timer");
        shutdown(workers, "worker pool");
    }

    private void arm(long delayMs) {
        long armedGeneration = ++generation;
        pending = timer.schedule(() -> tick(armedGeneration), delayMs, TimeUnit.MILLISECONDS);
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    private void tick(long armedGeneration) {
        synchronized (this) {
            if (!running || armedGeneration != generation) {
                return;
            }
        }

        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Poll failed", e);
        }

        synchronized (this) {
            if (running && armedGeneration == generation) {
                arm(intervalMs);
            }
        }
    }

    /**
     * Wrap a job execution so that one failing job cannot affect the others.
     */
    private Runnable wrapRunnable(Job job) {
        return () -> {
            try {
                executor.runJob(job);
            } catch (Exception e) {
                log.error("Job {} execution error", job.id(), e);
            }
        };
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "skillcron-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void shutdown(ExecutorService service, String name) {
        service.shutdown();
        try {
            if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                service.shutdownNow();
                log.warn("{} forcefully stopped", name);
            }
        } catch (InterruptedException e) {
            service.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
