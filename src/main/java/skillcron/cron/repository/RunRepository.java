package skillcron.cron.repository;

import skillcron.cron.model.Run;
import skillcron.cron.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for run history.
 */
public interface RunRepository {

    /** Error recorded on runs and jobs cut short by a process restart. */
    String INTERRUPTED_BY_RESTART = "Interrupted by restart";

    /**
     * Open a run for an execution attempt.
     *
     * @return the run id
     */
    long createRun(String jobId, String sessionId);

    /**
     * Close an open run. A run that is already closed is left as is.
     *
     * @return true if the run was open and is now closed
     */
    boolean completeRun(long runId, RunStatus status, String error, long durationMs);

    Optional<Run> findById(long runId);

    /**
     * Most recent runs of a job, newest first.
     */
    List<Run> findByJobId(String jobId, int limit);

    /**
     * Close every open run as failed with the given reason.
     *
     * @return number of runs closed
     */
    int closeOpenRuns(String reason);
}
