package skillcron.cron.model;

/**
 * Outcome of the most recent execution of a job.
 * A job that never ran has a null status.
 */
public enum JobStatus {
    /** Last execution succeeded */
    OK,
    /** Last execution failed (possibly awaiting a retry) */
    ERROR,
    /** An execution is in flight */
    RUNNING
}
