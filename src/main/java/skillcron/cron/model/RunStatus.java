package skillcron.cron.model;

/**
 * Final status of a closed run.
 */
public enum RunStatus {
    OK,
    ERROR;

    public JobStatus toJobStatus() {
        return this == OK ? JobStatus.OK : JobStatus.ERROR;
    }
}
