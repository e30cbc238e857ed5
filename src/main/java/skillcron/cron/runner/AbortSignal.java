package skillcron.cron.runner;

/**
 * Cooperative cancellation flag handed to a running skill.
 */
public final class AbortSignal {

    private volatile boolean aborted;

    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }
}
