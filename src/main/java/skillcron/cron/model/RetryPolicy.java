package skillcron.cron.model;

/**
 * Bounded retry with a fixed backoff.
 *
 * @param maxRetries retries allowed after the first failed attempt
 * @param backoffMs  delay before a retried attempt becomes due
 */
public record RetryPolicy(int maxRetries, long backoffMs) {

    public static final long DEFAULT_BACKOFF_MS = 60_000L;

    public static RetryPolicy none() {
        return new RetryPolicy(0, DEFAULT_BACKOFF_MS);
    }

    public static RetryPolicy of(int maxRetries, long backoffMs) {
        return new RetryPolicy(maxRetries, backoffMs);
    }
}
