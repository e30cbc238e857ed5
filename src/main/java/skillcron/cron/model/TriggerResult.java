package skillcron.cron.model;

/**
 * Synchronous result of a manual "run now" request.
 */
public record TriggerResult(Outcome outcome, String sessionId, String error) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        NOT_FOUND
    }

    public static TriggerResult completed(String sessionId) {
        return new TriggerResult(Outcome.COMPLETED, sessionId, null);
    }

    public static TriggerResult failed(String sessionId, String error) {
        return new TriggerResult(Outcome.FAILED, sessionId, error);
    }

    public static TriggerResult notFound() {
        return new TriggerResult(Outcome.NOT_FOUND, null, "job not found");
    }

    public boolean success() {
        return outcome == Outcome.COMPLETED;
    }
}
