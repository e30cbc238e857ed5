package skillcron.cron.support;

import skillcron.cron.model.Job;
import skillcron.cron.model.RunStatus;
import skillcron.cron.service.NotificationDispatcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingNotifier implements NotificationDispatcher {

    public record Sent(String jobId, RunStatus status, String sessionId, String error) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();

    @Override
    public void notify(Job job, RunStatus status, String sessionId, String error) {
        sent.add(new Sent(job.id(), status, sessionId, error));
    }

    public List<Sent> sent() {
        return sent;
    }
}
