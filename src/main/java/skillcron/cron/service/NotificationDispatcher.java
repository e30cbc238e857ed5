package skillcron.cron.service;

import skillcron.cron.model.Job;
import skillcron.cron.model.RunStatus;

/**
 * Reports the outcome of a finished execution.
 */
public interface NotificationDispatcher {

    /**
     * @param job       the job that ran
     * @param status    outcome of the execution
     * @param sessionId session of the execution
     * @param error     failure message, null on success
     */
    void notify(Job job, RunStatus status, String sessionId, String error);
}
