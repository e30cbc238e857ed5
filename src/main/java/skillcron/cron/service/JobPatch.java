package skillcron.cron.service;

import skillcron.cron.model.JobChannel;
import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Schedule;

/**
 * Partial edit of a job. Null fields are left unchanged.
 */
public record JobPatch(
        String name,
        String description,
        Boolean enabled,
        Schedule schedule,
        JobTarget target,
        RetryPolicy retryPolicy,
        JobChannel notifyChannel) {

    public boolean isEmpty() {
        return name == null && description == null && enabled == null && schedule == null
                && target == null && retryPolicy == null && notifyChannel == null;
    }
}
