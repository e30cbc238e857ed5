package skillcron.cron.service;

import skillcron.cron.model.JobChannel;
import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Schedule;

/**
 * Definition of a job to create.
 * Null {@code enabled} means enabled; null {@code retryPolicy} means no retries.
 */
public record NewJob(
        String name,
        String description,
        Boolean enabled,
        Schedule schedule,
        JobTarget target,
        RetryPolicy retryPolicy,
        JobChannel source,
        JobChannel notifyChannel) {
}
