package skillcron.cron.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing a scheduled job.
 * A job pairs a schedule with a target and carries the runtime state the
 * scheduler keeps for it.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String description;
    private final boolean enabled;
    private final Schedule schedule;
    private final JobTarget target;
    private final RetryPolicy retryPolicy;
    private final JobChannel source;
    private final JobChannel notifyChannel;
    private final Long nextRunAtMs;
    private final Long lastRunAtMs;
    private final JobStatus lastStatus;
    private final String lastError;
    private final String runningSessionId; // non-null while a run is in flight
    private final int retryCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.description = builder.description;
        this.enabled = builder.enabled;
        this.schedule = Objects.requireNonNull(builder.schedule, "schedule is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.none();
        this.source = builder.source;
        this.notifyChannel = builder.notifyChannel;
        this.nextRunAtMs = builder.nextRunAtMs;
        this.lastRunAtMs = builder.lastRunAtMs;
        this.lastStatus = builder.lastStatus;
        this.lastError = builder.lastError;
        this.runningSessionId = builder.runningSessionId;
        this.retryCount = builder.retryCount;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public boolean enabled() {
        return enabled;
    }

    public Schedule schedule() {
        return schedule;
    }

    public JobTarget target() {
        return target;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public JobChannel source() {
        return source;
    }

    public JobChannel notifyChannel() {
        return notifyChannel;
    }

    public Long nextRunAtMs() {
        return nextRunAtMs;
    }

    public Long lastRunAtMs() {
        return lastRunAtMs;
    }

    public JobStatus lastStatus() {
        return lastStatus;
    }

    public String lastError() {
        return lastError;
    }

    public String runningSessionId() {
        return runningSessionId;
    }

    public int retryCount() {
        return retryCount;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True while an execution holds the run lock */
    public boolean isRunning() {
        return runningSessionId != null;
    }

    /** True if a failed attempt may be retried instead of failing terminally */
    public boolean canRetry() {
        return retryCount < retryPolicy.maxRetries();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .enabled(enabled)
                .schedule(schedule)
                .target(target)
                .retryPolicy(retryPolicy)
                .source(source)
                .notifyChannel(notifyChannel)
                .nextRunAtMs(nextRunAtMs)
                .lastRunAtMs(lastRunAtMs)
                .lastStatus(lastStatus)
                .lastError(lastError)
                .runningSessionId(runningSessionId)
                .retryCount(retryCount)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private boolean enabled = true;
        private Schedule schedule;
        private JobTarget target;
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private JobChannel source;
        private JobChannel notifyChannel;
        private Long nextRunAtMs;
        private Long lastRunAtMs;
        private JobStatus lastStatus;
        private String lastError;
        private String runningSessionId;
        private int retryCount;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder schedule(Schedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder target(JobTarget target) {
            this.target = target;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder source(JobChannel source) {
            this.source = source;
            return this;
        }

        public Builder notifyChannel(JobChannel notifyChannel) {
            this.notifyChannel = notifyChannel;
            return this;
        }

        public Builder nextRunAtMs(Long nextRunAtMs) {
            this.nextRunAtMs = nextRunAtMs;
            return this;
        }

        public Builder lastRunAtMs(Long lastRunAtMs) {
            this.lastRunAtMs = lastRunAtMs;
            return this;
        }

        public Builder lastStatus(JobStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder runningSessionId(String runningSessionId) {
            this.runningSessionId = runningSessionId;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', name='" + name + "', schedule=" + schedule.kind()
                + ", nextRunAtMs=" + nextRunAtMs + ", running=" + isRunning() + "}";
    }
}
