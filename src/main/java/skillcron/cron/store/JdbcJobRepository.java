package skillcron.cron.store;

import skillcron.cron.model.Job;
import skillcron.cron.model.JobChannel;
import skillcron.cron.model.JobStatus;
import skillcron.cron.model.JobTarget;
import skillcron.cron.model.RetryPolicy;
import skillcron.cron.model.Schedule;
import skillcron.cron.model.ScheduleKind;
import skillcron.cron.model.TargetKind;
import skillcron.cron.repository.JobRepository;
import skillcron.cron.repository.RunRepository;
import skillcron.cron.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;
    private final ScheduleCalculator calculator;
    private final Clock clock;

    public JdbcJobRepository(Database db, ScheduleCalculator calculator) {
        this.db = db;
        this.calculator = calculator;
        this.clock = calculator.clock();
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO cron_jobs (id, name, description, enabled,
                        schedule_kind, schedule_at_ms, schedule_every_ms, schedule_cron_expr, schedule_cron_tz,
                        target_kind, target_id, target_query, target_profile_id,
                        max_retries, backoff_ms,
                        source_channel, source_user_id, source_chat_id,
                        notify_channel, notify_user_id, notify_chat_id,
                        next_run_at_ms, last_run_at_ms, last_status, last_error, running_session_id, retry_count,
                        created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = clock.instant();
            int i = bindDefinition(ps, true, job);
            setLong(ps, i++, job.nextRunAtMs());
            setLong(ps, i++, job.lastRunAtMs());
            ps.setString(i++, job.lastStatus() != null ? job.lastStatus().name() : null);
            ps.setString(i++, job.lastError());
            ps.setString(i++, job.runningSessionId());
            ps.setInt(i++, job.retryCount());
            ps.setTimestamp(i++, Timestamp.from(job.createdAt() != null ? job.createdAt() : now));
            ps.setTimestamp(i, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : now));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM cron_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll() {
        String sql = "SELECT * FROM cron_jobs ORDER BY created_at DESC, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findBySource(String channel, String sourceId) {
        String sql = """
                    SELECT * FROM cron_jobs
                    WHERE source_channel = ? AND (source_user_id = ? OR source_chat_id = ?)
                    ORDER BY created_at DESC, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, channel);
            ps.setString(2, sourceId);
            ps.setString(3, sourceId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find jobs by source: " + channel, e);
        }
    }

    @Override
    public boolean update(Job job, boolean rescheduled) {
        String sql = """
                    UPDATE cron_jobs SET name = ?, description = ?, enabled = ?,
                        schedule_kind = ?, schedule_at_ms = ?, schedule_every_ms = ?, schedule_cron_expr = ?, schedule_cron_tz = ?,
                        target_kind = ?, target_id = ?, target_query = ?, target_profile_id = ?,
                        max_retries = ?, backoff_ms = ?,
                        source_channel = ?, source_user_id = ?, source_chat_id = ?,
                        notify_channel = ?, notify_user_id = ?, notify_chat_id = ?,
                        retry_count = ?, updated_at = ?
                    WHERE id = ?
                """;
        String rescheduleSql = "UPDATE cron_jobs SET next_run_at_ms = ? WHERE id = ?";

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                // UPDATE binds the id last
                int i = bindDefinition(ps, false, job);
                ps.setInt(i++, job.retryCount());
                ps.setTimestamp(i++, Timestamp.from(clock.instant()));
                ps.setString(i, job.id());
                updated = ps.executeUpdate();
            }

            // next_run_at_ms is shared with the executor; only a new schedule overwrites it
            if (updated > 0 && rescheduled) {
                try (PreparedStatement ps = conn.prepareStatement(rescheduleSql)) {
                    setLong(ps, 1, job.nextRunAtMs());
                    ps.setString(2, job.id());
                    ps.executeUpdate();
                }
            }

            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        String sql = "DELETE FROM cron_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public boolean markJobRunning(String jobId, String sessionId) {
        String sql = """
                    UPDATE cron_jobs
                    SET running_session_id = ?, last_status = 'RUNNING', updated_at = ?
                    WHERE id = ? AND running_session_id IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to lock job: " + jobId, e);
        }
    }

    @Override
    public void markJobCompleted(String jobId, JobStatus status, String error) {
        String selectSql = """
                    SELECT schedule_kind, schedule_at_ms, schedule_every_ms, schedule_cron_expr, schedule_cron_tz
                    FROM cron_jobs WHERE id = ?
                    FOR UPDATE
                """;

        String updateSql = """
                    UPDATE cron_jobs
                    SET running_session_id = NULL, last_status = ?, last_error = ?, last_run_at_ms = ?,
                        next_run_at_ms = ?, retry_count = CASE WHEN ? THEN 0 ELSE retry_count END,
                        updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                selectPs.setString(1, jobId);
                Schedule schedule;
                try (ResultSet rs = selectPs.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        log.debug("Job {} no longer exists, nothing to complete", jobId);
                        return;
                    }
                    schedule = mapSchedule(rs);
                }

                long now = clock.millis();
                Long next = calculator.computeNextRunAtMs(schedule, now);

                updatePs.setString(1, status.name());
                updatePs.setString(2, error);
                updatePs.setLong(3, now);
                setLong(updatePs, 4, next);
                updatePs.setBoolean(5, status == JobStatus.OK);
                updatePs.setTimestamp(6, Timestamp.from(clock.instant()));
                updatePs.setString(7, jobId);
                updatePs.executeUpdate();

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to complete job: " + jobId, e);
        }
    }

    @Override
    public void scheduleRetry(String jobId, int previousRetryCount, String error) {
        String sql = """
                    UPDATE cron_jobs
                    SET running_session_id = NULL, last_status = 'ERROR', last_error = ?,
                        retry_count = ?, next_run_at_ms = ? + backoff_ms, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, error);
            ps.setInt(2, previousRetryCount + 1);
            ps.setLong(3, clock.millis());
            ps.setTimestamp(4, Timestamp.from(clock.instant()));
            ps.setString(5, jobId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to schedule retry: " + jobId, e);
        }
    }

    @Override
    public List<Job> findDueJobs() {
        String sql = """
                    SELECT * FROM cron_jobs
                    WHERE enabled = TRUE
                      AND running_session_id IS NULL
                      AND next_run_at_ms IS NOT NULL
                      AND next_run_at_ms <= ?
                    ORDER BY next_run_at_ms
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, clock.millis());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find due jobs", e);
        }
    }

    @Override
    public Long nextWakeAtMs() {
        String sql = """
                    SELECT MIN(next_run_at_ms) FROM cron_jobs
                    WHERE enabled = TRUE AND running_session_id IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            if (rs.next()) {
                return getLong(rs, 1);
            }
            return null;
        } catch (SQLException e) {
            throw new StoreException("Failed to compute next wake time", e);
        }
    }

    @Override
    public int releaseStaleLocks() {
        String sql = """
                    UPDATE cron_jobs
                    SET running_session_id = NULL,
                        last_status = CASE WHEN last_status = 'RUNNING' THEN 'ERROR' ELSE last_status END,
                        last_error = CASE WHEN last_status = 'RUNNING' THEN ? ELSE last_error END,
                        updated_at = ?
                    WHERE running_session_id IS NOT NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, RunRepository.INTERRUPTED_BY_RESTART);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            int released = ps.executeUpdate();
            conn.commit();

            if (released > 0) {
                log.warn("Released {} stale job locks", released);
            }
            return released;
        } catch (SQLException e) {
            throw new StoreException("Failed to release stale locks", e);
        }
    }

    @Override
    public String generateId() {
        return "cron-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    /**
     * Binds the definition columns shared by INSERT and UPDATE, starting at
     * parameter 1. Run state, next_run_at_ms included, is bound by the caller.
     *
     * @return the next free parameter index
     */
    private int bindDefinition(PreparedStatement ps, boolean withId, Job job) throws SQLException {
        int i = 1;
        if (withId) {
            ps.setString(i++, job.id());
        }
        ps.setString(i++, job.name());
        ps.setString(i++, job.description());
        ps.setBoolean(i++, job.enabled());

        Schedule schedule = job.schedule();
        ps.setString(i++, schedule.kind().wireName());
        setLong(ps, i++, schedule instanceof Schedule.At at ? at.atMs() : null);
        setLong(ps, i++, schedule instanceof Schedule.Every every ? every.everyMs() : null);
        ps.setString(i++, schedule instanceof Schedule.Cron cron ? cron.expr() : null);
        ps.setString(i++, schedule instanceof Schedule.Cron cron ? cron.tz() : null);

        JobTarget target = job.target();
        ps.setString(i++, target.kind().wireName());
        ps.setString(i++, target.targetId());
        ps.setString(i++, target.query());
        ps.setString(i++, target.profileId());

        ps.setInt(i++, job.retryPolicy().maxRetries());
        ps.setLong(i++, job.retryPolicy().backoffMs());

        i = bindChannel(ps, i, job.source());
        i = bindChannel(ps, i, job.notifyChannel());
        return i;
    }

    private int bindChannel(PreparedStatement ps, int i, JobChannel channel) throws SQLException {
        ps.setString(i++, channel != null ? channel.channel() : null);
        ps.setString(i++, channel != null ? channel.userId() : null);
        ps.setString(i++, channel != null ? channel.chatId() : null);
        return i;
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        String lastStatus = rs.getString("last_status");
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .enabled(rs.getBoolean("enabled"))
                .schedule(mapSchedule(rs))
                .target(new JobTarget(
                        TargetKind.fromWire(rs.getString("target_kind")),
                        rs.getString("target_id"),
                        rs.getString("target_query"),
                        rs.getString("target_profile_id")))
                .retryPolicy(RetryPolicy.of(rs.getInt("max_retries"), rs.getLong("backoff_ms")))
                .source(JobChannel.of(
                        rs.getString("source_channel"),
                        rs.getString("source_user_id"),
                        rs.getString("source_chat_id")))
                .notifyChannel(JobChannel.of(
                        rs.getString("notify_channel"),
                        rs.getString("notify_user_id"),
                        rs.getString("notify_chat_id")))
                .nextRunAtMs(getLong(rs, "next_run_at_ms"))
                .lastRunAtMs(getLong(rs, "last_run_at_ms"))
                .lastStatus(lastStatus != null ? JobStatus.valueOf(lastStatus) : null)
                .lastError(rs.getString("last_error"))
                .runningSessionId(rs.getString("running_session_id"))
                .retryCount(rs.getInt("retry_count"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private Schedule mapSchedule(ResultSet rs) throws SQLException {
        ScheduleKind kind = ScheduleKind.fromWire(rs.getString("schedule_kind"));
        return switch (kind) {
            case AT -> Schedule.at(rs.getLong("schedule_at_ms"));
            case EVERY -> Schedule.every(rs.getLong("schedule_every_ms"));
            case CRON -> Schedule.cron(rs.getString("schedule_cron_expr"), rs.getString("schedule_cron_tz"));
        };
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLong(ResultSet rs, int column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
