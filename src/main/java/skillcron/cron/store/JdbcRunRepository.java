package skillcron.cron.store;

import skillcron.cron.model.Run;
import skillcron.cron.model.RunStatus;
import skillcron.cron.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RunRepository.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcRunRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public long createRun(String jobId, String sessionId) {
        String sql = "INSERT INTO cron_runs (job_id, session_id, started_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, jobId);
            ps.setString(2, sessionId);
            ps.setTimestamp(3, Timestamp.from(clock.instant()));
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for run of job " + jobId);
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.debug("Opened run {} for job {} (session {})", id, jobId, sessionId);
            return id;
        } catch (SQLException e) {
            throw new StoreException("Failed to create run for job: " + jobId, e);
        }
    }

    @Override
    public boolean completeRun(long runId, RunStatus status, String error, long durationMs) {
        String sql = """
                    UPDATE cron_runs
                    SET status = ?, error = ?, duration_ms = ?, completed_at = ?
                    WHERE id = ? AND completed_at IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, error);
            ps.setLong(3, durationMs);
            ps.setTimestamp(4, Timestamp.from(clock.instant()));
            ps.setLong(5, runId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to complete run: " + runId, e);
        }
    }

    @Override
    public Optional<Run> findById(long runId) {
        String sql = "SELECT * FROM cron_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<Run> findByJobId(String jobId, int limit) {
        String sql = "SELECT * FROM cron_runs WHERE job_id = ? ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);

            List<Run> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRow(rs));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new StoreException("Failed to find runs for job: " + jobId, e);
        }
    }

    @Override
    public int closeOpenRuns(String reason) {
        String sql = """
                    UPDATE cron_runs
                    SET status = 'ERROR', error = ?, completed_at = ?
                    WHERE completed_at IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            int closed = ps.executeUpdate();
            conn.commit();

            if (closed > 0) {
                log.warn("Closed {} runs left open: {}", closed, reason);
            }
            return closed;
        } catch (SQLException e) {
            throw new StoreException("Failed to close open runs", e);
        }
    }

    private Run mapRow(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        return new Run(
                rs.getLong("id"),
                rs.getString("job_id"),
                rs.getString("session_id"),
                status != null ? RunStatus.valueOf(status) : null,
                rs.getString("error"),
                durationMs,
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")));
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
