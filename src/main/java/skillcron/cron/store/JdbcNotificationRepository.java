package skillcron.cron.store;

import skillcron.cron.model.Notification;
import skillcron.cron.model.NotificationType;
import skillcron.cron.repository.NotificationRepository;

import java.sql.*;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of NotificationRepository.
 */
public class JdbcNotificationRepository implements NotificationRepository {

    private final Database db;
    private final Clock clock;

    public JdbcNotificationRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public long create(NotificationType type, String title, String content, String jobId, String sessionId) {
        String sql = """
                    INSERT INTO notifications (type, title, content, is_read, job_id, session_id, created_at)
                    VALUES (?, ?, ?, FALSE, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, type.name());
            ps.setString(2, title);
            ps.setString(3, content);
            ps.setString(4, jobId);
            ps.setString(5, sessionId);
            ps.setTimestamp(6, Timestamp.from(clock.instant()));
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for notification");
                }
                id = keys.getLong(1);
            }
            conn.commit();
            return id;
        } catch (SQLException e) {
            throw new StoreException("Failed to create notification for job: " + jobId, e);
        }
    }

    @Override
    public List<Notification> findRecent(int limit) {
        String sql = "SELECT * FROM notifications ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<Notification> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StoreException("Failed to list notifications", e);
        }
    }

    @Override
    public int countUnread() {
        String sql = "SELECT COUNT(*) FROM notifications WHERE is_read = FALSE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count unread notifications", e);
        }
    }

    @Override
    public boolean markRead(long id) {
        String sql = "UPDATE notifications SET is_read = TRUE WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark notification read: " + id, e);
        }
    }

    @Override
    public int markAllRead() {
        String sql = "UPDATE notifications SET is_read = TRUE WHERE is_read = FALSE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark all notifications read", e);
        }
    }

    private Notification mapRow(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new Notification(
                rs.getLong("id"),
                NotificationType.valueOf(rs.getString("type")),
                rs.getString("title"),
                rs.getString("content"),
                rs.getBoolean("is_read"),
                rs.getString("job_id"),
                rs.getString("session_id"),
                created != null ? created.toInstant() : null);
    }
}
