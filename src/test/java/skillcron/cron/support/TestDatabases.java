package skillcron.cron.support;

import skillcron.cron.store.Database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

public final class TestDatabases {

    private TestDatabases() {
    }

    /**
     * Fresh in-memory database, private to the caller.
     */
    public static Database inMemory(String name) {
        return new Database("jdbc:h2:mem:" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 10);
    }

    public static void clean(Database db) throws SQLException {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM notifications");
            st.execute("DELETE FROM cron_runs");
            st.execute("DELETE FROM cron_jobs");
            conn.commit();
        }
    }
}
