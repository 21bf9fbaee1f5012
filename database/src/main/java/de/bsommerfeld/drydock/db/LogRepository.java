package de.bsommerfeld.drydock.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.domain.LogEntry;
import de.bsommerfeld.drydock.core.domain.LogLevel;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted application log behind the log view. Sync failures are invisible
 * to the user except through these rows.
 */
@Singleton
public class LogRepository {

    /** Upper bound for a single read, the log view never shows more. */
    public static final int MAX_ENTRIES = 1000;

    private final ConnectionPool pool;
    private final Clock clock;

    @Inject
    public LogRepository(ConnectionPool pool) {
        this(pool, Clock.systemUTC());
    }

    LogRepository(ConnectionPool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    public void append(LogLevel level, String message) throws DatabaseException {
        pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-log"))) {
                ps.setString(1, level.name());
                ps.setString(2, message);
                ps.setLong(3, clock.instant().getEpochSecond());
                return ps.executeUpdate();
            }
        });
    }

    /** Newest first, at most {@code limit} (capped at {@value #MAX_ENTRIES}). */
    public List<LogEntry> recent(int limit) throws DatabaseException {
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-logs"))) {
                ps.setInt(1, Math.min(limit, MAX_ENTRIES));
                return queryEntries(ps);
            }
        });
    }

    /** Case-insensitive substring match on the message, newest first. */
    public List<LogEntry> search(String query) throws DatabaseException {
        String pattern = "%" + escapeLike(query) + "%";
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("search-logs"))) {
                ps.setString(1, pattern);
                ps.setInt(2, MAX_ENTRIES);
                return queryEntries(ps);
            }
        });
    }

    private List<LogEntry> queryEntries(PreparedStatement ps) throws SQLException {
        List<LogEntry> entries = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                entries.add(new LogEntry(
                        rs.getLong("id"),
                        LogLevel.parse(rs.getString("level")),
                        rs.getString("message"),
                        Instant.ofEpochSecond(rs.getLong("timestamp"))));
            }
        }
        return entries;
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
