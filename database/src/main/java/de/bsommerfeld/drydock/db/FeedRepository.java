package de.bsommerfeld.drydock.db;

import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.domain.Feed;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import de.bsommerfeld.drydock.core.domain.FeedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed access to the {@code feeds} and {@code feed_items} tables. No
 * business rules live here; the ingestion pipeline decides what to store.
 *
 * <p>
 * Every method leases its own connection from the {@link ConnectionPool} for
 * exactly one statement and returns it before returning. The class keeps no
 * mutable state and is safe to call from the render thread and the scheduler
 * thread at the same time.
 *
 * <h3>Deduplication</h3>
 * {@code feed_items.dedup_key} is unique store-wide.
 * {@link #insertItemIfAbsent} relies on {@code INSERT OR IGNORE} and reports
 * whether a row was actually written, which keeps repeated ingestion of the
 * same remote entry idempotent.
 */
@Singleton
public class FeedRepository {

    private static final Logger LOG = LoggerFactory.getLogger(FeedRepository.class);

    private final ConnectionPool pool;
    private final Clock clock;

    @Inject
    public FeedRepository(ConnectionPool pool) {
        this(pool, Clock.systemUTC());
    }

    FeedRepository(ConnectionPool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    // =====================================================================
    // Feeds
    // =====================================================================

    /**
     * Subscribes to a feed. The URL is stored as entered (trimmed); scheme
     * normalization happens at fetch time.
     *
     * @throws DuplicateFeedException if a feed with the same URL exists
     */
    public Feed createFeed(String title, String url) throws DatabaseException {
        String trimmedUrl = url.trim();
        try (Connection conn = pool.acquire()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-feed"))) {
                ps.setString(1, title.trim());
                ps.setString(2, trimmedUrl);
                ps.setLong(3, clock.instant().getEpochSecond());
                ps.executeUpdate();
            }
            Feed created = queryFeed(conn, SqlLoader.load("select-feed-by-url"), trimmedUrl);
            LOG.info("[DB] Added feed {} ({})", created.id(), trimmedUrl);
            return created;
        } catch (SQLException e) {
            if (isUniqueViolation(e))
                throw new DuplicateFeedException(trimmedUrl, e);
            throw new DatabaseException("Failed to add feed " + trimmedUrl, e);
        }
    }

    public List<Feed> listFeeds() throws DatabaseException {
        return pool.withConnection(conn -> {
            List<Feed> feeds = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-feeds"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    feeds.add(mapFeed(rs));
            }
            return feeds;
        });
    }

    public Optional<Feed> findFeed(long feedId) throws DatabaseException {
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-feed"))) {
                ps.setLong(1, feedId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapFeed(rs)) : Optional.<Feed>empty();
                }
            }
        });
    }

    public void updateLastSynced(long feedId, Instant timestamp) throws DatabaseException {
        pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-feed-last-synced"))) {
                ps.setLong(1, timestamp.getEpochSecond());
                ps.setLong(2, feedId);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Deletes a feed. Its items go with it through the {@code ON DELETE
     * CASCADE} foreign key.
     *
     * @return {@code false} if no feed had this id
     */
    public boolean deleteFeed(long feedId) throws DatabaseException {
        int deleted = pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-feed"))) {
                ps.setLong(1, feedId);
                return ps.executeUpdate();
            }
        });
        if (deleted > 0)
            LOG.info("[DB] Deleted feed {} and its items.", feedId);
        return deleted > 0;
    }

    // =====================================================================
    // Items
    // =====================================================================

    /**
     * Stores {@code entry} unless an item with the same dedup key exists.
     *
     * @return {@code true} if a new row was created, {@code false} if the key
     *         was already present
     */
    public boolean insertItemIfAbsent(long feedId, FeedEntry entry) throws DatabaseException {
        int inserted = pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-feed-item"))) {
                ps.setLong(1, feedId);
                ps.setString(2, entry.title());
                ps.setString(3, entry.link());
                ps.setString(4, entry.description());
                ps.setLong(5, entry.publishedAt().getEpochSecond());
                ps.setString(6, entry.dedupKey());
                ps.setLong(7, clock.instant().getEpochSecond());
                return ps.executeUpdate();
            }
        });
        return inserted == 1;
    }

    /** Newest items across all feeds, ordered by publication time. */
    public List<FeedItem> listLatestItems(int limit) throws DatabaseException {
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-latest-feed-items"))) {
                ps.setInt(1, limit);
                return queryItems(ps);
            }
        });
    }

    public List<FeedItem> listItems(long feedId) throws DatabaseException {
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-feed-items-for-feed"))) {
                ps.setLong(1, feedId);
                return queryItems(ps);
            }
        });
    }

    public int countItems(long feedId) throws DatabaseException {
        return pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-feed-items"))) {
                ps.setLong(1, feedId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private Feed queryFeed(Connection conn, String sql, String url) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, url);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    throw new SQLException("Feed vanished after insert: " + url);
                return mapFeed(rs);
            }
        }
    }

    private List<FeedItem> queryItems(PreparedStatement ps) throws SQLException {
        List<FeedItem> items = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                items.add(mapItem(rs));
        }
        return items;
    }

    private Feed mapFeed(ResultSet rs) throws SQLException {
        long lastSynced = rs.getLong("last_synced_at");
        Instant lastSyncedAt = rs.wasNull() ? null : Instant.ofEpochSecond(lastSynced);
        return new Feed(
                rs.getLong("id"), rs.getString("title"), rs.getString("url"),
                lastSyncedAt, Instant.ofEpochSecond(rs.getLong("created_at")));
    }

    private FeedItem mapItem(ResultSet rs) throws SQLException {
        return new FeedItem(
                rs.getLong("id"), rs.getLong("feed_id"),
                rs.getString("title"), Strings.nullToEmpty(rs.getString("link")),
                Strings.nullToEmpty(rs.getString("description")),
                Instant.ofEpochSecond(rs.getLong("published_at")),
                rs.getString("dedup_key"),
                Instant.ofEpochSecond(rs.getLong("created_at")));
    }

    private static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage();
        return message != null && message.toUpperCase(Locale.ROOT).contains("UNIQUE");
    }
}
