/**
 * Persistence for feeds, feed items and the application log, backed by a
 * single SQLite file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Ingestion / Scheduler / View models]
 *        │
 *        ▼
 *   FeedRepository, LogRepository   ← typed, parameterized SQL
 *        │
 *        ▼
 *   ConnectionPool                  ← HikariCP over sqlite-jdbc, WAL + FK on
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * feeds       id, title, url (UNIQUE), last_synced_at, created_at
 * feed_items  id, feed_id (FK → feeds, ON DELETE CASCADE), title, link,
 *             description, published_at, dedup_key (UNIQUE), created_at
 * logs        id, level, message, timestamp
 * </pre>
 *
 * Timestamps are epoch seconds. {@code feed_items} is indexed by
 * {@code feed_id} and by {@code published_at DESC}; {@code logs} by
 * {@code timestamp DESC} and {@code level}.
 *
 * <h2>SQL files</h2>
 * {@code schema.sql} sits at the classpath root and is applied by
 * {@link de.bsommerfeld.drydock.db.ConnectionPool} whenever a pool opens.
 * Every other statement lives in {@code sql/*.sql} and is loaded through
 * {@link de.bsommerfeld.drydock.db.SqlLoader}.
 */
package de.bsommerfeld.drydock.db;
