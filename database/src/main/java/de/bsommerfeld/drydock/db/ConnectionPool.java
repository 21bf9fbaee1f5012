package de.bsommerfeld.drydock.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import de.bsommerfeld.drydock.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded pool of SQLite connections backed by HikariCP.
 *
 * <h3>Connection setup</h3>
 * Every physical connection is opened through a {@link SQLiteConfig} that
 * turns on foreign key enforcement ({@code ON DELETE CASCADE} depends on it)
 * and switches the journal to WAL, so readers on the render thread are not
 * blocked while the scheduler writes.
 *
 * <h3>Lifecycle</h3>
 * The application calls {@link #initialize} exactly once; the resulting pool
 * is held process-wide and reachable through {@link #get()}. Tests and tools
 * that need an isolated store use {@link #open} instead.
 *
 * <h3>Leasing</h3>
 * {@link #acquire()} hands out a connection the caller owns exclusively until
 * it is closed. Once {@code max-pool-size} connections are leased, further
 * callers wait at most {@code acquire-timeout-millis} and then fail with
 * {@link PoolExhaustedException}.
 */
public final class ConnectionPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private static final String SCHEMA_RESOURCE = "schema.sql";
    private static final AtomicReference<ConnectionPool> INSTANCE = new AtomicReference<>();

    private final Path databaseFile;
    private final HikariDataSource dataSource;
    private final long acquireTimeoutMillis;

    private ConnectionPool(Path databaseFile, HikariDataSource dataSource, long acquireTimeoutMillis) {
        this.databaseFile = databaseFile;
        this.dataSource = dataSource;
        this.acquireTimeoutMillis = acquireTimeoutMillis;
    }

    // =====================================================================
    // Process-wide instance
    // =====================================================================

    /**
     * Opens the process-wide pool at {@code databaseFile}, creating the store
     * and applying the schema if needed.
     *
     * @throws DatabaseInitializationException if the store cannot be opened or
     *                                         migrated, or if the pool was
     *                                         already initialized
     */
    public static ConnectionPool initialize(Path databaseFile, DatabaseConfig config)
            throws DatabaseInitializationException {
        synchronized (INSTANCE) {
            if (INSTANCE.get() != null) {
                throw new DatabaseInitializationException(
                        "Database pool already initialized at " + INSTANCE.get().databaseFile);
            }
            ConnectionPool pool = open(databaseFile, config);
            INSTANCE.set(pool);
            return pool;
        }
    }

    /**
     * @throws NotInitializedException if {@link #initialize} has not run
     */
    public static ConnectionPool get() throws NotInitializedException {
        ConnectionPool pool = INSTANCE.get();
        if (pool == null)
            throw new NotInitializedException();
        return pool;
    }

    /** Closes and forgets the process-wide pool. Shutdown and tests only. */
    public static void shutdown() {
        synchronized (INSTANCE) {
            ConnectionPool pool = INSTANCE.getAndSet(null);
            if (pool != null)
                pool.close();
        }
    }

    // =====================================================================
    // Standalone pools
    // =====================================================================

    /**
     * Opens a pool that is not registered process-wide. The caller owns it and
     * must {@link #close()} it.
     */
    public static ConnectionPool open(Path databaseFile, DatabaseConfig config)
            throws DatabaseInitializationException {
        Path file = databaseFile.toAbsolutePath();
        ensureStoreLocation(file);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig(file, config));
        } catch (RuntimeException e) {
            throw new DatabaseInitializationException("Failed to open connection pool for " + file, e);
        }

        ConnectionPool pool = new ConnectionPool(file, dataSource, config.getAcquireTimeoutMillis());
        try {
            pool.applySchema();
        } catch (SQLException | RuntimeException e) {
            dataSource.close();
            throw new DatabaseInitializationException("Schema migration failed for " + file, e);
        }
        LOG.info("Database ready at {} (max {} connections)", file, config.getMaxPoolSize());
        return pool;
    }

    private static void ensureStoreLocation(Path file) throws DatabaseInitializationException {
        Path parent = file.getParent();
        try {
            if (parent != null)
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DatabaseInitializationException("Cannot create database directory " + parent, e);
        }
        if (Files.exists(file)) {
            if (!Files.isWritable(file))
                throw new DatabaseInitializationException("Database file is not writable: " + file);
        } else {
            if (parent != null && !Files.isWritable(parent))
                throw new DatabaseInitializationException("Database directory is not writable: " + parent);
            LOG.info("No database at {}, creating a new one.", file);
        }
    }

    private static HikariConfig hikariConfig(Path file, DatabaseConfig config) {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(config.getBusyTimeoutMillis());

        SQLiteDataSource source = new SQLiteDataSource(sqlite);
        source.setUrl("jdbc:sqlite:" + file);

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("drydock-sqlite");
        hikari.setDataSource(source);
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(config.getAcquireTimeoutMillis());
        return hikari;
    }

    /**
     * Applies {@code schema.sql} in one transaction. Every statement is
     * {@code CREATE ... IF NOT EXISTS}, so re-running on an existing store is
     * a no-op. Any failing statement aborts the migration.
     */
    private void applySchema() throws SQLException {
        String schemaSql = SqlLoader.readRaw(SCHEMA_RESOURCE);
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            conn.setAutoCommit(false);
            try {
                for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                    if (sql.trim().isEmpty())
                        continue;
                    stmt.execute(sql.trim());
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
        LOG.info("Database schema applied.");
    }

    // =====================================================================
    // Leasing
    // =====================================================================

    /**
     * Leases a connection. Closing it returns it to the pool, so callers use
     * try-with-resources.
     *
     * @throws PoolExhaustedException if no connection became free within the
     *                                acquisition timeout
     * @throws DatabaseException      if the pool is closed or the store is
     *                                unreachable
     */
    public Connection acquire() throws DatabaseException {
        try {
            return dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            throw new PoolExhaustedException(
                    "No database connection available within " + acquireTimeoutMillis + " ms", e);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to acquire database connection", e);
        }
    }

    /**
     * Runs {@code work} on a leased connection and returns the connection on
     * every exit path.
     */
    public <T> T withConnection(SqlWork<T> work) throws DatabaseException {
        try (Connection conn = acquire()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new DatabaseException("Database operation failed: " + e.getMessage(), e);
        }
    }

    /** Connections currently leased to callers. */
    public int leasedConnections() {
        return dataSource.getHikariPoolMXBean().getActiveConnections();
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            LOG.info("Closing database pool for {}", databaseFile);
            dataSource.close();
        }
    }
}
