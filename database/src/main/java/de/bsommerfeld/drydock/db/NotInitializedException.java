package de.bsommerfeld.drydock.db;

/**
 * The process-wide {@link ConnectionPool} was requested before
 * {@link ConnectionPool#initialize} ran.
 */
public class NotInitializedException extends DatabaseException {

    public NotInitializedException() {
        super("Database not initialized. Call ConnectionPool.initialize first.");
    }
}
