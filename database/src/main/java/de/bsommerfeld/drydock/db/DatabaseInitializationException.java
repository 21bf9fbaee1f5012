package de.bsommerfeld.drydock.db;

/**
 * The store could not be created, opened or migrated. Fatal at startup.
 */
public class DatabaseInitializationException extends DatabaseException {

    public DatabaseInitializationException(String message) {
        super(message);
    }

    public DatabaseInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
