package de.bsommerfeld.drydock.db;

/**
 * Thrown when an operation against the embedded store fails. Subclasses
 * distinguish failures callers may want to treat differently.
 */
public class DatabaseException extends Exception {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
