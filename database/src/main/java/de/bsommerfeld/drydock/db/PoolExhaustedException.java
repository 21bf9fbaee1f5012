package de.bsommerfeld.drydock.db;

/**
 * Every pooled connection stayed leased for the whole acquisition timeout.
 */
public class PoolExhaustedException extends DatabaseException {

    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
