package de.bsommerfeld.drydock.db;

/**
 * A feed with the same source URL is already subscribed.
 */
public class DuplicateFeedException extends DatabaseException {

    public DuplicateFeedException(String url, Throwable cause) {
        super("Feed already exists: " + url, cause);
    }
}
