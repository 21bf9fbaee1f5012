package de.bsommerfeld.drydock.feeds;

/** The body was fetched but is neither RSS nor Atom. */
public class FeedParseException extends FeedSyncException {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
