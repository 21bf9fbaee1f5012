package de.bsommerfeld.drydock.feeds;

/**
 * A single feed could not be synced. Raised per feed; the batch sync turns it
 * into a {@link FeedFailure} and moves on to the next feed.
 */
public class FeedSyncException extends Exception {

    public FeedSyncException(String message) {
        super(message);
    }

    public FeedSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
