package de.bsommerfeld.drydock.feeds;

/**
 * The feed document could not be retrieved: blank URL, transport failure,
 * non-2xx status or a redirect chain that is too long.
 */
public class FetchException extends FeedSyncException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
