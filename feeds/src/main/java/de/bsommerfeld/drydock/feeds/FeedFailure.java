package de.bsommerfeld.drydock.feeds;

import de.bsommerfeld.drydock.db.DatabaseException;

import java.util.Objects;

/**
 * Why one feed produced no result in a batch sync.
 *
 * @param feedId {@link #NO_FEED} when the failure is not tied to a single feed
 */
public record FeedFailure(long feedId, String title, Kind kind, String reason) {

    public static final long NO_FEED = -1;

    public enum Kind {
        /** Transport, status or URL problem, or any unexpected failure. */
        FETCH,
        /** Body is neither RSS nor Atom. */
        PARSE,
        /** The store rejected a read or write. */
        STORAGE
    }

    public FeedFailure {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
    }

    static FeedFailure of(long feedId, String title, Exception cause) {
        Kind kind;
        if (cause instanceof FeedParseException)
            kind = Kind.PARSE;
        else if (cause instanceof DatabaseException)
            kind = Kind.STORAGE;
        else
            kind = Kind.FETCH;
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FeedFailure(feedId, title, kind, reason);
    }

    @Override
    public String toString() {
        return title + ": " + reason;
    }
}
