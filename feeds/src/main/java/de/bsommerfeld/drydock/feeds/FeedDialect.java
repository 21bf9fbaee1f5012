package de.bsommerfeld.drydock.feeds;

import de.bsommerfeld.drydock.core.domain.FeedEntry;

import java.time.Instant;
import java.util.List;

/**
 * One syndication format the {@link FeedParser} can read.
 */
public interface FeedDialect {

    /** Short name used in log and error messages. */
    String name();

    /**
     * Parses {@code document} and normalizes every entry.
     *
     * @param now fallback publication time for entries without a date
     * @throws FeedParseException if {@code document} is not a document of
     *                            this dialect
     */
    List<FeedEntry> parse(FetchedDocument document, Instant now) throws FeedParseException;
}
