package de.bsommerfeld.drydock.feeds;

import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a fetched document into normalized entries by trying each dialect in
 * order. RSS goes first; Atom is only attempted when RSS rejects the
 * document.
 */
@Singleton
public class FeedParser {

    private static final Logger LOG = LoggerFactory.getLogger(FeedParser.class);

    private final List<FeedDialect> dialects;

    public FeedParser() {
        this(List.of(new RssDialect(), new AtomDialect()));
    }

    FeedParser(List<FeedDialect> dialects) {
        this.dialects = List.copyOf(dialects);
    }

    /**
     * @throws FeedParseException if no dialect accepts {@code document}; the
     *                            first dialect's failure is the cause
     */
    public List<FeedEntry> parse(FetchedDocument document, Instant now) throws FeedParseException {
        List<FeedParseException> failures = new ArrayList<>();
        for (FeedDialect dialect : dialects) {
            try {
                List<FeedEntry> entries = dialect.parse(document, now);
                LOG.debug("Parsed {} entries as {}", entries.size(), dialect.name());
                return entries;
            } catch (FeedParseException e) {
                LOG.trace("{} rejected document: {}", dialect.name(), e.getMessage());
                failures.add(e);
            }
        }

        FeedParseException failure = new FeedParseException("Failed to parse feed as RSS or Atom",
                failures.isEmpty() ? null : failures.get(0));
        for (int i = 1; i < failures.size(); i++)
            failure.addSuppressed(failures.get(i));
        throw failure;
    }
}
