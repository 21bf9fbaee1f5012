package de.bsommerfeld.drydock.feeds;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.domain.Feed;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import de.bsommerfeld.drydock.db.DatabaseException;
import de.bsommerfeld.drydock.db.FeedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches, parses and stores subscribed feeds.
 *
 * <h3>Pipeline per feed</h3>
 *
 * <pre>
 * syncFeed()
 *   ├ FeedUrls.normalize()          → scheme added, blank rejected
 *   ├ FeedFetcher.fetch()           → raw document
 *   ├ FeedParser.parse()            → RSS, then Atom
 *   ├ insertItemIfAbsent() per item → dedup on dedup_key
 *   └ updateLastSynced()
 * </pre>
 *
 * <h3>Failure isolation</h3>
 * A failing item is logged and skipped. A failing feed aborts only that feed;
 * {@link #syncAllFeeds()} records it and continues with the next one. Feeds
 * are processed sequentially on the calling thread.
 */
@Singleton
public class FeedIngestionService {

    private static final Logger LOG = LoggerFactory.getLogger(FeedIngestionService.class);

    private final FeedRepository repository;
    private final FeedFetcher fetcher;
    private final FeedParser parser;
    private final Clock clock;

    @Inject
    public FeedIngestionService(FeedRepository repository, FeedFetcher fetcher, FeedParser parser) {
        this(repository, fetcher, parser, Clock.systemUTC());
    }

    FeedIngestionService(FeedRepository repository, FeedFetcher fetcher, FeedParser parser, Clock clock) {
        this.repository = repository;
        this.fetcher = fetcher;
        this.parser = parser;
        this.clock = clock;
    }

    /**
     * Syncs one feed.
     *
     * @return number of entries that were not stored before
     * @throws FetchException     if the URL is blank or the document cannot be
     *                            retrieved
     * @throws FeedParseException if the document is neither RSS nor Atom
     * @throws DatabaseException  if the sync timestamp cannot be written
     */
    public int syncFeed(long feedId, String url) throws FeedSyncException, DatabaseException {
        String normalized = FeedUrls.normalize(url);
        if (!normalized.equals(url.trim()))
            LOG.info("URL missing protocol, fetching {} instead", normalized);

        LOG.debug("Fetching feed {} from {}", feedId, normalized);
        FetchedDocument document = fetcher.fetch(normalized);
        List<FeedEntry> entries = parser.parse(document, clock.instant());

        int added = 0;
        for (FeedEntry entry : entries) {
            try {
                if (repository.insertItemIfAbsent(feedId, entry))
                    added++;
            } catch (DatabaseException e) {
                LOG.warn("Failed to store item '{}' of feed {}: {}", entry.dedupKey(), feedId, e.getMessage());
            }
        }

        repository.updateLastSynced(feedId, clock.instant());
        LOG.debug("Feed {}: {} of {} entries were new", feedId, added, entries.size());
        return added;
    }

    /**
     * Syncs every subscribed feed. Never throws; every failure ends up in the
     * returned summary.
     */
    public SyncSummary syncAllFeeds() {
        List<Feed> feeds;
        try {
            feeds = repository.listFeeds();
        } catch (DatabaseException e) {
            LOG.error("Failed to list feeds for sync", e);
            return new SyncSummary(0, 0,
                    List.of(FeedFailure.of(FeedFailure.NO_FEED, "Feed list", e)));
        }

        LOG.info("Found {} feeds to refresh", feeds.size());
        int totalAdded = 0;
        List<FeedFailure> failures = new ArrayList<>();

        for (Feed feed : feeds) {
            try {
                int added = syncFeed(feed.id(), feed.url());
                LOG.info("Feed {} ({}): added {} items", feed.id(), feed.title(), added);
                totalAdded += added;
            } catch (FeedSyncException | DatabaseException e) {
                LOG.warn("Feed {} ({}) failed: {}", feed.id(), feed.title(), e.getMessage());
                failures.add(FeedFailure.of(feed.id(), feed.title(), e));
            } catch (RuntimeException e) {
                LOG.error("Feed {} ({}) failed unexpectedly", feed.id(), feed.title(), e);
                failures.add(FeedFailure.of(feed.id(), feed.title(), e));
            }
        }

        return new SyncSummary(feeds.size(), totalAdded, failures);
    }
}
