package de.bsommerfeld.drydock.app;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.domain.Feed;
import de.bsommerfeld.drydock.core.domain.FeedItem;
import de.bsommerfeld.drydock.core.event.ApplicationEventBus;
import de.bsommerfeld.drydock.core.event.SyncEvents.FeedSyncCompletedEvent;
import de.bsommerfeld.drydock.core.event.SyncEvents.ViewStaleEvent;
import de.bsommerfeld.drydock.core.view.ViewKey;
import de.bsommerfeld.drydock.db.DatabaseException;
import de.bsommerfeld.drydock.db.FeedRepository;
import de.bsommerfeld.drydock.feeds.SyncSummary;
import de.bsommerfeld.drydock.sync.FeedSyncScheduler;
import de.bsommerfeld.drydock.sync.ViewStateCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Render-side projection of the feed store.
 *
 * <p>
 * The view model owns its cached lists and is only touched from the render
 * loop. It never reloads on its own: a reload happens on first use and
 * whenever the {@link ViewStateCoordinator} reports the view stale. The
 * flag is cleared before the reload, so a sync finishing mid-reload leaves
 * the view stale for the next frame.
 *
 * <p>
 * Manual refreshes are handed to the {@link FeedSyncScheduler}, which runs
 * them on its own thread in line with the scheduled cycles. The outcome of
 * the last cycle, manual or scheduled, is kept for the status line.
 */
@Singleton
public class FeedsViewModel {

    private static final Logger LOG = LoggerFactory.getLogger(FeedsViewModel.class);

    /** Upper bound of items shown in the feed list. */
    static final int ITEM_LIMIT = 10_000;

    private final FeedRepository repository;
    private final FeedSyncScheduler scheduler;
    private final ViewStateCoordinator coordinator;
    private final ApplicationEventBus eventBus;

    private List<FeedItem> items;
    private List<Feed> feeds;
    private volatile String lastSyncStatus = "";

    @Inject
    public FeedsViewModel(FeedRepository repository, FeedSyncScheduler scheduler,
            ViewStateCoordinator coordinator, ApplicationEventBus eventBus) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
        eventBus.register(this);
    }

    // -- Render loop --

    /** Newest items across all feeds, reloaded only when stale. */
    public List<FeedItem> items() {
        if (items == null || coordinator.isStale(ViewKey.FEED_ITEMS)) {
            coordinator.clearStale(ViewKey.FEED_ITEMS);
            try {
                items = List.copyOf(repository.listLatestItems(ITEM_LIMIT));
            } catch (DatabaseException e) {
                LOG.error("Error loading feed items", e);
                coordinator.markStale(ViewKey.FEED_ITEMS);
                if (items == null)
                    items = List.of();
            }
        }
        return items;
    }

    /** Subscribed feeds, reloaded only when stale. */
    public List<Feed> feeds() {
        if (feeds == null || coordinator.isStale(ViewKey.FEEDS)) {
            coordinator.clearStale(ViewKey.FEEDS);
            try {
                feeds = List.copyOf(repository.listFeeds());
            } catch (DatabaseException e) {
                LOG.error("Error loading feeds", e);
                coordinator.markStale(ViewKey.FEEDS);
                if (feeds == null)
                    feeds = List.of();
            }
        }
        return feeds;
    }

    /** Description of the last finished sync cycle, empty before the first. */
    public String lastSyncStatus() {
        return lastSyncStatus;
    }

    @Subscribe
    public void onSyncCompleted(FeedSyncCompletedEvent event) {
        lastSyncStatus = event.description();
    }

    // -- Actions --

    /**
     * Syncs every feed on the sync thread. The returned future completes
     * after the cycle marked the feed views stale, and fails if the scheduler
     * is stopped.
     */
    public CompletableFuture<SyncSummary> refreshAll() {
        return scheduler.requestSync()
                .whenComplete((summary, error) -> {
                    if (error != null)
                        LOG.error("Manual feed refresh failed", error);
                    else
                        LOG.info("Manual feed refresh finished: {}", summary.describe());
                });
    }

    public Feed addFeed(String title, String url) throws DatabaseException {
        Feed feed = repository.createFeed(title, url);
        signalFeedViewsStale();
        return feed;
    }

    public boolean deleteFeed(long feedId) throws DatabaseException {
        boolean deleted = repository.deleteFeed(feedId);
        if (deleted)
            signalFeedViewsStale();
        return deleted;
    }

    private void signalFeedViewsStale() {
        eventBus.post(new ViewStaleEvent(ViewKey.FEEDS));
        eventBus.post(new ViewStaleEvent(ViewKey.FEED_ITEMS));
    }
}
