package de.bsommerfeld.drydock.app;

import de.bsommerfeld.drydock.core.config.DatabaseConfig;
import de.bsommerfeld.drydock.core.domain.Feed;
import de.bsommerfeld.drydock.core.domain.FeedEntry;
import de.bsommerfeld.drydock.core.event.ApplicationEventBus;
import de.bsommerfeld.drydock.core.view.ViewKey;
import de.bsommerfeld.drydock.db.ConnectionPool;
import de.bsommerfeld.drydock.db.FeedRepository;
import de.bsommerfeld.drydock.db.LogRepository;
import de.bsommerfeld.drydock.feeds.FeedFailure;
import de.bsommerfeld.drydock.feeds.FeedIngestionService;
import de.bsommerfeld.drydock.feeds.SyncSummary;
import de.bsommerfeld.drydock.sync.FeedSyncScheduler;
import de.bsommerfeld.drydock.sync.ViewStateCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests the render-side reload discipline of FeedsViewModel against a real
 * SQLite store. Manual refreshes go through a real scheduler whose ingestion
 * is mocked.
 */
class FeedsViewModelTest {

    private static final Instant NOW = Instant.parse("2026-03-05T12:00:00Z");

    @TempDir
    Path tempDir;

    private ConnectionPool pool;
    private FeedRepository repository;
    private FeedIngestionService ingestion;
    private ViewStateCoordinator coordinator;
    private FeedSyncScheduler scheduler;
    private FeedsViewModel viewModel;

    @BeforeEach
    void setUp() throws Exception {
        pool = ConnectionPool.open(tempDir.resolve("view.db"), new DatabaseConfig());
        repository = new FeedRepository(pool);
        ingestion = mock(FeedIngestionService.class);
        ApplicationEventBus eventBus = new ApplicationEventBus();
        coordinator = new ViewStateCoordinator(eventBus);
        scheduler = new FeedSyncScheduler(ingestion, new LogRepository(pool), eventBus,
                Duration.ofMinutes(5), Executors.newSingleThreadScheduledExecutor());
        viewModel = new FeedsViewModel(repository, scheduler, coordinator, eventBus);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        pool.close();
    }

    // -- Reload discipline --

    @Test
    void items_firstCall_shouldLoadFromStore() throws Exception {
        Feed feed = repository.createFeed("A", "https://a.example/rss");
        repository.insertItemIfAbsent(feed.id(), entry("a-1"));

        assertEquals(1, viewModel.items().size());
    }

    @Test
    void items_notStale_shouldServeCachedList() throws Exception {
        Feed feed = repository.createFeed("A", "https://a.example/rss");
        viewModel.items();

        repository.insertItemIfAbsent(feed.id(), entry("a-1"));

        assertTrue(viewModel.items().isEmpty());
    }

    @Test
    void items_stale_shouldReloadAndClearFlag() throws Exception {
        Feed feed = repository.createFeed("A", "https://a.example/rss");
        viewModel.items();
        repository.insertItemIfAbsent(feed.id(), entry("a-1"));

        coordinator.markStale(ViewKey.FEED_ITEMS);

        assertEquals(1, viewModel.items().size());
        assertFalse(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    @Test
    void items_storeFailure_shouldKeepCacheAndStayStale() throws Exception {
        Feed feed = repository.createFeed("A", "https://a.example/rss");
        repository.insertItemIfAbsent(feed.id(), entry("a-1"));
        viewModel.items();

        pool.close();
        coordinator.markStale(ViewKey.FEED_ITEMS);

        assertEquals(1, viewModel.items().size());
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    // -- Actions --

    @Test
    void addFeed_shouldMarkFeedViewsStale() throws Exception {
        assertTrue(viewModel.feeds().isEmpty());

        viewModel.addFeed("A", "https://a.example/rss");

        assertTrue(coordinator.isStale(ViewKey.FEEDS));
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
        assertEquals(1, viewModel.feeds().size());
    }

    @Test
    void deleteFeed_shouldRemoveItemsAndMarkStale() throws Exception {
        Feed feed = repository.createFeed("A", "https://a.example/rss");
        repository.insertItemIfAbsent(feed.id(), entry("a-1"));
        assertEquals(1, viewModel.items().size());

        assertTrue(viewModel.deleteFeed(feed.id()));

        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
        assertTrue(viewModel.items().isEmpty());
    }

    @Test
    void deleteFeed_unknownId_shouldNotMarkStale() throws Exception {
        viewModel.items();

        assertFalse(viewModel.deleteFeed(42));
        assertFalse(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    @Test
    void refreshAll_shouldSyncAndMarkViewsStale() throws Exception {
        when(ingestion.syncAllFeeds()).thenReturn(new SyncSummary(1, 4, List.of()));

        SyncSummary summary = viewModel.refreshAll().get(5, TimeUnit.SECONDS);

        assertEquals(4, summary.itemsAdded());
        assertTrue(coordinator.isStale(ViewKey.FEEDS));
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
        verify(ingestion, times(1)).syncAllFeeds();
    }

    @Test
    void refreshAll_shouldUpdateLastSyncStatus() throws Exception {
        FeedFailure failure = new FeedFailure(1, "Broken", FeedFailure.Kind.FETCH, "HTTP error: 503");
        when(ingestion.syncAllFeeds()).thenReturn(new SyncSummary(2, 1, List.of(failure)));
        assertEquals("", viewModel.lastSyncStatus());

        viewModel.refreshAll().get(5, TimeUnit.SECONDS);

        assertTrue(viewModel.lastSyncStatus().startsWith("Refreshed feeds with 1 errors"));
    }

    @Test
    void refreshAll_stoppedScheduler_shouldFailWithoutSyncing() {
        scheduler.stop();

        CompletableFuture<SyncSummary> future = viewModel.refreshAll();

        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        verifyNoInteractions(ingestion);
    }

    @Test
    void refreshAll_failingSync_shouldStillMarkViewsStale() {
        when(ingestion.syncAllFeeds()).thenThrow(new IllegalStateException("offline"));

        CompletableFuture<SyncSummary> future = viewModel.refreshAll();

        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    private static FeedEntry entry(String key) {
        return new FeedEntry("Item " + key, "https://a.example/" + key, "", NOW, key);
    }
}
