package de.bsommerfeld.drydock.sync;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.config.DryDockConfig;
import de.bsommerfeld.drydock.core.domain.LogLevel;
import de.bsommerfeld.drydock.core.event.ApplicationEventBus;
import de.bsommerfeld.drydock.core.event.SyncEvents.FeedSyncCompletedEvent;
import de.bsommerfeld.drydock.core.event.SyncEvents.ViewStaleEvent;
import de.bsommerfeld.drydock.core.view.ViewKey;
import de.bsommerfeld.drydock.db.DatabaseException;
import de.bsommerfeld.drydock.db.LogRepository;
import de.bsommerfeld.drydock.feeds.FeedIngestionService;
import de.bsommerfeld.drydock.feeds.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link FeedIngestionService#syncAllFeeds()} periodically on a
 * dedicated thread.
 *
 * <h3>Cycle</h3>
 * The first cycle runs one interval after {@link #start()}; the next one is
 * scheduled one interval after the previous finished, so cycles never
 * overlap. Each cycle logs its outcome, records it in the log view and then
 * posts {@link ViewStaleEvent}s for the feed views. Staleness is signalled
 * even when the cycle failed.
 *
 * <h3>Manual sync</h3>
 * {@link #requestSync()} queues a cycle on the same single-thread executor,
 * so a user-triggered sync and a scheduled cycle run one after the other and
 * never over the same feeds at once.
 *
 * <h3>Resilience</h3>
 * Nothing thrown inside a cycle escapes it; a task that throws would cancel
 * every later execution of the {@code ScheduledExecutorService}.
 */
@Singleton
public class FeedSyncScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(FeedSyncScheduler.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final FeedIngestionService ingestion;
    private final LogRepository logRepository;
    private final ApplicationEventBus eventBus;
    private final Duration interval;
    private final ScheduledExecutorService executor;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private volatile ScheduledFuture<?> schedule;

    @Inject
    public FeedSyncScheduler(FeedIngestionService ingestion, LogRepository logRepository,
            ApplicationEventBus eventBus, DryDockConfig config) {
        this(ingestion, logRepository, eventBus,
                Duration.ofSeconds(config.getSync().getIntervalSeconds()),
                Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                        .setNameFormat("feed-sync-%d")
                        .setDaemon(true)
                        .build()));
    }

    public FeedSyncScheduler(FeedIngestionService ingestion, LogRepository logRepository,
            ApplicationEventBus eventBus, Duration interval, ScheduledExecutorService executor) {
        if (interval.isZero() || interval.isNegative())
            throw new IllegalArgumentException("Sync interval must be positive: " + interval);
        this.ingestion = ingestion;
        this.logRepository = logRepository;
        this.eventBus = eventBus;
        this.interval = interval;
        this.executor = executor;
    }

    // -- Lifecycle --

    /** Schedules the recurring sync. Calling it again is a no-op. */
    public void start() {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.SLEEPING)) {
            LOG.debug("Feed sync scheduler already started or stopped ({})", state.get());
            return;
        }
        long millis = interval.toMillis();
        schedule = executor.scheduleWithFixedDelay(this::runCycle, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Feed sync scheduled every {}s", interval.toSeconds());
    }

    /**
     * Cancels the schedule and shuts the executor down. A cycle in progress
     * gets {@value #SHUTDOWN_TIMEOUT_SECONDS}s to finish before it is
     * interrupted.
     */
    public void stop() {
        SchedulerState previous = state.getAndSet(SchedulerState.STOPPED);
        if (previous == SchedulerState.STOPPED)
            return;

        ScheduledFuture<?> current = schedule;
        if (current != null)
            current.cancel(false);

        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Feed sync did not finish within {}s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Feed sync scheduler stopped");
    }

    public SchedulerState getState() {
        return state.get();
    }

    public Duration getInterval() {
        return interval;
    }

    // -- Cycle --

    /**
     * Queues one cycle on the sync thread, behind any cycle already running.
     * Works whether or not the schedule was started.
     *
     * @return completes with the cycle's summary, or exceptionally if the
     *         scheduler is stopped or the cycle failed
     */
    public CompletableFuture<SyncSummary> requestSync() {
        CompletableFuture<SyncSummary> result = new CompletableFuture<>();
        if (state.get() == SchedulerState.STOPPED) {
            result.completeExceptionally(new IllegalStateException("Feed sync scheduler is stopped"));
            return result;
        }
        try {
            executor.execute(() -> runCycle().ifPresentOrElse(result::complete,
                    () -> result.completeExceptionally(new IllegalStateException("Feed sync cycle did not complete"))));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Runs one sync cycle on the calling thread. Used by the schedule, by
     * {@link #requestSync()} and directly by tests.
     *
     * @return the cycle's summary, empty if the scheduler is stopped or the
     *         cycle failed
     */
    public Optional<SyncSummary> runCycle() {
        SchedulerState before = state.get();
        if (before == SchedulerState.STOPPED)
            return Optional.empty();
        state.compareAndSet(before, SchedulerState.RUNNING);

        try {
            LOG.info("Feed sync cycle started");
            SyncSummary summary = ingestion.syncAllFeeds();
            report(summary);
            eventBus.post(new FeedSyncCompletedEvent(
                    summary.itemsAdded(), summary.failureCount(), summary.describe()));
            return Optional.of(summary);
        } catch (Exception e) {
            LOG.error("Feed sync cycle failed", e);
            record(LogLevel.ERROR, "Feed sync failed: " + e.getMessage());
            return Optional.empty();
        } finally {
            eventBus.post(new ViewStaleEvent(ViewKey.FEEDS));
            eventBus.post(new ViewStaleEvent(ViewKey.FEED_ITEMS));
            eventBus.post(new ViewStaleEvent(ViewKey.LOGS));
            state.compareAndSet(SchedulerState.RUNNING,
                    before == SchedulerState.IDLE ? SchedulerState.IDLE : SchedulerState.SLEEPING);
        }
    }

    private void report(SyncSummary summary) {
        if (summary.isFullSuccess()) {
            LOG.info(summary.describe());
            record(LogLevel.INFO, summary.describe());
        } else {
            LOG.warn(summary.describe());
            record(LogLevel.WARNING, summary.describe());
        }
    }

    private void record(LogLevel level, String message) {
        try {
            logRepository.append(level, message);
        } catch (DatabaseException e) {
            LOG.warn("Could not record sync outcome in log view: {}", e.getMessage());
        }
    }
}
