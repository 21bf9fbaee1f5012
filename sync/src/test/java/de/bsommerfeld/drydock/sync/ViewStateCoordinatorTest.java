package de.bsommerfeld.drydock.sync;

import de.bsommerfeld.drydock.core.event.ApplicationEventBus;
import de.bsommerfeld.drydock.core.event.SyncEvents.ViewStaleEvent;
import de.bsommerfeld.drydock.core.view.ViewKey;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ViewStateCoordinatorTest {

    @Test
    void newCoordinator_shouldReportNothingStale() {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();

        for (ViewKey key : ViewKey.values())
            assertFalse(coordinator.isStale(key));
        assertTrue(coordinator.drainStale().isEmpty());
    }

    @Test
    void markStale_thenClear_shouldToggleOnlyThatView() {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();

        coordinator.markStale(ViewKey.FEED_ITEMS);
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
        assertFalse(coordinator.isStale(ViewKey.LOGS));

        coordinator.clearStale(ViewKey.FEED_ITEMS);
        assertFalse(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    @Test
    void markStale_twice_shouldNeedSingleClear() {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();

        coordinator.markStale(ViewKey.FEEDS);
        coordinator.markStale(ViewKey.FEEDS);
        coordinator.clearStale(ViewKey.FEEDS);

        assertFalse(coordinator.isStale(ViewKey.FEEDS));
    }

    @Test
    void drainStale_shouldReturnAndResetAllStaleViews() {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();
        coordinator.markStale(ViewKey.FEEDS);
        coordinator.markStale(ViewKey.LOGS);

        Set<ViewKey> drained = coordinator.drainStale();

        assertEquals(EnumSet.of(ViewKey.FEEDS, ViewKey.LOGS), drained);
        assertFalse(coordinator.isStale(ViewKey.FEEDS));
        assertTrue(coordinator.drainStale().isEmpty());
    }

    @Test
    void viewStaleEvent_shouldMarkViewThroughEventBus() {
        ApplicationEventBus bus = new ApplicationEventBus();
        ViewStateCoordinator coordinator = new ViewStateCoordinator(bus);

        bus.post(new ViewStaleEvent(ViewKey.LOGS));

        assertTrue(coordinator.isStale(ViewKey.LOGS));
    }

    @Test
    void concurrentMarkStale_shouldLeaveViewStale() throws Exception {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 1_000; i++)
                        coordinator.markStale(ViewKey.FEED_ITEMS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertTrue(coordinator.isStale(ViewKey.FEED_ITEMS));
    }

    @Test
    void concurrentMarkAndDrain_shouldNeverLoseAMark() throws Exception {
        ViewStateCoordinator coordinator = new ViewStateCoordinator();
        ViewKey[] keys = ViewKey.values();
        AtomicBoolean producing = new AtomicBoolean(true);
        EnumSet<ViewKey> seen = EnumSet.noneOf(ViewKey.class);

        Thread producer = new Thread(() -> {
            for (int i = 0; i < 50_000; i++)
                coordinator.markStale(keys[i % keys.length]);
            producing.set(false);
        });
        producer.start();

        while (producing.get())
            seen.addAll(coordinator.drainStale());
        producer.join(10_000);
        seen.addAll(coordinator.drainStale());

        assertEquals(EnumSet.allOf(ViewKey.class), seen);
        assertTrue(coordinator.drainStale().isEmpty());
    }
}
