package de.bsommerfeld.drydock.sync;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.drydock.core.event.ApplicationEventBus;
import de.bsommerfeld.drydock.core.event.SyncEvents.ViewStaleEvent;
import de.bsommerfeld.drydock.core.view.ViewKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared presentation state between background producers and the render
 * loop. Holds one flag per {@link ViewKey}: stale or populated.
 *
 * <h3>Threading</h3>
 * Every read and write goes through a single {@link ReentrantLock}, so a
 * reader never sees a half-applied update. Producers either call
 * {@link #markStale} directly or post a {@link ViewStaleEvent}; the render
 * loop polls {@link #isStale}/{@link #clearStale} or consumes everything at
 * once through {@link #drainStale()}.
 *
 * <p>
 * The coordinator only tracks staleness. View data itself stays owned by
 * the render loop.
 */
@Singleton
public class ViewStateCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ViewStateCoordinator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final EnumSet<ViewKey> stale = EnumSet.noneOf(ViewKey.class);

    public ViewStateCoordinator() {
    }

    /** Creates the coordinator and subscribes it to {@link ViewStaleEvent}s. */
    @Inject
    public ViewStateCoordinator(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    public void markStale(ViewKey view) {
        lock.lock();
        try {
            if (stale.add(view))
                LOG.trace("View {} marked stale", view);
        } finally {
            lock.unlock();
        }
    }

    public boolean isStale(ViewKey view) {
        lock.lock();
        try {
            return stale.contains(view);
        } finally {
            lock.unlock();
        }
    }

    /** Called by the render loop after it reloaded {@code view}. */
    public void clearStale(ViewKey view) {
        lock.lock();
        try {
            stale.remove(view);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every stale view and marks them all populated in one step. A
     * view marked stale concurrently shows up either in this result or in
     * the next one, never in neither.
     */
    public Set<ViewKey> drainStale() {
        lock.lock();
        try {
            if (stale.isEmpty())
                return EnumSet.noneOf(ViewKey.class);
            EnumSet<ViewKey> drained = EnumSet.copyOf(stale);
            stale.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    @Subscribe
    public void onViewStale(ViewStaleEvent event) {
        markStale(event.view());
    }
}
