package de.bsommerfeld.drydock.core.event;

import de.bsommerfeld.drydock.core.view.ViewKey;

import java.util.Objects;

/**
 * Events exchanged between the background sync and whatever renders the
 * data. Only events both sides need to produce or consume belong here.
 */
public final class SyncEvents {

    private SyncEvents() {
    }

    /**
     * The cached data behind {@code view} no longer reflects the store and
     * must be reloaded before the next render.
     */
    public record ViewStaleEvent(ViewKey view) {
        public ViewStaleEvent {
            Objects.requireNonNull(view, "view");
        }
    }

    /**
     * Fired after every sync cycle, successful or not.
     *
     * @param itemsAdded   new items stored across all feeds
     * @param failureCount feeds that could not be synced this cycle
     * @param description  human-readable summary for the log view
     */
    public record FeedSyncCompletedEvent(int itemsAdded, int failureCount, String description) {
        public boolean isFullSuccess() {
            return failureCount == 0;
        }
    }
}
