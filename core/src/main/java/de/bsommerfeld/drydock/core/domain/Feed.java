package de.bsommerfeld.drydock.core.domain;

import java.time.Instant;

/**
 * A subscribed syndication feed. The {@code url} is unique across all feeds.
 *
 * @param id           surrogate key assigned by the store
 * @param title        display title chosen when the feed was added
 * @param url          source URL as entered by the user, possibly without a
 *                     scheme
 * @param lastSyncedAt completion time of the last successful sync,
 *                     {@code null} if the feed was never synced
 * @param createdAt    time the subscription was created
 */
public record Feed(
        long id,
        String title,
        String url,
        Instant lastSyncedAt,
        Instant createdAt) {

    public boolean hasBeenSynced() {
        return lastSyncedAt != null;
    }
}
