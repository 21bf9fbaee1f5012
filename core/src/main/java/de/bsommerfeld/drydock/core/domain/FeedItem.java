package de.bsommerfeld.drydock.core.domain;

import java.time.Instant;

/**
 * A stored feed entry. Items are immutable once written and are deleted only
 * together with their owning feed.
 *
 * @param id          surrogate key assigned by the store
 * @param feedId      owning feed
 * @param title       entry title
 * @param link        entry link, may be empty
 * @param description summary text, may be empty
 * @param publishedAt publication time reported by the source, or the ingestion
 *                    time when the source omitted it
 * @param dedupKey    store-wide unique identity of the remote entry
 * @param createdAt   time the row was written
 */
public record FeedItem(
        long id,
        long feedId,
        String title,
        String link,
        String description,
        Instant publishedAt,
        String dedupKey,
        Instant createdAt) {
}
