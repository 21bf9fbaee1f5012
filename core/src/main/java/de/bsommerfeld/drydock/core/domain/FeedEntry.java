package de.bsommerfeld.drydock.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A parsed and normalized remote entry that has not been stored yet. Every
 * field is non-null; absent values are normalized before construction.
 *
 * @param dedupKey the entry's own identifier (RSS guid, Atom id), or its link
 *                 when the source provides no identifier
 */
public record FeedEntry(
        String title,
        String link,
        String description,
        Instant publishedAt,
        String dedupKey) {

    public FeedEntry {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(link, "link");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(publishedAt, "publishedAt");
        Objects.requireNonNull(dedupKey, "dedupKey");
    }
}
