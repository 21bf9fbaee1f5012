package de.bsommerfeld.drydock.feeds;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one {@link FeedIngestionService#syncAllFeeds()} run.
 *
 * @param feedsAttempted feeds the run tried to sync
 * @param itemsAdded     new items stored across all successful feeds
 * @param failures       one entry per failed feed, in processing order
 */
public record SyncSummary(int feedsAttempted, int itemsAdded, List<FeedFailure> failures) {

    public SyncSummary {
        failures = List.copyOf(failures);
    }

    public boolean isFullSuccess() {
        return failures.isEmpty();
    }

    /** Some feeds failed, but at least one went through. */
    public boolean isPartialSuccess() {
        return !failures.isEmpty() && failures.size() < feedsAttempted;
    }

    public int failureCount() {
        return failures.size();
    }

    /** Human-readable summary for the log view. */
    public String describe() {
        if (isFullSuccess())
            return "Successfully refreshed feeds. Added " + itemsAdded + " new items.";
        return "Refreshed feeds with " + failures.size() + " errors. Added " + itemsAdded + " items.\nErrors:\n"
                + failures.stream().map(FeedFailure::toString).collect(Collectors.joining("\n"));
    }
}
