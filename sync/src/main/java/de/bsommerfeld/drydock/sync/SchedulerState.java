package de.bsommerfeld.drydock.sync;

/**
 * Lifecycle of the {@link FeedSyncScheduler}. A started scheduler loops
 * {@code SLEEPING → RUNNING → SLEEPING}; {@code STOPPED} is terminal.
 */
public enum SchedulerState {
    /** Created, not started yet. */
    IDLE,
    /** Waiting for the next cycle. */
    SLEEPING,
    /** A sync cycle is in progress. */
    RUNNING,
    STOPPED
}
