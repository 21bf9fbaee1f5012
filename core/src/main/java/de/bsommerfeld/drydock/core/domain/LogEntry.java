package de.bsommerfeld.drydock.core.domain;

import java.time.Instant;

/**
 * A row of the persisted application log shown in the log view.
 */
public record LogEntry(long id, LogLevel level, String message, Instant timestamp) {
}
