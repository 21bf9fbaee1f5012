package de.bsommerfeld.drydock.core.domain;

import java.util.Locale;

/** Severity of an entry in the persisted application log. */
public enum LogLevel {
    INFO,
    WARNING,
    ERROR;

    /**
     * Lenient lookup used when reading stored rows. Unknown or missing values
     * map to {@link #INFO}.
     */
    public static LogLevel parse(String value) {
        if (value == null)
            return INFO;
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "WARN":
            case "WARNING":
                return WARNING;
            case "ERROR":
                return ERROR;
            default:
                return INFO;
        }
    }
}
