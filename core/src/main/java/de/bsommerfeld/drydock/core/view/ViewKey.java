package de.bsommerfeld.drydock.core.view;

/**
 * Opaque identifier of a cached view. Background components only ever refer
 * to views through these keys, never through UI types.
 */
public enum ViewKey {
    FEEDS,
    FEED_ITEMS,
    LOGS
}
