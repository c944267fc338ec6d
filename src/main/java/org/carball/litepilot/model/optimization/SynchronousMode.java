package org.carball.litepilot.model.optimization;

/**
 * Values of {@code PRAGMA synchronous}; the ordinal is the number SQLite reports.
 */
public enum SynchronousMode {
    OFF,
    NORMAL,
    FULL,
    EXTRA
}
