package org.carball.litepilot.model.optimization;

/**
 * Values of {@code PRAGMA temp_store}; the ordinal is the number SQLite reports.
 */
public enum TempStore {
    DEFAULT,
    FILE,
    MEMORY
}
