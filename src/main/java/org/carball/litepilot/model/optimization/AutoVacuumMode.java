package org.carball.litepilot.model.optimization;

/**
 * Values of {@code PRAGMA auto_vacuum}; the ordinal is the number SQLite reports.
 */
public enum AutoVacuumMode {
    NONE,
    FULL,
    INCREMENTAL
}
