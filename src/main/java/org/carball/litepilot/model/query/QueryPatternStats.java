package org.carball.litepilot.model.query;

/**
 * Totals over every recorded query pattern.
 */
public record QueryPatternStats(
        int totalPatterns,
        long totalQueries,
        double averageFrequency,
        int slowQueries
) {}
