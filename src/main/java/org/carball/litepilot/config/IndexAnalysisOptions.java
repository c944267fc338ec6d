package org.carball.litepilot.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

@Data
@Builder(toBuilder = true)
@Slf4j
public class IndexAnalysisOptions {

    // Patterns seen at least this often are analysed
    @Builder.Default
    private int minFrequency = 3;

    // ...as are patterns slower than this on average, in milliseconds
    @Builder.Default
    private double slowQueryThreshold = 1000;

    @Builder.Default
    private boolean includePartialIndexes = true;

    @Builder.Default
    private int maxRecommendations = 20;

    public static IndexAnalysisOptions defaults() {
        return IndexAnalysisOptions.builder().build();
    }

    public void validate() {
        if (minFrequency < 1) {
            log.warn("Minimum frequency ({}) below 1 makes every recorded pattern eligible", minFrequency);
        }
        if (slowQueryThreshold < 0) {
            log.warn("Slow query threshold ({}) should not be negative", slowQueryThreshold);
        }
        if (maxRecommendations < 1) {
            log.warn("Recommendation cap ({}) should be at least 1, no recommendations will be returned",
                    maxRecommendations);
        }
    }
}
