package org.carball.litepilot.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.pool.JdbcConnectionFactory;

/**
 * Fully resolved settings for one database, as produced by {@link ConfigurationLoader}.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class LitePilotConfig {

    @Builder.Default
    private String databasePath = JdbcConnectionFactory.MEMORY_DATABASE;

    @Builder.Default
    private int poolSize = 1;

    @Builder.Default
    private OptimizationConfig optimization = OptimizationConfig.defaults();

    @Builder.Default
    private IndexAnalysisOptions indexAnalysis = IndexAnalysisOptions.defaults();

    public static LitePilotConfig defaults() {
        return LitePilotConfig.builder().build();
    }

    public PoolConfig toPoolConfig() {
        return PoolConfig.builder()
                .databasePath(databasePath)
                .poolSize(poolSize)
                .build();
    }

    public void validate() {
        if (poolSize <= 0) {
            log.warn("Pool size ({}) should be positive, a single connection will be used", poolSize);
        }
        optimization.validate();
        indexAnalysis.validate();
    }

    public String getConfigurationSummary() {
        return String.format("Database: %s | Pool: %d | %s | Min frequency: %d | Max recommendations: %d",
                databasePath, poolSize, optimization.getConfigurationSummary(),
                indexAnalysis.getMinFrequency(), indexAnalysis.getMaxRecommendations());
    }
}
