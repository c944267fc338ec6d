package org.carball.litepilot.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.model.optimization.AutoVacuumMode;
import org.carball.litepilot.model.optimization.JournalMode;
import org.carball.litepilot.model.optimization.SynchronousMode;
import org.carball.litepilot.model.optimization.TempStore;

/**
 * Targets and switches for {@code SqliteAutoOptimizer.optimizeDatabase}.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class OptimizationConfig {

    @Builder.Default
    private boolean enableAutoPragma = true;

    // Consumed by SqliteAutopilot.runMaintenance, the optimizer itself ignores it
    @Builder.Default
    private boolean enableAutoIndexing = true;

    @Builder.Default
    private boolean enablePerformanceTuning = true;

    @Builder.Default
    private boolean enableBackupRecommendations = true;

    @Builder.Default
    private double slowQueryThreshold = 1000;

    @Builder.Default
    private AutoVacuumMode autoVacuumMode = AutoVacuumMode.INCREMENTAL;

    @Builder.Default
    private JournalMode journalMode = JournalMode.WAL;

    @Builder.Default
    private SynchronousMode synchronous = SynchronousMode.NORMAL;

    // Negative values are KiB, positive values are pages; -64000 is about 64MB
    @Builder.Default
    private long cacheSize = -64000;

    @Builder.Default
    private TempStore tempStore = TempStore.MEMORY;

    @Builder.Default
    private String profileName = "default";

    public static OptimizationConfig defaults() {
        return OptimizationConfig.builder().build();
    }

    /**
     * Logs warnings for settings that are legal but usually a mistake.
     */
    public void validate() {
        if (cacheSize == 0) {
            log.warn("Cache size of 0 disables the page cache");
        }
        if (synchronous == SynchronousMode.OFF) {
            log.warn("synchronous=OFF can corrupt the database on power loss");
        }
        if (journalMode == JournalMode.OFF || journalMode == JournalMode.MEMORY) {
            log.warn("journal_mode={} loses atomic commit if the process crashes mid-transaction", journalMode);
        }
        if (slowQueryThreshold < 0) {
            log.warn("Slow query threshold ({}) should not be negative", slowQueryThreshold);
        }

        log.debug("Using optimization targets - journal: {}, synchronous: {}, cache: {}, profile: {}",
                journalMode, synchronous, cacheSize, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Journal: %s | Synchronous: %s | Cache: %d | Temp store: %s | Auto vacuum: %s",
                profileName, journalMode, synchronous, cacheSize, tempStore, autoVacuumMode);
    }
}
