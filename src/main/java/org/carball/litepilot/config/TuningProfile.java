package org.carball.litepilot.config;

import lombok.Getter;
import org.carball.litepilot.model.optimization.AutoVacuumMode;
import org.carball.litepilot.model.optimization.JournalMode;
import org.carball.litepilot.model.optimization.SynchronousMode;
import org.carball.litepilot.model.optimization.TempStore;

/**
 * Named sets of PRAGMA targets for common workloads.
 */
@Getter
public enum TuningProfile {

    BALANCED("balanced", "WAL with NORMAL sync and a 64MB cache, the default for most applications",
            JournalMode.WAL, SynchronousMode.NORMAL, -64000, TempStore.MEMORY, AutoVacuumMode.INCREMENTAL),

    DURABLE("durable", "FULL sync so committed transactions survive power loss",
            JournalMode.WAL, SynchronousMode.FULL, -64000, TempStore.MEMORY, AutoVacuumMode.FULL),

    THROUGHPUT("throughput", "Large cache and no auto vacuum for write-heavy workloads",
            JournalMode.WAL, SynchronousMode.NORMAL, -256000, TempStore.MEMORY, AutoVacuumMode.NONE) {
        @Override
        public OptimizationConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .slowQueryThreshold(500)
                    .build();
        }
    },

    LOW_MEMORY("low-memory", "Small cache and file-backed temp storage for constrained hosts",
            JournalMode.WAL, SynchronousMode.NORMAL, -2000, TempStore.FILE, AutoVacuumMode.INCREMENTAL);

    private final String name;
    private final String description;
    private final JournalMode journalMode;
    private final SynchronousMode synchronous;
    private final long cacheSize;
    private final TempStore tempStore;
    private final AutoVacuumMode autoVacuumMode;

    TuningProfile(String name, String description, JournalMode journalMode, SynchronousMode synchronous,
                  long cacheSize, TempStore tempStore, AutoVacuumMode autoVacuumMode) {
        this.name = name;
        this.description = description;
        this.journalMode = journalMode;
        this.synchronous = synchronous;
        this.cacheSize = cacheSize;
        this.tempStore = tempStore;
        this.autoVacuumMode = autoVacuumMode;
    }

    public OptimizationConfig buildConfig() {
        return OptimizationConfig.builder()
                .profileName(name)
                .journalMode(journalMode)
                .synchronous(synchronous)
                .cacheSize(cacheSize)
                .tempStore(tempStore)
                .autoVacuumMode(autoVacuumMode)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static TuningProfile fromName(String name) {
        for (TuningProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown tuning profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (TuningProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Tuning Profiles:\n\n");
        for (TuningProfile profile : values()) {
            help.append(String.format("  %-12s %s\n", profile.getName(), profile.getDescription()));
        }
        return help.toString();
    }
}
