package org.carball.litepilot.config;

import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.model.optimization.AutoVacuumMode;
import org.carball.litepilot.model.optimization.JournalMode;
import org.carball.litepilot.model.optimization.SynchronousMode;
import org.carball.litepilot.model.optimization.TempStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "LITEPILOT_";
    static final String ARG_PREFIX = "--litepilot.";

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > settings file > profile > defaults
     */
    public LitePilotConfig loadConfiguration(String[] args) {
        return loadConfiguration(args, System.getenv());
    }

    public LitePilotConfig loadConfiguration(String[] args, Map<String, String> environment) {
        log.debug("Loading configuration");

        Map<String, String> env = environmentOverrides(environment);
        Map<String, String> cli = argumentOverrides(args);

        String settingsPath = cli.getOrDefault("config", env.get("config"));
        LitePilotSettings settings = settingsPath != null ? readSettings(Path.of(settingsPath)) : null;

        // 1. Profile, wherever it was named
        String profileName = cli.getOrDefault("profile",
                env.getOrDefault("profile", settings != null ? settings.getProfile() : null));
        LitePilotConfig config = profileName != null
                ? loadProfile(profileName)
                : LitePilotConfig.defaults();

        // 2. Settings file
        if (settings != null) {
            applySettings(config, settings);
        }

        // 3. Environment variables
        applyOverrides(config, env, "environment");

        // 4. CLI arguments (highest priority)
        applyOverrides(config, cli, "arguments");

        config.validate();
        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration from a specific profile.
     */
    public LitePilotConfig loadProfile(String profileName) {
        try {
            TuningProfile profile = TuningProfile.fromName(profileName);
            LitePilotConfig config = LitePilotConfig.builder()
                    .optimization(profile.buildConfig())
                    .build();
            log.info("Loaded profile '{}': {}", profileName, config.getOptimization().getConfigurationSummary());
            return config;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    private LitePilotSettings readSettings(Path path) {
        if (!Files.exists(path)) {
            log.warn("Settings file not found: {}, using defaults", path);
            return null;
        }
        try {
            LitePilotSettings settings = LitePilotSettings.load(path);
            log.info("Loaded settings from: {}", path);
            return settings;
        } catch (IOException e) {
            log.error("Failed to read settings file {}: {}", path, e.getMessage());
            throw new IllegalArgumentException("Invalid settings file " + path + ": " + e.getMessage(), e);
        }
    }

    private void applySettings(LitePilotConfig config, LitePilotSettings settings) {
        if (settings.getDatabasePath() != null) {
            config.setDatabasePath(settings.getDatabasePath());
        }
        if (settings.getPoolSize() != null) {
            config.setPoolSize(settings.getPoolSize());
        }

        LitePilotSettings.Optimization file = settings.getOptimization();
        if (file != null) {
            OptimizationConfig optimization = config.getOptimization();
            if (file.getEnableAutoPragma() != null) optimization.setEnableAutoPragma(file.getEnableAutoPragma());
            if (file.getEnableAutoIndexing() != null) optimization.setEnableAutoIndexing(file.getEnableAutoIndexing());
            if (file.getEnablePerformanceTuning() != null) optimization.setEnablePerformanceTuning(file.getEnablePerformanceTuning());
            if (file.getEnableBackupRecommendations() != null) optimization.setEnableBackupRecommendations(file.getEnableBackupRecommendations());
            if (file.getSlowQueryThreshold() != null) optimization.setSlowQueryThreshold(file.getSlowQueryThreshold());
            if (file.getAutoVacuumMode() != null) optimization.setAutoVacuumMode(file.getAutoVacuumMode());
            if (file.getJournalMode() != null) optimization.setJournalMode(file.getJournalMode());
            if (file.getSynchronous() != null) optimization.setSynchronous(file.getSynchronous());
            if (file.getCacheSize() != null) optimization.setCacheSize(file.getCacheSize());
            if (file.getTempStore() != null) optimization.setTempStore(file.getTempStore());
        }

        LitePilotSettings.IndexAnalysis analysis = settings.getIndexAnalysis();
        if (analysis != null) {
            IndexAnalysisOptions options = config.getIndexAnalysis();
            if (analysis.getMinFrequency() != null) options.setMinFrequency(analysis.getMinFrequency());
            if (analysis.getSlowQueryThreshold() != null) options.setSlowQueryThreshold(analysis.getSlowQueryThreshold());
            if (analysis.getIncludePartialIndexes() != null) options.setIncludePartialIndexes(analysis.getIncludePartialIndexes());
            if (analysis.getMaxRecommendations() != null) options.setMaxRecommendations(analysis.getMaxRecommendations());
        }
    }

    // LITEPILOT_POOL_SIZE -> pool-size
    private Map<String, String> environmentOverrides(Map<String, String> environment) {
        Map<String, String> overrides = new LinkedHashMap<>();
        environment.forEach((name, value) -> {
            if (name.startsWith(ENV_PREFIX)) {
                String key = name.substring(ENV_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
                overrides.put(key, value);
            }
        });
        return overrides;
    }

    // --litepilot.pool-size 4 -> pool-size
    private Map<String, String> argumentOverrides(String[] args) {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(ARG_PREFIX)) {
                overrides.put(args[i].substring(ARG_PREFIX.length()), args[i + 1]);
                i++;
            }
        }
        return overrides;
    }

    private void applyOverrides(LitePilotConfig config, Map<String, String> overrides, String source) {
        OptimizationConfig optimization = config.getOptimization();
        IndexAnalysisOptions analysis = config.getIndexAnalysis();

        overrides.forEach((key, value) -> {
            try {
                switch (key) {
                    case "database-path" -> config.setDatabasePath(value);
                    case "pool-size" -> config.setPoolSize(Integer.parseInt(value));
                    case "journal-mode" -> optimization.setJournalMode(parseEnum(JournalMode.class, value));
                    case "synchronous" -> optimization.setSynchronous(parseEnum(SynchronousMode.class, value));
                    case "cache-size" -> optimization.setCacheSize(Long.parseLong(value));
                    case "temp-store" -> optimization.setTempStore(parseEnum(TempStore.class, value));
                    case "auto-vacuum" -> optimization.setAutoVacuumMode(parseEnum(AutoVacuumMode.class, value));
                    case "auto-pragma" -> optimization.setEnableAutoPragma(Boolean.parseBoolean(value));
                    case "auto-indexing" -> optimization.setEnableAutoIndexing(Boolean.parseBoolean(value));
                    case "performance-tuning" -> optimization.setEnablePerformanceTuning(Boolean.parseBoolean(value));
                    case "backup-recommendations" -> optimization.setEnableBackupRecommendations(Boolean.parseBoolean(value));
                    case "slow-query-threshold" -> {
                        double threshold = Double.parseDouble(value);
                        optimization.setSlowQueryThreshold(threshold);
                        analysis.setSlowQueryThreshold(threshold);
                    }
                    case "min-frequency" -> analysis.setMinFrequency(Integer.parseInt(value));
                    case "max-recommendations" -> analysis.setMaxRecommendations(Integer.parseInt(value));
                    case "include-partial-indexes" -> analysis.setIncludePartialIndexes(Boolean.parseBoolean(value));
                    case "profile", "config" -> {
                        // resolved before the overrides are applied
                    }
                    default -> log.debug("Ignoring unknown {} setting '{}'", source, key);
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", key, value);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid value for {}: {}", key, value);
            }
        });
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --litepilot.config <file>              YAML settings file
              --litepilot.profile <name>             Tuning profile (balanced, durable, throughput, low-memory)
              --litepilot.database-path <path>       Database file, or :memory:
              --litepilot.pool-size <num>            Number of connections
              --litepilot.journal-mode <mode>        DELETE|TRUNCATE|PERSIST|MEMORY|WAL|OFF
              --litepilot.synchronous <mode>         OFF|NORMAL|FULL|EXTRA
              --litepilot.cache-size <num>           PRAGMA cache_size target
              --litepilot.temp-store <mode>          DEFAULT|FILE|MEMORY
              --litepilot.auto-vacuum <mode>         NONE|FULL|INCREMENTAL
              --litepilot.slow-query-threshold <ms>  Slow query threshold
              --litepilot.min-frequency <num>        Minimum pattern frequency for index analysis
              --litepilot.max-recommendations <num>  Index recommendation cap

            Environment Variables:
              LITEPILOT_<NAME>                       Same as --litepilot.<name>, e.g. LITEPILOT_POOL_SIZE

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Profile defaults or built-in defaults
            """;
    }
}
