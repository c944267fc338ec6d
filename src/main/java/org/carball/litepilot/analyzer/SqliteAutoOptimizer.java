package org.carball.litepilot.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.catalog.SchemaCatalog;
import org.carball.litepilot.config.OptimizationConfig;
import org.carball.litepilot.model.optimization.JournalMode;
import org.carball.litepilot.model.optimization.OptimizationResult;
import org.carball.litepilot.model.optimization.PerformanceMetrics;
import org.carball.litepilot.model.query.QueryResult;
import org.carball.litepilot.model.recommendation.ImpactLevel;
import org.carball.litepilot.parser.SqlPatternExtractor;
import org.carball.litepilot.pool.SqlExecutor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads the engine configuration of a database and moves it towards an {@link OptimizationConfig}.
 * <p>
 * Changes are only made where the current value differs from the target, so running
 * {@link #optimizeDatabase(OptimizationConfig)} twice applies nothing the second time. Connection
 * scoped settings only stick when the executor always uses the same connection.
 */
@Slf4j
public class SqliteAutoOptimizer {

    static final List<String> METRIC_PRAGMAS = List.of(
            "page_count", "page_size", "freelist_count", "schema_version", "user_version", "application_id",
            "cache_size", "synchronous", "journal_mode", "auto_vacuum", "temp_store", "foreign_keys");

    private static final long FRAGMENTATION_THRESHOLD = 100;
    private static final long SMALL_CACHE_THRESHOLD = 32000;
    private static final long LARGE_DATABASE_BYTES = 100L * 1024 * 1024;

    private final SqlExecutor executor;
    private final SchemaCatalog catalog;
    private final Map<String, OptimizationResult> optimizationHistory = new ConcurrentHashMap<>();

    public SqliteAutoOptimizer(SqlExecutor executor, SchemaCatalog catalog) {
        this.executor = executor;
        this.catalog = catalog;
    }

    /**
     * Snapshots the current configuration. Settings that cannot be read are left {@code null}.
     *
     * @throws RuntimeException if the integrity check itself cannot run
     */
    public PerformanceMetrics analyzeDatabase() {
        Map<String, CompletableFuture<Object>> reads = new LinkedHashMap<>();
        for (String pragma : METRIC_PRAGMAS) {
            reads.put(pragma, executor.execute("PRAGMA " + pragma)
                    .handle((result, error) -> {
                        if (error != null) {
                            log.debug("Failed to get PRAGMA {}: {}", pragma, error.getMessage());
                            return null;
                        }
                        return result.firstValue(pragma);
                    }));
        }
        CompletableFuture.allOf(reads.values().toArray(new CompletableFuture[0])).join();

        QueryResult integrity = executor.executeAndWait("PRAGMA integrity_check");
        boolean integrityOk = integrity.rows().size() == 1
                && "ok".equalsIgnoreCase(String.valueOf(integrity.firstValue("integrity_check")));

        return PerformanceMetrics.builder()
                .pageCount(asLong(reads.get("page_count").join()))
                .pageSize(asLong(reads.get("page_size").join()))
                .freelistCount(asLong(reads.get("freelist_count").join()))
                .schemaVersion(asLong(reads.get("schema_version").join()))
                .userVersion(asLong(reads.get("user_version").join()))
                .applicationId(asLong(reads.get("application_id").join()))
                .cacheSize(asLong(reads.get("cache_size").join()))
                .synchronous(asInteger(reads.get("synchronous").join()))
                .journalMode(asString(reads.get("journal_mode").join()))
                .autoVacuum(asInteger(reads.get("auto_vacuum").join()))
                .tempStore(asInteger(reads.get("temp_store").join()))
                .foreignKeys(asInteger(reads.get("foreign_keys").join()))
                .integrityCheck(integrityOk)
                .build();
    }

    public OptimizationResult optimizeDatabase() {
        return optimizeDatabase(OptimizationConfig.defaults());
    }

    /**
     * Applies the configured changes and collects advice. Never throws: anything that goes wrong is
     * reported in {@link OptimizationResult#getWarnings()}.
     */
    public OptimizationResult optimizeDatabase(OptimizationConfig config) {
        OptimizationResult result = new OptimizationResult();

        try {
            PerformanceMetrics metrics = analyzeDatabase();

            log.debug("Optimizing with {}", config.getConfigurationSummary());
            if (config.isEnableAutoPragma()) {
                applyPragmaOptimizations(config, metrics, result);
            }
            if (config.isEnablePerformanceTuning()) {
                applyPerformanceTuning(config, metrics, result);
            }

            generateRecommendations(metrics, result);
            if (config.isEnableBackupRecommendations()) {
                result.getRecommendations().addAll(backupRecommendations(metrics));
            }

            optimizationHistory.put(catalog.databaseIdentifier(), result);

            log.info("Applied {} SQLite optimizations", result.getAppliedOptimizations().size());
        } catch (RuntimeException e) {
            log.error("Failed to optimize SQLite database: {}", e.getMessage());
            result.addWarning("Optimization failed: " + e.getMessage());
        }
        return result;
    }

    private void applyPragmaOptimizations(OptimizationConfig config, PerformanceMetrics metrics,
                                          OptimizationResult result) {
        if (!metrics.isWalMode() && config.getJournalMode() == JournalMode.WAL) {
            StepOutcome<QueryResult> outcome = run("PRAGMA journal_mode = WAL");
            if (!outcome.succeeded()) {
                result.addWarning("Failed to enable WAL mode");
            } else {
                String mode = asString(outcome.value().firstValue("journal_mode"));
                if ("wal".equalsIgnoreCase(mode)) {
                    result.addApplied("Enabled WAL mode for better concurrency");
                    result.setPerformanceImpact(ImpactLevel.HIGH);
                } else {
                    result.addWarning("WAL mode could not be enabled, journal mode is " + mode);
                }
            }
        }

        Long cacheSize = metrics.getCacheSize();
        if (cacheSize != null && Math.abs(cacheSize) < Math.abs(config.getCacheSize())) {
            applySetting("PRAGMA cache_size = " + config.getCacheSize(),
                    "Set cache size to " + config.getCacheSize(), "Failed to set cache size",
                    ImpactLevel.MEDIUM, result);
        }

        if (Integer.valueOf(0).equals(metrics.getForeignKeys())) {
            applySetting("PRAGMA foreign_keys = ON",
                    "Enabled foreign key constraints", "Failed to enable foreign keys",
                    ImpactLevel.LOW, result);
        }

        if (metrics.getSynchronous() != null && metrics.getSynchronous() != config.getSynchronous().ordinal()) {
            applySetting("PRAGMA synchronous = " + config.getSynchronous(),
                    "Set synchronous mode to " + config.getSynchronous(), "Failed to set synchronous mode",
                    ImpactLevel.MEDIUM, result);
        }

        if (metrics.getTempStore() != null && metrics.getTempStore() != config.getTempStore().ordinal()) {
            applySetting("PRAGMA temp_store = " + config.getTempStore(),
                    "Set temp store to " + config.getTempStore(), "Failed to set temp store",
                    ImpactLevel.LOW, result);
        }
    }

    private void applyPerformanceTuning(OptimizationConfig config, PerformanceMetrics metrics,
                                        OptimizationResult result) {
        if (run("ANALYZE").succeeded()) {
            result.addMaintenanceTask("Ran ANALYZE for query optimization");
            result.setPerformanceImpact(ImpactLevel.MEDIUM);
        } else {
            result.addWarning("Failed to run ANALYZE");
        }

        StepOutcome<QueryResult> optimize = run("PRAGMA optimize");
        if (optimize.succeeded()) {
            result.addMaintenanceTask("Ran PRAGMA optimize for automatic tuning");
            result.setPerformanceImpact(ImpactLevel.LOW);
        } else {
            // Older engines do not know PRAGMA optimize
            log.debug("PRAGMA optimize not available in this SQLite version: {}", optimize.failure());
        }

        int target = config.getAutoVacuumMode().ordinal();
        if (metrics.getAutoVacuum() != null && metrics.getAutoVacuum() != target) {
            if (!run("PRAGMA auto_vacuum = " + config.getAutoVacuumMode()).succeeded()) {
                result.addWarning("Failed to set auto vacuum mode");
                return;
            }
            StepOutcome<QueryResult> reread = run("PRAGMA auto_vacuum");
            Integer current = reread.succeeded() ? asInteger(reread.value().firstValue("auto_vacuum")) : null;
            if (current != null && current == target) {
                result.addApplied("Set auto vacuum to " + config.getAutoVacuumMode());
                result.setPerformanceImpact(ImpactLevel.MEDIUM);
            } else {
                result.addWarning("Auto vacuum mode " + config.getAutoVacuumMode()
                        + " only takes effect after VACUUM on an existing database");
            }
        }
    }

    private void generateRecommendations(PerformanceMetrics metrics, OptimizationResult result) {
        Long freelist = metrics.getFreelistCount();
        if (freelist != null && freelist > FRAGMENTATION_THRESHOLD) {
            result.addRecommendation("High fragmentation detected (" + freelist
                    + " free pages). Consider running VACUUM to reclaim space.");
        }

        if (!metrics.isIntegrityCheck()) {
            result.addRecommendation("Database integrity check failed. Run PRAGMA integrity_check for details.");
        }

        StepOutcome<List<String>> tables = StepOutcome.attempt(catalog::listTables);
        if (!tables.succeeded()) {
            log.debug("Failed to get table list: {}", tables.failure());
        } else {
            for (String table : tables.value()) {
                StepOutcome<Integer> indexCount = StepOutcome.attempt(() -> catalog.listIndexes(table).size());
                if (!indexCount.succeeded()) {
                    log.debug("Failed to get indexes for table {}: {}", table, indexCount.failure());
                } else if (indexCount.value() == 0) {
                    result.addRecommendation("Table '" + table
                            + "' has no indexes. Consider adding indexes for frequently queried columns.");
                }
            }
        }

        Long cacheSize = metrics.getCacheSize();
        if (cacheSize != null && Math.abs(cacheSize) < SMALL_CACHE_THRESHOLD) {
            result.addRecommendation("Consider increasing cache_size for better performance with larger databases.");
        }

        if (!metrics.isWalMode()) {
            result.addRecommendation("Consider enabling WAL mode for better concurrent read performance.");
        }
    }

    /**
     * Backup advice for the database as it is now.
     */
    public List<String> getBackupRecommendations() {
        return backupRecommendations(analyzeDatabase());
    }

    private List<String> backupRecommendations(PerformanceMetrics metrics) {
        List<String> recommendations = new ArrayList<>();

        if (metrics.isWalMode()) {
            recommendations.add("When using WAL mode, back up the -wal and -shm files together with the "
                    + "main database file, or checkpoint first.");
        }
        if (metrics.getDatabaseSizeBytes() > LARGE_DATABASE_BYTES) {
            recommendations.add("For large databases, consider using the SQLite backup API or VACUUM INTO "
                    + "instead of copying the file.");
        }
        recommendations.add("Perform backups during low-activity periods to minimize lock contention.");

        return recommendations;
    }

    /**
     * Suggests an index for every WHERE column that appears in three or more of {@code queries}.
     * Works on the given text only, independent of any recorded patterns.
     */
    public List<String> suggestIndexOptimizations(List<String> queries) {
        Map<String, String> spelling = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (String query : queries) {
            for (String column : SqlPatternExtractor.extractWhereColumns(query)) {
                String key = column.toLowerCase(Locale.ROOT);
                spelling.putIfAbsent(key, column);
                counts.merge(key, 1, Integer::sum);
            }
        }

        List<String> suggestions = new ArrayList<>();
        counts.forEach((key, count) -> {
            if (count >= 3) {
                suggestions.add("Consider adding an index on '" + spelling.get(key) + "' (used in " + count + " queries)");
            }
        });
        return suggestions;
    }

    public Optional<OptimizationResult> getOptimizationHistory(String databaseId) {
        return Optional.ofNullable(databaseId).map(optimizationHistory::get);
    }

    public void clearHistory() {
        optimizationHistory.clear();
    }

    private void applySetting(String sql, String description, String failureMessage,
                              ImpactLevel impact, OptimizationResult result) {
        StepOutcome<QueryResult> outcome = run(sql);
        if (outcome.succeeded()) {
            result.addApplied(description);
            result.setPerformanceImpact(impact);
        } else {
            log.warn("{}: {}", failureMessage, outcome.failure());
            result.addWarning(failureMessage);
        }
    }

    private StepOutcome<QueryResult> run(String sql) {
        return StepOutcome.attempt(() -> executor.executeAndWait(sql));
    }

    private static Long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }

    private static Integer asInteger(Object value) {
        Long longValue = asLong(value);
        return longValue == null ? null : longValue.intValue();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString().toLowerCase(Locale.ROOT);
    }
}
