package org.carball.litepilot.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.catalog.SchemaCatalog;
import org.carball.litepilot.config.IndexAnalysisOptions;
import org.carball.litepilot.model.query.QueryPattern;
import org.carball.litepilot.model.query.QueryPatternStats;
import org.carball.litepilot.model.recommendation.ImpactLevel;
import org.carball.litepilot.model.recommendation.IndexAnalysisResult;
import org.carball.litepilot.model.recommendation.IndexRecommendation;
import org.carball.litepilot.model.recommendation.IndexType;
import org.carball.litepilot.model.recommendation.Priority;
import org.carball.litepilot.model.schema.ExistingIndex;
import org.carball.litepilot.parser.SqlPatternExtractor;
import org.carball.litepilot.parser.StatementClassifier;
import org.carball.litepilot.pool.QueryExecutionListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Records executed statements as query patterns and turns the busiest ones into index
 * recommendations.
 * <p>
 * Only the most frequent qualifying pattern of each table contributes recommendations in one
 * analysis run.
 */
@Slf4j
public class SqliteAutoIndexer implements QueryExecutionListener {

    private static final Set<String> RECORDED_STATEMENTS = Set.of("SELECT", "WITH", "UPDATE", "DELETE", "INSERT", "REPLACE");

    private static final int MAX_COMPOSITE_COLUMNS = 3;

    private final SchemaCatalog catalog;
    private final Map<String, QueryPattern> queryPatterns = new LinkedHashMap<>();
    private final Map<String, IndexAnalysisResult> analysisHistory = new HashMap<>();

    // Indexes seen by the latest analysis run
    private final List<ExistingIndex> existingIndexes = new ArrayList<>();

    public SqliteAutoIndexer(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Records statements executed through a pool. Catalog and PRAGMA traffic is ignored so the
     * tool's own queries never show up as patterns.
     */
    @Override
    public void onQueryExecuted(String sql, double executionTimeMs) {
        if (!RECORDED_STATEMENTS.contains(StatementClassifier.leadingKeyword(sql))) {
            return;
        }
        String table = SqlPatternExtractor.extractTable(sql);
        if (table.toLowerCase(Locale.ROOT).startsWith("sqlite_")) {
            return;
        }
        recordQuery(sql, executionTimeMs, table);
    }

    public void recordQuery(String sql, double executionTimeMs) {
        recordQuery(sql, executionTimeMs, null);
    }

    /**
     * Counts one execution of {@code sql}. Statements that differ only in literal values or
     * placeholders share a pattern.
     *
     * @param table target table, or {@code null} to take it from the statement
     */
    public synchronized void recordQuery(String sql, double executionTimeMs, String table) {
        String normalized = SqlPatternExtractor.normalize(sql);
        QueryPattern pattern = queryPatterns.get(normalized);

        if (pattern != null) {
            pattern.recordExecution(executionTimeMs);
            return;
        }

        pattern = new QueryPattern(normalized,
                table != null ? table : SqlPatternExtractor.extractTable(sql),
                executionTimeMs);
        pattern.setWhereColumns(SqlPatternExtractor.extractWhereColumns(sql));
        pattern.setOrderByColumns(SqlPatternExtractor.extractOrderByColumns(sql));
        pattern.setJoinColumns(SqlPatternExtractor.extractJoinColumns(sql));
        queryPatterns.put(normalized, pattern);
        log.debug("New query pattern on {}: {}", pattern.getTable(), normalized);
    }

    public IndexAnalysisResult analyzeAndRecommend() {
        return analyzeAndRecommend(IndexAnalysisOptions.defaults());
    }

    /**
     * Recommends indexes for the recorded patterns that are frequent or slow enough.
     * <p>
     * The catalog is read before the recorder is locked, so statements finishing on pool threads
     * meanwhile can still be recorded.
     *
     * @throws RuntimeException if the catalog cannot list the tables; there is no partial answer then
     */
    public IndexAnalysisResult analyzeAndRecommend(IndexAnalysisOptions options) {
        try {
            List<String> warnings = new ArrayList<>();
            List<ExistingIndex> loadedIndexes = loadExistingIndexes(warnings);
            String databaseId = catalog.databaseIdentifier();

            synchronized (this) {
                existingIndexes.clear();
                existingIndexes.addAll(loadedIndexes);

                List<QueryPattern> relevantPatterns = queryPatterns.values().stream()
                        .filter(pattern -> pattern.getFrequency() >= options.getMinFrequency()
                                || pattern.getAverageExecutionTime() > options.getSlowQueryThreshold())
                        .sorted(Comparator.comparingInt(QueryPattern::getFrequency).reversed())
                        .toList();

                List<IndexRecommendation> recommendations = generateRecommendations(relevantPatterns);
                List<String> redundantIndexes = findRedundantIndexes();
                List<String> missingIndexes = findMissingIndexes(recommendations);

                List<IndexRecommendation> limitedRecommendations = recommendations.stream()
                        .sorted(Comparator.comparingInt(IndexRecommendation::getScore).reversed())
                        .limit(Math.max(0, options.getMaxRecommendations()))
                        .collect(Collectors.toList());

                IndexAnalysisResult result = IndexAnalysisResult.builder()
                        .recommendations(limitedRecommendations)
                        .existingIndexes(existingIndexes.stream().map(ExistingIndex::getName).collect(Collectors.toList()))
                        .redundantIndexes(redundantIndexes)
                        .missingIndexes(missingIndexes)
                        .performanceImpact(calculatePerformanceImpact(limitedRecommendations))
                        .summary(generateSummary(limitedRecommendations, redundantIndexes))
                        .warnings(warnings)
                        .build();

                analysisHistory.put(databaseId, result);

                log.info("Generated {} index recommendations", limitedRecommendations.size());
                return result;
            }

        } catch (RuntimeException e) {
            log.error("Failed to analyze index patterns: {}", e.getMessage());
            throw e;
        }
    }

    // Engine-created indexes are left out, they cannot be dropped or renamed
    private List<ExistingIndex> loadExistingIndexes(List<String> warnings) {
        List<ExistingIndex> loaded = new ArrayList<>();

        for (String table : catalog.listTables()) {
            StepOutcome<List<ExistingIndex>> outcome = StepOutcome.attempt(() -> catalog.listIndexes(table));
            if (!outcome.succeeded()) {
                log.warn("Failed to load indexes for table {}: {}", table, outcome.failure());
                warnings.add("Could not read indexes of table '" + table + "': " + outcome.failure());
                continue;
            }
            outcome.value().stream()
                    .filter(index -> !index.isEngineManaged())
                    .forEach(loaded::add);
        }
        return loaded;
    }

    private List<IndexRecommendation> generateRecommendations(List<QueryPattern> patterns) {
        List<IndexRecommendation> recommendations = new ArrayList<>();
        Set<String> processedTables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

        for (QueryPattern pattern : patterns) {
            if (!processedTables.add(pattern.getTable())) {
                continue;
            }

            if (pattern.hasWhereClause()) {
                recommendations.addAll(generateWhereIndexes(pattern));
            }
            if (pattern.hasOrderBy()) {
                recommendations.addAll(generateOrderByIndexes(pattern));
            }
            if (pattern.hasJoins()) {
                recommendations.addAll(generateJoinIndexes(pattern));
            }
        }

        return deduplicate(recommendations);
    }

    private List<IndexRecommendation> generateWhereIndexes(QueryPattern pattern) {
        List<IndexRecommendation> recommendations = new ArrayList<>();

        for (String column : pattern.getWhereColumns()) {
            if (hasExistingIndex(pattern.getTable(), List.of(column))) {
                continue;
            }
            recommendations.add(recommendation(pattern.getTable(), List.of(column), IndexType.SINGLE,
                    wherePriority(pattern), estimateImpact(pattern),
                    String.format("Frequently queried column (%d times, avg %dms)",
                            pattern.getFrequency(), Math.round(pattern.getAverageExecutionTime()))));
        }

        if (pattern.getWhereColumns().size() > 1) {
            List<String> columns = pattern.getWhereColumns().subList(0,
                    Math.min(MAX_COMPOSITE_COLUMNS, pattern.getWhereColumns().size()));
            if (!hasExistingIndex(pattern.getTable(), columns)) {
                recommendations.add(recommendation(pattern.getTable(), List.copyOf(columns), IndexType.COMPOSITE,
                        Priority.HIGH, ImpactLevel.HIGH,
                        "Composite index for multiple WHERE columns (" + pattern.getFrequency() + " times)"));
            }
        }

        return recommendations;
    }

    private List<IndexRecommendation> generateOrderByIndexes(QueryPattern pattern) {
        List<IndexRecommendation> recommendations = new ArrayList<>();
        for (String column : pattern.getOrderByColumns()) {
            if (!hasExistingIndex(pattern.getTable(), List.of(column))) {
                recommendations.add(recommendation(pattern.getTable(), List.of(column), IndexType.SINGLE,
                        Priority.MEDIUM, ImpactLevel.MEDIUM,
                        "Frequently ordered by column (" + pattern.getFrequency() + " times)"));
            }
        }
        return recommendations;
    }

    private List<IndexRecommendation> generateJoinIndexes(QueryPattern pattern) {
        List<IndexRecommendation> recommendations = new ArrayList<>();
        for (String column : pattern.getJoinColumns()) {
            if (!hasExistingIndex(pattern.getTable(), List.of(column))) {
                recommendations.add(recommendation(pattern.getTable(), List.of(column), IndexType.SINGLE,
                        Priority.HIGH, ImpactLevel.HIGH,
                        "Foreign key column used in joins (" + pattern.getFrequency() + " times)"));
            }
        }
        return recommendations;
    }

    private IndexRecommendation recommendation(String table, List<String> columns, IndexType type,
                                               Priority priority, ImpactLevel impact, String reason) {
        return IndexRecommendation.builder()
                .table(table)
                .columns(columns)
                .type(type)
                .priority(priority)
                .estimatedImpact(impact)
                .reason(reason)
                .sql(generateIndexSql(table, columns, type))
                .build();
    }

    private boolean hasExistingIndex(String table, List<String> columns) {
        return existingIndexes.stream().anyMatch(index -> index.coversExactly(table, columns));
    }

    static Priority wherePriority(QueryPattern pattern) {
        if (pattern.getAverageExecutionTime() > 5000) return Priority.CRITICAL;
        if (pattern.getFrequency() > 20) return Priority.HIGH;
        if (pattern.getFrequency() > 10) return Priority.MEDIUM;
        return Priority.LOW;
    }

    static ImpactLevel estimateImpact(QueryPattern pattern) {
        if (pattern.getAverageExecutionTime() > 2000) return ImpactLevel.HIGH;
        if (pattern.getFrequency() > 15) return ImpactLevel.HIGH;
        if (pattern.getAverageExecutionTime() > 500) return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }

    static String generateIndexName(String table, List<String> columns) {
        String suffix = columns.size() == 1 ? columns.get(0) : columns.size() + "cols";
        return "idx_" + table + "_" + suffix;
    }

    static String generateIndexSql(String table, List<String> columns, IndexType type) {
        String columnList = columns.stream()
                .map(column -> "\"" + column + "\"")
                .collect(Collectors.joining(", "));
        String create = type == IndexType.UNIQUE ? "CREATE UNIQUE INDEX" : "CREATE INDEX";
        return create + " \"" + generateIndexName(table, columns) + "\" ON \"" + table + "\" (" + columnList + ")";
    }

    private List<IndexRecommendation> deduplicate(List<IndexRecommendation> recommendations) {
        Set<String> seen = new LinkedHashSet<>();
        return recommendations.stream()
                .filter(rec -> seen.add((rec.getTable() + ":" + String.join(",", rec.getColumns()))
                        .toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    /**
     * When one index's columns are a leading prefix of another index on the same table, the longer
     * index is reported.
     */
    private List<String> findRedundantIndexes() {
        Map<String, List<ExistingIndex>> byTable = existingIndexes.stream()
                .collect(Collectors.groupingBy(index -> index.getTable().toLowerCase(Locale.ROOT),
                        LinkedHashMap::new, Collectors.toList()));

        Set<String> redundant = new LinkedHashSet<>();
        for (List<ExistingIndex> indexes : byTable.values()) {
            for (int i = 0; i < indexes.size(); i++) {
                for (int j = i + 1; j < indexes.size(); j++) {
                    ExistingIndex first = indexes.get(i);
                    ExistingIndex second = indexes.get(j);

                    if (isStrictPrefix(first.getColumns(), second.getColumns())) {
                        redundant.add(second.getName());
                    } else if (isStrictPrefix(second.getColumns(), first.getColumns())) {
                        redundant.add(first.getName());
                    }
                }
            }
        }
        return new ArrayList<>(redundant);
    }

    private List<String> findMissingIndexes(List<IndexRecommendation> recommendations) {
        Set<String> existingNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        existingIndexes.forEach(index -> existingNames.add(index.getName()));

        List<String> missing = new ArrayList<>();
        for (IndexRecommendation rec : recommendations) {
            String indexName = generateIndexName(rec.getTable(), rec.getColumns());
            if (!existingNames.contains(indexName)) {
                missing.add(indexName);
            }
        }
        return missing;
    }

    private static boolean isStrictPrefix(List<String> shorter, List<String> longer) {
        if (shorter.size() >= longer.size()) {
            return false;
        }
        for (int i = 0; i < shorter.size(); i++) {
            if (!shorter.get(i).equalsIgnoreCase(longer.get(i))) {
                return false;
            }
        }
        return true;
    }

    static ImpactLevel calculatePerformanceImpact(List<IndexRecommendation> recommendations) {
        long highImpact = recommendations.stream().filter(r -> r.getEstimatedImpact() == ImpactLevel.HIGH).count();
        long mediumImpact = recommendations.stream().filter(r -> r.getEstimatedImpact() == ImpactLevel.MEDIUM).count();

        if (highImpact > 3) return ImpactLevel.HIGH;
        if (highImpact > 0 || mediumImpact > 5) return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }

    static String generateSummary(List<IndexRecommendation> recommendations, List<String> redundantIndexes) {
        long critical = recommendations.stream().filter(r -> r.getPriority() == Priority.CRITICAL).count();
        long high = recommendations.stream().filter(r -> r.getPriority() == Priority.HIGH).count();

        StringBuilder summary = new StringBuilder("Found " + recommendations.size() + " index recommendations");
        if (critical > 0) {
            summary.append(", ").append(critical).append(" critical");
        }
        if (high > 0) {
            summary.append(", ").append(high).append(" high priority");
        }
        if (!redundantIndexes.isEmpty()) {
            summary.append(". ").append(redundantIndexes.size()).append(" redundant indexes identified for removal");
        }
        return summary.toString();
    }

    public synchronized Optional<IndexAnalysisResult> getAnalysisHistory(String databaseId) {
        return Optional.ofNullable(databaseId).map(analysisHistory::get);
    }

    /**
     * Forgets every recorded pattern and past analysis.
     */
    public synchronized void clearAnalysisData() {
        queryPatterns.clear();
        existingIndexes.clear();
        analysisHistory.clear();
    }

    public synchronized QueryPatternStats getQueryPatternStats() {
        int totalPatterns = queryPatterns.size();
        long totalQueries = queryPatterns.values().stream().mapToLong(QueryPattern::getFrequency).sum();
        double averageFrequency = totalPatterns > 0 ? (double) totalQueries / totalPatterns : 0;
        int slowQueries = (int) queryPatterns.values().stream()
                .filter(p -> p.getAverageExecutionTime() > 1000)
                .count();

        return new QueryPatternStats(totalPatterns, totalQueries, averageFrequency, slowQueries);
    }

    /**
     * Copies of the recorded patterns, in first-seen order.
     */
    public synchronized List<QueryPattern> getQueryPatterns() {
        return queryPatterns.values().stream().map(QueryPattern::copy).toList();
    }
}
