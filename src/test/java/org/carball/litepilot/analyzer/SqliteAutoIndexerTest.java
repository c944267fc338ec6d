package org.carball.litepilot.analyzer;

import org.carball.litepilot.catalog.SchemaCatalog;
import org.carball.litepilot.catalog.StaticSchemaCatalog;
import org.carball.litepilot.config.IndexAnalysisOptions;
import org.carball.litepilot.model.query.QueryPattern;
import org.carball.litepilot.model.query.QueryPatternStats;
import org.carball.litepilot.model.recommendation.ImpactLevel;
import org.carball.litepilot.model.recommendation.IndexAnalysisResult;
import org.carball.litepilot.model.recommendation.IndexRecommendation;
import org.carball.litepilot.model.recommendation.IndexType;
import org.carball.litepilot.model.recommendation.Priority;
import org.carball.litepilot.model.schema.ExistingIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqliteAutoIndexerTest {

    private static final String SCHEMA = """
            CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT UNIQUE, status TEXT, created_at INTEGER);
            CREATE TABLE orders (id INTEGER PRIMARY KEY, customer_id INTEGER, status TEXT, total REAL);
            CREATE TABLE customers (id INTEGER PRIMARY KEY, name TEXT);
            CREATE INDEX idx_users_email ON users (email);
            """;

    private SqliteAutoIndexer indexer;

    @BeforeEach
    void setUp() {
        indexer = new SqliteAutoIndexer(StaticSchemaCatalog.fromDdl(SCHEMA));
    }

    private void record(String sql, int times, double executionTimeMs) {
        for (int i = 0; i < times; i++) {
            indexer.recordQuery(sql, executionTimeMs);
        }
    }

    @Test
    void shouldRecommendIndexForBusiestUnindexedColumn() {
        record("SELECT * FROM users WHERE email = 'someone@example.com'", 5, 10);
        record("SELECT * FROM users WHERE status = 'active'", 15, 1200);

        IndexAnalysisResult result = indexer.analyzeAndRecommend();

        assertThat(result.getRecommendations()).singleElement().satisfies(rec -> {
            assertThat(rec.getTable()).isEqualTo("users");
            assertThat(rec.getColumns()).containsExactly("status");
            assertThat(rec.getType()).isEqualTo(IndexType.SINGLE);
            assertThat(rec.getPriority()).isEqualTo(Priority.MEDIUM);
            assertThat(rec.getEstimatedImpact()).isEqualTo(ImpactLevel.MEDIUM);
            assertThat(rec.getReason()).isEqualTo("Frequently queried column (15 times, avg 1200ms)");
            assertThat(rec.getSql()).isEqualTo("CREATE INDEX \"idx_users_status\" ON \"users\" (\"status\")");
        });
        assertThat(result.getExistingIndexes()).containsExactly("idx_users_email");
        assertThat(result.getMissingIndexes()).containsExactly("idx_users_status");
        assertThat(result.getPerformanceImpact()).isEqualTo(ImpactLevel.LOW);
        assertThat(result.getSummary()).isEqualTo("Found 1 index recommendations");
    }

    @Test
    void shouldMergeExecutionsThatDifferOnlyInValues() {
        indexer.recordQuery("SELECT * FROM orders WHERE id = 1", 10);
        indexer.recordQuery("select *   from orders where id = 2", 30);

        List<QueryPattern> patterns = indexer.getQueryPatterns();

        assertThat(patterns).singleElement().satisfies(pattern -> {
            assertThat(pattern.getNormalizedQuery()).isEqualTo("select * from orders where id = ?");
            assertThat(pattern.getFrequency()).isEqualTo(2);
            assertThat(pattern.getAverageExecutionTime()).isEqualTo(20.0);
            assertThat(pattern.getTable()).isEqualTo("orders");
            assertThat(pattern.getWhereColumns()).containsExactly("id");
        });
    }

    @Test
    void shouldIgnoreRareFastPatterns() {
        record("SELECT * FROM orders WHERE status = ?", 2, 5);

        assertThat(indexer.analyzeAndRecommend().getRecommendations()).isEmpty();
    }

    @Test
    void shouldAnalyseRareButSlowPatterns() {
        indexer.recordQuery("SELECT * FROM orders WHERE status = 'late'", 1500);

        IndexRecommendation rec = indexer.analyzeAndRecommend().getRecommendations().get(0);

        assertThat(rec.getPriority()).isEqualTo(Priority.LOW);
        assertThat(rec.getEstimatedImpact()).isEqualTo(ImpactLevel.MEDIUM);
    }

    @Test
    void shouldRecommendCompositeIndexForSeveralWhereColumns() {
        record("SELECT * FROM orders WHERE customer_id = ? AND status = ?", 25, 10);

        IndexAnalysisResult result = indexer.analyzeAndRecommend();

        assertThat(result.getRecommendations()).hasSize(3);
        assertThat(result.getRecommendations())
                .filteredOn(rec -> rec.getType() == IndexType.COMPOSITE)
                .singleElement()
                .satisfies(rec -> {
                    assertThat(rec.getColumns()).containsExactly("customer_id", "status");
                    assertThat(rec.getPriority()).isEqualTo(Priority.HIGH);
                    assertThat(rec.getReason()).isEqualTo("Composite index for multiple WHERE columns (25 times)");
                    assertThat(rec.getSql()).isEqualTo(
                            "CREATE INDEX \"idx_orders_2cols\" ON \"orders\" (\"customer_id\", \"status\")");
                });
        assertThat(result.getSummary()).isEqualTo("Found 3 index recommendations, 3 high priority");
    }

    @Test
    void shouldNotRecommendWhatAnIndexAlreadyCovers() {
        SqliteAutoIndexer withIndex = new SqliteAutoIndexer(StaticSchemaCatalog.fromDdl(SCHEMA
                + "CREATE INDEX idx_orders_customer ON orders (customer_id);"));
        for (int i = 0; i < 25; i++) {
            withIndex.recordQuery("SELECT * FROM orders WHERE customer_id = ? AND status = ?", 10);
        }

        List<IndexRecommendation> recommendations = withIndex.analyzeAndRecommend().getRecommendations();

        assertThat(recommendations).extracting(IndexRecommendation::getColumns)
                .containsExactlyInAnyOrder(List.of("status"), List.of("customer_id", "status"));
    }

    @Test
    void shouldUseOnlyTheBusiestPatternPerTable() {
        record("SELECT * FROM orders WHERE status = ?", 10, 5);
        record("SELECT * FROM orders WHERE total > ?", 4, 5);

        assertThat(indexer.analyzeAndRecommend().getRecommendations())
                .extracting(IndexRecommendation::getColumns)
                .containsExactly(List.of("status"));
    }

    @Test
    void shouldRecommendOrderByAndJoinIndexes() {
        record("SELECT * FROM users ORDER BY created_at DESC", 6, 5);
        record("SELECT * FROM orders o JOIN customers c ON o.customer_id = c.id", 4, 5);

        List<IndexRecommendation> recommendations = indexer.analyzeAndRecommend().getRecommendations();

        assertThat(recommendations).anySatisfy(rec -> {
            assertThat(rec.getTable()).isEqualTo("users");
            assertThat(rec.getColumns()).containsExactly("created_at");
            assertThat(rec.getReason()).isEqualTo("Frequently ordered by column (6 times)");
        });
        assertThat(recommendations).anySatisfy(rec -> {
            assertThat(rec.getTable()).isEqualTo("orders");
            assertThat(rec.getColumns()).containsExactly("customer_id");
            assertThat(rec.getPriority()).isEqualTo(Priority.HIGH);
            assertThat(rec.getReason()).isEqualTo("Foreign key column used in joins (4 times)");
        });
        // Join recommendation scores 9 and ranks before the order-by one at 4
        assertThat(recommendations.get(0).getTable()).isEqualTo("orders");
    }

    @Test
    void shouldCapNumberOfRecommendations() {
        record("SELECT * FROM orders WHERE customer_id = ? AND status = ?", 25, 10);

        IndexAnalysisResult result = indexer.analyzeAndRecommend(
                IndexAnalysisOptions.builder().maxRecommendations(1).build());

        assertThat(result.getRecommendations()).hasSize(1);
        assertThat(result.getMissingIndexes()).hasSize(3);
    }

    @Test
    void shouldReportLongerIndexAsRedundant() {
        SqliteAutoIndexer redundant = new SqliteAutoIndexer(StaticSchemaCatalog.fromDdl("""
                CREATE TABLE events (id INTEGER PRIMARY KEY, kind TEXT, created_at INTEGER);
                CREATE INDEX idx_events_kind ON events (kind);
                CREATE INDEX idx_events_kind_created ON events (kind, created_at);
                """));

        IndexAnalysisResult result = redundant.analyzeAndRecommend();

        assertThat(result.getRedundantIndexes()).containsExactly("idx_events_kind_created");
        assertThat(result.getSummary())
                .isEqualTo("Found 0 index recommendations. 1 redundant indexes identified for removal");
    }

    @Test
    void shouldTurnFailedIndexLookupIntoWarning() {
        SchemaCatalog flaky = new SchemaCatalog() {
            @Override
            public List<String> listTables() {
                return List.of("orders", "broken");
            }

            @Override
            public List<ExistingIndex> listIndexes(String table) {
                if (table.equals("broken")) {
                    throw new IllegalStateException("database is locked");
                }
                return List.of();
            }

            @Override
            public String databaseIdentifier() {
                return "flaky.db";
            }
        };
        SqliteAutoIndexer flakyIndexer = new SqliteAutoIndexer(flaky);
        for (int i = 0; i < 3; i++) {
            flakyIndexer.recordQuery("SELECT * FROM orders WHERE status = ?", 5);
        }

        IndexAnalysisResult result = flakyIndexer.analyzeAndRecommend();

        assertThat(result.getRecommendations()).hasSize(1);
        assertThat(result.getWarnings()).containsExactly("Could not read indexes of table 'broken': database is locked");
        assertThat(flakyIndexer.getAnalysisHistory("flaky.db")).contains(result);
    }

    @Test
    void shouldFailWhenTablesCannotBeListed() {
        SchemaCatalog unavailable = new SchemaCatalog() {
            @Override
            public List<String> listTables() {
                throw new IllegalStateException("no such database");
            }

            @Override
            public List<ExistingIndex> listIndexes(String table) {
                return List.of();
            }

            @Override
            public String databaseIdentifier() {
                return "gone.db";
            }
        };

        assertThatThrownBy(() -> new SqliteAutoIndexer(unavailable).analyzeAndRecommend())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("no such database");
    }

    @Test
    void shouldRecordOnlyApplicationStatementsFromPool() {
        indexer.onQueryExecuted("SELECT * FROM users WHERE status = ?", 3);
        indexer.onQueryExecuted("UPDATE orders SET status = ? WHERE id = ?", 3);
        indexer.onQueryExecuted("PRAGMA index_list('users')", 1);
        indexer.onQueryExecuted("SELECT name FROM sqlite_master WHERE type = 'table'", 1);
        indexer.onQueryExecuted("CREATE INDEX idx_x ON users (status)", 1);

        assertThat(indexer.getQueryPatterns()).extracting(QueryPattern::getTable)
                .containsExactly("users", "orders");
    }

    @Test
    void shouldKeepHistoryAndStatistics() {
        record("SELECT * FROM users WHERE status = ?", 4, 1500);
        record("SELECT * FROM orders WHERE id = ?", 2, 10);

        IndexAnalysisResult result = indexer.analyzeAndRecommend();
        QueryPatternStats stats = indexer.getQueryPatternStats();

        assertThat(indexer.getAnalysisHistory("unknown")).contains(result);
        assertThat(indexer.getAnalysisHistory("other.db")).isEmpty();
        assertThat(stats.totalPatterns()).isEqualTo(2);
        assertThat(stats.totalQueries()).isEqualTo(6);
        assertThat(stats.averageFrequency()).isEqualTo(3.0);
        assertThat(stats.slowQueries()).isEqualTo(1);

        indexer.clearAnalysisData();

        assertThat(indexer.getQueryPatterns()).isEmpty();
        assertThat(indexer.getAnalysisHistory("unknown")).isEmpty();
        assertThat(indexer.getQueryPatternStats().averageFrequency()).isZero();
    }

    @Test
    void shouldGradePriorityAndImpact() {
        QueryPattern slow = new QueryPattern("select ...", "t", 6000);
        QueryPattern busy = new QueryPattern("select ...", "t", 10);
        busy.setFrequency(21);

        assertThat(SqliteAutoIndexer.wherePriority(slow)).isEqualTo(Priority.CRITICAL);
        assertThat(SqliteAutoIndexer.wherePriority(busy)).isEqualTo(Priority.HIGH);
        assertThat(SqliteAutoIndexer.estimateImpact(slow)).isEqualTo(ImpactLevel.HIGH);
        assertThat(SqliteAutoIndexer.estimateImpact(busy)).isEqualTo(ImpactLevel.HIGH);
        assertThat(SqliteAutoIndexer.generateIndexName("t", List.of("a", "b", "c"))).isEqualTo("idx_t_3cols");
    }
}
