package org.carball.litepilot;

import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.analyzer.IndexApplier;
import org.carball.litepilot.analyzer.SqliteAutoIndexer;
import org.carball.litepilot.analyzer.SqliteAutoOptimizer;
import org.carball.litepilot.catalog.SchemaCatalog;
import org.carball.litepilot.catalog.SqliteSchemaCatalog;
import org.carball.litepilot.concurrent.WriteMutexRegistry;
import org.carball.litepilot.config.IndexAnalysisOptions;
import org.carball.litepilot.config.LitePilotConfig;
import org.carball.litepilot.config.OptimizationConfig;
import org.carball.litepilot.config.PoolConfig;
import org.carball.litepilot.model.optimization.OptimizationResult;
import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;
import org.carball.litepilot.model.recommendation.IndexAnalysisResult;
import org.carball.litepilot.pool.PoolSqlExecutor;
import org.carball.litepilot.pool.PooledConnection;
import org.carball.litepilot.pool.SqlExecutor;
import org.carball.litepilot.pool.SqliteConnectionPool;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * One managed SQLite database: a connection pool whose executions feed an index recommender, and
 * an optimizer for its engine settings.
 * <p>
 * Create one instance per database and share the {@link WriteMutexRegistry} between every instance
 * in the process.
 */
@Slf4j
public class SqliteAutopilot implements AutoCloseable {

    private final SqliteConnectionPool pool;
    private final SqlExecutor executor;
    private final SchemaCatalog catalog;
    private final SqliteAutoIndexer indexer;
    private final SqliteAutoOptimizer optimizer;
    private final OptimizationConfig optimizationConfig;

    public SqliteAutopilot(PoolConfig poolConfig, WriteMutexRegistry mutexRegistry,
                           OptimizationConfig optimizationConfig) {
        this.pool = new SqliteConnectionPool(poolConfig, mutexRegistry);
        this.executor = new PoolSqlExecutor(pool);
        this.catalog = new SqliteSchemaCatalog(executor);
        this.indexer = new SqliteAutoIndexer(catalog);
        this.optimizer = new SqliteAutoOptimizer(executor, catalog);
        this.optimizationConfig = optimizationConfig;
        pool.addQueryListener(indexer);
    }

    public SqliteAutopilot(LitePilotConfig config, WriteMutexRegistry mutexRegistry) {
        this(config.toPoolConfig(), mutexRegistry, config.getOptimization());
    }

    public SqliteAutopilot open() throws SQLException {
        pool.init();
        return this;
    }

    @Override
    public void close() {
        pool.destroy();
    }

    /**
     * Runs one statement on a pooled connection.
     */
    public CompletableFuture<QueryResult> execute(CompiledQuery query) {
        return executor.execute(query);
    }

    /**
     * Runs {@code work} inside an immediate transaction on one connection. The transaction commits
     * when the returned future completes normally and rolls back otherwise.
     */
    public <T> CompletableFuture<T> inTransaction(Function<PooledConnection, CompletableFuture<T>> work) {
        return pool.acquireConnection().thenCompose(connection ->
                pool.beginTransaction(connection)
                        .thenCompose(ignored -> work.apply(connection))
                        .thenCompose(value -> pool.commitTransaction(connection).thenApply(committed -> value))
                        .handle((value, error) -> {
                            if (error == null) {
                                return CompletableFuture.completedFuture(value);
                            }
                            if (!connection.holdsWriteMutex()) {
                                // BEGIN never succeeded, nothing to roll back
                                return CompletableFuture.<T>failedFuture(error);
                            }
                            return pool.rollbackTransaction(connection)
                                    .exceptionally(rollbackError -> {
                                        log.warn("Rollback after failed transaction also failed: {}",
                                                rollbackError.getMessage());
                                        return null;
                                    })
                                    .thenCompose(ignored -> CompletableFuture.<T>failedFuture(error));
                        })
                        .thenCompose(Function.identity())
                        .whenComplete((value, error) -> pool.releaseConnection(connection)));
    }

    /**
     * Tunes the engine settings and, when automatic indexing is on, analyses the recorded queries.
     */
    public MaintenanceReport runMaintenance(IndexAnalysisOptions options) {
        OptimizationResult optimization = optimizer.optimizeDatabase(optimizationConfig);
        IndexAnalysisResult analysis = optimizationConfig.isEnableAutoIndexing()
                ? indexer.analyzeAndRecommend(options)
                : null;
        return new MaintenanceReport(optimization, analysis);
    }

    public MaintenanceReport runMaintenance() {
        return runMaintenance(IndexAnalysisOptions.defaults());
    }

    public IndexApplier indexApplier() {
        return new IndexApplier(executor);
    }

    public SqliteConnectionPool getPool() {
        return pool;
    }

    public SqlExecutor getExecutor() {
        return executor;
    }

    public SchemaCatalog getCatalog() {
        return catalog;
    }

    public SqliteAutoIndexer getIndexer() {
        return indexer;
    }

    public SqliteAutoOptimizer getOptimizer() {
        return optimizer;
    }
}
