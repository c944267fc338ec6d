package org.carball.litepilot.pool;

import lombok.RequiredArgsConstructor;
import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;

import java.util.concurrent.CompletableFuture;

/**
 * Runs every statement on a connection borrowed from the pool for just that statement.
 * <p>
 * Connection-scoped PRAGMA assignments reach every pooled connection, the pool carries them over
 * before each connection's next statement.
 */
@RequiredArgsConstructor
public class PoolSqlExecutor implements SqlExecutor {

    private final SqliteConnectionPool pool;

    @Override
    public CompletableFuture<QueryResult> execute(CompiledQuery query) {
        return pool.acquireConnection().thenCompose(connection ->
                pool.executeQuery(connection, query)
                        .whenComplete((result, error) -> pool.releaseConnection(connection)));
    }
}
