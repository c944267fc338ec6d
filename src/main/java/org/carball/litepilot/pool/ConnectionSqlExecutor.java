package org.carball.litepilot.pool;

import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;

/**
 * Runs statements synchronously on a JDBC connection owned by the caller. The connection is never
 * closed here.
 */
public class ConnectionSqlExecutor implements SqlExecutor {

    private final PooledConnection connection;

    public ConnectionSqlExecutor(Connection connection) {
        this.connection = new PooledConnection(0, connection);
    }

    @Override
    public synchronized CompletableFuture<QueryResult> execute(CompiledQuery query) {
        try {
            return CompletableFuture.completedFuture(connection.execute(query));
        } catch (SQLException e) {
            return CompletableFuture.failedFuture(
                    new DatabaseAccessException("Query failed: " + e.getMessage(), e));
        }
    }
}
