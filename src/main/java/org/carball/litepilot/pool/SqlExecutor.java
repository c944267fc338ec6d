package org.carball.litepilot.pool;

import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Something that can run one statement against a database, used by the catalog, the indexer and
 * the optimizer so they do not care whether they sit on a pool or on a plain JDBC connection.
 */
public interface SqlExecutor {

    CompletableFuture<QueryResult> execute(CompiledQuery query);

    default CompletableFuture<QueryResult> execute(String sql) {
        return execute(CompiledQuery.raw(sql));
    }

    /**
     * Runs {@code sql} and waits for it.
     *
     * @throws DatabaseAccessException if the statement failed
     */
    default QueryResult executeAndWait(String sql) {
        try {
            return execute(sql).join();
        } catch (CompletionException e) {
            throw DatabaseAccessException.from(e.getCause() != null ? e.getCause() : e);
        }
    }
}
