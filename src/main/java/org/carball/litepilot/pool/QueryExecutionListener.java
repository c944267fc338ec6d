package org.carball.litepilot.pool;

/**
 * Notified after each statement the pool executes successfully.
 */
@FunctionalInterface
public interface QueryExecutionListener {

    void onQueryExecuted(String sql, double executionTimeMs);
}
