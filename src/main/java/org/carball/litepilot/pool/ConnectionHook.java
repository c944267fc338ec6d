package org.carball.litepilot.pool;

import java.sql.SQLException;

/**
 * Caller-supplied setup run on every new connection, after the baseline PRAGMAs.
 */
@FunctionalInterface
public interface ConnectionHook {

    void onCreate(PooledConnection connection) throws SQLException;
}
