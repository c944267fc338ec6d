package org.carball.litepilot.pool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens physical connections to one database.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection create() throws SQLException;

    /**
     * Whether repeated {@link #create()} calls reach the same database. A factory that cannot
     * (an in-memory database opens a fresh one per connection) limits its pool to one connection.
     */
    default boolean isReentrant() {
        return true;
    }
}
