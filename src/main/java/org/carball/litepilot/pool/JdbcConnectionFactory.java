package org.carball.litepilot.pool;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens SQLite connections through the xerial JDBC driver.
 */
@Slf4j
public class JdbcConnectionFactory implements ConnectionFactory {

    public static final String MEMORY_DATABASE = ":memory:";

    private final String databasePath;

    public JdbcConnectionFactory(String databasePath) {
        this.databasePath = databasePath == null || databasePath.isBlank() ? MEMORY_DATABASE : databasePath;
    }

    @Override
    public Connection create() throws SQLException {
        if (!isMemoryDatabase()) {
            File parent = new File(databasePath).getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                log.warn("Could not create directory {} for database file", parent);
            }
        }
        return DriverManager.getConnection(getJdbcUrl());
    }

    @Override
    public boolean isReentrant() {
        return !isMemoryDatabase();
    }

    public String getJdbcUrl() {
        return "jdbc:sqlite:" + databasePath;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    private boolean isMemoryDatabase() {
        return MEMORY_DATABASE.equals(databasePath) || databasePath.startsWith("file::memory:");
    }
}
