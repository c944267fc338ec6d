package org.carball.litepilot.pool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One physical SQLite connection owned by a {@link SqliteConnectionPool}.
 * <p>
 * Between acquire and release the connection belongs to a single caller; it is never used by two
 * callers at once, so statement execution here is plain blocking JDBC.
 */
@Slf4j
public class PooledConnection {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final int id;
    private final Connection connection;
    private volatile boolean holdsWriteMutex;
    private volatile boolean closed;
    private volatile int settingsVersion;

    PooledConnection(int id, Connection connection) {
        this.id = id;
        this.connection = connection;
    }

    public int getId() {
        return id;
    }

    /**
     * True while this connection owns the process-wide write mutex of its database.
     */
    public boolean holdsWriteMutex() {
        return holdsWriteMutex;
    }

    void setHoldsWriteMutex(boolean holdsWriteMutex) {
        this.holdsWriteMutex = holdsWriteMutex;
    }

    /**
     * Version of the pool's connection settings last applied to this connection.
     */
    int getSettingsVersion() {
        return settingsVersion;
    }

    void setSettingsVersion(int settingsVersion) {
        this.settingsVersion = settingsVersion;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Runs one statement on this connection, blocking until SQLite returns.
     */
    public QueryResult execute(CompiledQuery query) throws SQLException {
        if (closed) {
            throw new SQLException("Connection " + id + " is closed");
        }
        try (PreparedStatement statement = connection.prepareStatement(query.sql())) {
            bindParameters(statement, query.parameters());
            if (statement.execute()) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    return QueryResult.ofRows(readRows(resultSet));
                }
            }
            int updateCount = statement.getUpdateCount();
            long affected = Math.max(updateCount, 0);
            Long insertId = affected > 0 ? lastInsertRowid() : null;
            return QueryResult.ofUpdate(affected, insertId);
        }
    }

    /**
     * Runs a statement that has no parameters and whose result is not needed (PRAGMA setup, BEGIN...).
     */
    public void executeRaw(String sql) throws SQLException {
        if (closed) {
            throw new SQLException("Connection " + id + " is closed");
        }
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close SQLite connection {}: {}", id, e.getMessage());
        }
    }

    private Long lastInsertRowid() throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : null;
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(metaData.getColumnLabel(i), resultSet.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    static void bindParameters(PreparedStatement statement, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            int index = i + 1;
            Object value = parameters.get(i);

            if (value == null) {
                statement.setNull(index, Types.NULL);
            } else if (value instanceof Boolean b) {
                statement.setInt(index, b ? 1 : 0);
            } else if (value instanceof BigInteger big) {
                if (big.bitLength() < Long.SIZE) {
                    statement.setLong(index, big.longValue());
                } else {
                    statement.setString(index, big.toString());
                }
            } else if (value instanceof BigDecimal decimal) {
                statement.setString(index, decimal.toPlainString());
            } else if (value instanceof Double || value instanceof Float) {
                statement.setDouble(index, ((Number) value).doubleValue());
            } else if (value instanceof Number number) {
                statement.setLong(index, number.longValue());
            } else if (value instanceof String text) {
                statement.setString(index, text);
            } else if (value instanceof byte[] blob) {
                statement.setBytes(index, blob);
            } else if (value instanceof java.sql.Date || value instanceof java.sql.Time) {
                // toInstant() is unsupported on these
                statement.setString(index, value.toString());
            } else if (value instanceof Date date) {
                statement.setString(index, date.toInstant().toString());
            } else if (value instanceof TemporalAccessor temporal) {
                statement.setString(index, temporal.toString());
            } else {
                statement.setString(index, toJson(value));
            }
        }
    }

    private static String toJson(Object value) throws SQLException {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot bind parameter of type " + value.getClass().getName(), e);
        }
    }
}
