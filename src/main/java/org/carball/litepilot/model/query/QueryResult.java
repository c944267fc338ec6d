package org.carball.litepilot.model.query;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement. Row-returning statements fill {@code rows}; other statements report
 * the affected row count and, when rows changed, the last inserted rowid.
 */
public record QueryResult(List<Map<String, Object>> rows, Long numAffectedRows, Long insertId) {

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static QueryResult ofRows(List<Map<String, Object>> rows) {
        return new QueryResult(rows, null, null);
    }

    public static QueryResult ofUpdate(long affectedRows, Long insertId) {
        return new QueryResult(List.of(), affectedRows, insertId);
    }

    /**
     * Value of {@code column} in the first row, falling back to the first column of that row.
     * Returns {@code null} when there are no rows.
     */
    public Object firstValue(String column) {
        if (rows.isEmpty()) {
            return null;
        }
        Map<String, Object> row = rows.get(0);
        if (column != null && row.containsKey(column)) {
            return row.get(column);
        }
        return row.isEmpty() ? null : row.values().iterator().next();
    }
}
