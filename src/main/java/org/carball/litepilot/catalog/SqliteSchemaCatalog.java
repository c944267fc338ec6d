package org.carball.litepilot.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.model.query.QueryResult;
import org.carball.litepilot.model.schema.ExistingIndex;
import org.carball.litepilot.pool.DatabaseAccessException;
import org.carball.litepilot.pool.SqlExecutor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reads the catalog of a live database through {@code sqlite_master} and the index PRAGMAs.
 */
@Slf4j
@RequiredArgsConstructor
public class SqliteSchemaCatalog implements SchemaCatalog {

    public static final String UNKNOWN_DATABASE = "unknown";

    private final SqlExecutor executor;

    @Override
    public List<String> listTables() {
        QueryResult result = executor.executeAndWait(
                "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name");
        List<String> tables = new ArrayList<>();
        for (Map<String, Object> row : result.rows()) {
            tables.add(String.valueOf(row.get("name")));
        }
        return tables;
    }

    @Override
    public List<ExistingIndex> listIndexes(String table) {
        QueryResult indexList = executor.executeAndWait("PRAGMA index_list(" + quoteLiteral(table) + ")");
        List<ExistingIndex> indexes = new ArrayList<>();

        for (Map<String, Object> row : indexList.rows()) {
            String name = String.valueOf(row.get("name"));
            indexes.add(ExistingIndex.builder()
                    .name(name)
                    .table(table)
                    .columns(indexColumns(name))
                    .unique(toInt(row.get("unique")) == 1)
                    .origin(row.get("origin") != null ? row.get("origin").toString() : "c")
                    .build());
        }
        return indexes;
    }

    @Override
    public String databaseIdentifier() {
        try {
            QueryResult result = executor.executeAndWait("PRAGMA database_list");
            return result.rows().stream()
                    .filter(row -> toInt(row.get("seq")) == 0)
                    .map(row -> row.get("file"))
                    .filter(file -> file != null && !file.toString().isEmpty())
                    .map(Object::toString)
                    .findFirst()
                    .orElse(UNKNOWN_DATABASE);
        } catch (DatabaseAccessException e) {
            log.debug("Could not read database identity: {}", e.getMessage());
            return UNKNOWN_DATABASE;
        }
    }

    private List<String> indexColumns(String indexName) {
        QueryResult info = executor.executeAndWait("PRAGMA index_info(" + quoteLiteral(indexName) + ")");
        return info.rows().stream()
                .sorted(Comparator.comparingInt(row -> toInt(row.get("seqno"))))
                .map(row -> row.get("name"))
                // expression columns have no name
                .map(name -> name == null ? "<expr>" : name.toString())
                .toList();
    }

    static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static int toInt(Object value) {
        return value instanceof Number number ? number.intValue() : -1;
    }
}
