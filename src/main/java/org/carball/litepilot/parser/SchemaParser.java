package org.carball.litepilot.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.litepilot.model.schema.Column;
import org.carball.litepilot.model.schema.DatabaseSchema;
import org.carball.litepilot.model.schema.ExistingIndex;
import org.carball.litepilot.model.schema.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds a {@link DatabaseSchema} from SQLite DDL, including the indexes SQLite would create for it.
 * <p>
 * UNIQUE constraints and non-rowid primary keys get the {@code sqlite_autoindex_<table>_<n>} names
 * the engine gives them, so a parsed schema lists the same indexes a live database would.
 */
@Slf4j
public class SchemaParser {

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    public static DatabaseSchema parseDDL(Path ddlFile) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDDL(content);
    }

    public static DatabaseSchema parseDDL(String ddlContent) {
        DatabaseSchema schema = new DatabaseSchema();

        try {
            Statements statements = CCJSqlParserUtil.parseStatements(preprocessDDL(ddlContent));

            // First pass: tables, so that indexes can find them
            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    Table table = convertTable(createTable);
                    schema.addTable(table);
                    log.debug("Parsed table: {}", table.getName());
                }
            }

            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateIndex createIndex) {
                    processCreateIndex(createIndex, schema);
                }
            }

        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        return schema;
    }

    private static String preprocessDDL(String ddlContent) {
        // Table options JSqlParser does not know about
        String processed = ddlContent.replaceAll("(?i)\\)\\s*WITHOUT\\s+ROWID", ")");
        processed = processed.replaceAll("(?i)\\)\\s*STRICT\\b", ")");
        processed = processed.replaceAll("(?i)\\bAUTOINCREMENT\\b", "");
        return processed.replaceAll("\\s+", " ");
    }

    private static Table convertTable(CreateTable createTable) {
        String tableName = cleanIdentifier(createTable.getTable().getName());
        Table table = new Table(tableName);
        int autoIndexNumber = 0;

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                Column column = convertColumn(colDef);
                table.addColumn(column);

                if (column.isPrimaryKey() && !isRowidAlias(column)) {
                    table.addIndex(autoIndex(tableName, ++autoIndexNumber, List.of(column.getName()), "pk"));
                }
                if (column.isUnique()) {
                    table.addIndex(autoIndex(tableName, ++autoIndexNumber, List.of(column.getName()), "u"));
                }
            }
        }

        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if (index instanceof ForeignKeyIndex) {
                    continue;
                }
                List<String> columns = columnNames(index);
                if ("PRIMARY KEY".equalsIgnoreCase(index.getType())) {
                    processPrimaryKey(columns, table);
                    if (columns.size() > 1 || !isRowidAlias(table.getPrimaryKey())) {
                        table.addIndex(autoIndex(tableName, ++autoIndexNumber, columns, "pk"));
                    }
                } else if ("UNIQUE".equalsIgnoreCase(index.getType())) {
                    table.addIndex(autoIndex(tableName, ++autoIndexNumber, columns, "u"));
                }
            }
        }

        return table;
    }

    private static Column convertColumn(ColumnDefinition colDef) {
        Column.ColumnBuilder builder = Column.builder()
                .name(cleanIdentifier(colDef.getColumnName()))
                .dataType(colDef.getColDataType().getDataType())
                .nullable(true);

        if (colDef.getColumnSpecs() != null) {
            List<String> specs = colDef.getColumnSpecs();
            for (int i = 0; i < specs.size(); i++) {
                String upperSpec = specs.get(i).toUpperCase(Locale.ROOT);

                if (upperSpec.equals("NOT NULL")) {
                    builder.nullable(false);
                } else if (upperSpec.equals("NOT") && i + 1 < specs.size()
                        && specs.get(i + 1).equalsIgnoreCase("NULL")) {
                    builder.nullable(false);
                } else if (upperSpec.equals("PRIMARY") || upperSpec.contains("PRIMARY KEY")) {
                    builder.primaryKey(true);
                } else if (upperSpec.equals("UNIQUE")) {
                    builder.unique(true);
                }
            }
        }

        return builder.build();
    }

    private static void processPrimaryKey(List<String> pkColumns, Table table) {
        if (pkColumns.size() != 1) {
            return;
        }
        String pkColumn = pkColumns.get(0);
        table.getColumns().stream()
                .filter(c -> c.getName().equalsIgnoreCase(pkColumn))
                .findFirst()
                .ifPresent(c -> {
                    c.setPrimaryKey(true);
                    table.setPrimaryKey(c);
                });
    }

    private static void processCreateIndex(CreateIndex createIndex, DatabaseSchema schema) {
        String tableName = cleanIdentifier(createIndex.getTable().getName());
        Table table = schema.findTable(tableName);
        if (table == null) {
            log.warn("Index {} refers to unknown table {}", createIndex.getIndex().getName(), tableName);
            return;
        }

        Index index = createIndex.getIndex();
        boolean unique = "UNIQUE".equalsIgnoreCase(index.getType())
                || createIndex.toString().toUpperCase(Locale.ROOT).startsWith("CREATE UNIQUE");

        table.addIndex(ExistingIndex.builder()
                .name(cleanIdentifier(index.getName()))
                .table(table.getName())
                .columns(columnNames(index))
                .unique(unique)
                .build());
        log.debug("Parsed index {} on {}", index.getName(), table.getName());
    }

    private static ExistingIndex autoIndex(String tableName, int number, List<String> columns, String origin) {
        return ExistingIndex.builder()
                .name("sqlite_autoindex_" + tableName + "_" + number)
                .table(tableName)
                .columns(columns)
                .unique(true)
                .origin(origin)
                .build();
    }

    // INTEGER PRIMARY KEY aliases the rowid and gets no separate index
    private static boolean isRowidAlias(Column column) {
        return column != null && column.getDataType() != null
                && column.getDataType().equalsIgnoreCase("INTEGER");
    }

    private static List<String> columnNames(Index index) {
        return index.getColumns().stream()
                .map(Index.ColumnParams::getColumnName)
                .map(SchemaParser::cleanIdentifier)
                .collect(Collectors.toList());
    }

    private static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;

        return identifier.replaceAll("[\\[\\]`\"]", "");
    }
}
