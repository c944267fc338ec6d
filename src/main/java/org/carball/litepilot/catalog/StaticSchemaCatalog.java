package org.carball.litepilot.catalog;

import org.carball.litepilot.model.schema.DatabaseSchema;
import org.carball.litepilot.model.schema.ExistingIndex;
import org.carball.litepilot.model.schema.Table;
import org.carball.litepilot.parser.SchemaParser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Catalog backed by a parsed schema, for analysing query logs without opening the database.
 */
public class StaticSchemaCatalog implements SchemaCatalog {

    private final DatabaseSchema schema;
    private final String identifier;

    public StaticSchemaCatalog(DatabaseSchema schema, String identifier) {
        this.schema = schema;
        this.identifier = identifier;
    }

    public static StaticSchemaCatalog fromDdl(Path ddlFile) throws IOException {
        return new StaticSchemaCatalog(SchemaParser.parseDDL(ddlFile), ddlFile.toString());
    }

    public static StaticSchemaCatalog fromDdl(String ddl) {
        return new StaticSchemaCatalog(SchemaParser.parseDDL(ddl), SqliteSchemaCatalog.UNKNOWN_DATABASE);
    }

    @Override
    public List<String> listTables() {
        return schema.getTables().stream().map(Table::getName).toList();
    }

    @Override
    public List<ExistingIndex> listIndexes(String table) {
        Table found = schema.findTable(table);
        return found == null ? List.of() : List.copyOf(found.getIndexes());
    }

    @Override
    public String databaseIdentifier() {
        return identifier;
    }
}
