package org.carball.litepilot.catalog;

import org.carball.litepilot.model.schema.ExistingIndex;

import java.util.List;

/**
 * Read-only view of the tables and indexes of one database.
 */
public interface SchemaCatalog {

    /**
     * User tables, without the engine's own {@code sqlite_} tables.
     */
    List<String> listTables();

    /**
     * Every index on {@code table}, engine-created ones included, columns in index order.
     */
    List<ExistingIndex> listIndexes(String table);

    /**
     * Best-effort identity of the database, used to key analysis history; {@code "unknown"} when
     * there is none.
     */
    String databaseIdentifier();
}
