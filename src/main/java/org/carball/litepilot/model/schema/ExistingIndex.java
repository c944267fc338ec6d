package org.carball.litepilot.model.schema;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ExistingIndex {
    private String name;
    private String table;
    private List<String> columns;
    private boolean unique;

    /**
     * How the index came to exist: {@code c} for CREATE INDEX, {@code u} for a UNIQUE constraint,
     * {@code pk} for a PRIMARY KEY.
     */
    @Builder.Default
    private String origin = "c";

    public boolean isEngineManaged() {
        return name != null && name.startsWith("sqlite_");
    }

    public boolean coversExactly(String tableName, List<String> columnNames) {
        if (table == null || !table.equalsIgnoreCase(tableName) || columns.size() != columnNames.size()) {
            return false;
        }
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).equalsIgnoreCase(columnNames.get(i))) {
                return false;
            }
        }
        return true;
    }
}
