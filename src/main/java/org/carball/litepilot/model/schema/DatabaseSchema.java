package org.carball.litepilot.model.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DatabaseSchema {
    private List<Table> tables = new ArrayList<>();

    public void addTable(Table table) {
        tables.add(table);
    }

    public Table findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }
}
