package org.carball.litepilot.model.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text plus positional parameters, as produced by a query compiler.
 * Parameters may contain {@code null}.
 */
public record CompiledQuery(String sql, List<Object> parameters) {

    public CompiledQuery {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL text must not be empty");
        }
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static CompiledQuery raw(String sql) {
        return new CompiledQuery(sql, List.of());
    }

    public static CompiledQuery of(String sql, Object... parameters) {
        List<Object> values = new ArrayList<>(parameters.length);
        Collections.addAll(values, parameters);
        return new CompiledQuery(sql, values);
    }
}
