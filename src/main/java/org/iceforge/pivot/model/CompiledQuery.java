package org.iceforge.pivot.model;

import java.util.List;

/**
 * SQL emitted for one pivot, with the output columns in SELECT order and the measure aliases.
 */
public record CompiledQuery(String cube, String sql, List<String> columns, List<String> measureAliases) {

    public CompiledQuery {
        columns = List.copyOf(columns);
        measureAliases = List.copyOf(measureAliases);
    }
}
