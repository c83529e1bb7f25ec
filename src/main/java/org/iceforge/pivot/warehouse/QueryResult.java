package org.iceforge.pivot.warehouse;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by the warehouse, keyed by output column label in SELECT order.
 */
public record QueryResult(String sql,
                          List<String> columns,
                          List<Map<String, Object>> rows,
                          int rowCount,
                          long executionTimeMs) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
