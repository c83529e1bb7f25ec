package org.iceforge.pivot.model;

import java.util.List;

/**
 * Caller-supplied pivot layout. Order of every list is significant: it is the display order
 * and the compiler never reorders it.
 */
public record PivotConfig(List<PivotField> rows,
                          List<PivotField> columns,
                          List<String> measures,
                          List<PivotFilter> filters) {

    public PivotConfig {
        rows = rows == null ? List.of() : List.copyOf(rows);
        columns = columns == null ? List.of() : List.copyOf(columns);
        measures = measures == null ? List.of() : List.copyOf(measures);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
