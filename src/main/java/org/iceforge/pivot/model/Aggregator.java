package org.iceforge.pivot.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of measure aggregators. The schema attribute value (e.g. {@code distinct-count})
 * maps one to one onto a SQL aggregate.
 */
public enum Aggregator {
    SUM("sum"),
    COUNT("count"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    DISTINCT_COUNT("distinct-count");

    private final String schemaName;

    Aggregator(String schemaName) {
        this.schemaName = schemaName;
    }

    public String apply(String columnRef) {
        if (this == DISTINCT_COUNT) {
            return "COUNT(DISTINCT " + columnRef + ")";
        }
        return name() + "(" + columnRef + ")";
    }

    public static Optional<Aggregator> fromSchemaName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(a -> a.schemaName.equals(normalized))
                .findFirst();
    }
}
