package org.iceforge.pivot.model;

import java.util.Objects;

public record Measure(String name, String column, Aggregator aggregator, String formatString, String caption) {

    public Measure {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(aggregator, "aggregator");
    }
}
