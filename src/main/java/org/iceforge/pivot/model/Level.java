package org.iceforge.pivot.model;

import java.util.Objects;

/**
 * One granularity of a hierarchy, e.g. Year. {@code ordinalColumn} may be null.
 */
public record Level(String name, String column, String ordinalColumn, String caption) {

    public Level {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(column, "column");
    }
}
