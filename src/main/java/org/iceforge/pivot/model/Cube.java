package org.iceforge.pivot.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable cube definition. A re-upload produces a new instance which replaces this one in
 * the registry; instances are never modified after construction.
 */
public record Cube(String name,
                   String factTable,
                   List<Dimension> dimensions,
                   List<Measure> measures,
                   String caption) {

    public Cube {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factTable, "factTable");
        dimensions = List.copyOf(dimensions);
        measures = List.copyOf(measures);
    }

    public Optional<Dimension> findDimension(String dimensionName) {
        return dimensions.stream().filter(d -> d.name().equals(dimensionName)).findFirst();
    }

    public Optional<Measure> findMeasure(String measureName) {
        return measures.stream().filter(m -> m.name().equals(measureName)).findFirst();
    }

    /**
     * Every physical table the cube may touch: the fact table and each dimension table.
     */
    public Set<String> tables() {
        Set<String> out = new LinkedHashSet<>();
        out.add(factTable);
        for (Dimension d : dimensions) {
            out.add(d.table());
        }
        return out;
    }

    /**
     * Known columns of one of this cube's tables, derived from the declared metadata.
     */
    public Set<String> columnsOf(String table) {
        Set<String> out = new LinkedHashSet<>();
        if (factTable.equals(table)) {
            for (Measure m : measures) {
                out.add(m.column());
            }
            for (Dimension d : dimensions) {
                if (d.foreignKey() != null) {
                    out.add(d.foreignKey());
                }
            }
        }
        for (Dimension d : dimensions) {
            if (!d.table().equals(table)) {
                continue;
            }
            if (!d.table().equals(factTable)) {
                out.add(d.primaryKey());
            }
            for (Level l : d.levels()) {
                out.add(l.column());
                if (l.ordinalColumn() != null) {
                    out.add(l.ordinalColumn());
                }
            }
        }
        return out;
    }
}
