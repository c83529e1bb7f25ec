package org.iceforge.pivot.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A joined lookup table whose levels form a single ordered hierarchy, coarsest first.
 * {@code foreignKey} is null only for degenerate dimensions living on the fact table.
 */
public record Dimension(String name,
                        String table,
                        String foreignKey,
                        String primaryKey,
                        List<Level> levels,
                        String caption) {

    public static final String DEFAULT_PRIMARY_KEY = "id";

    public Dimension {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(table, "table");
        primaryKey = primaryKey == null ? DEFAULT_PRIMARY_KEY : primaryKey;
        levels = List.copyOf(levels);
    }

    public Optional<Level> findLevel(String levelName) {
        return levels.stream().filter(l -> l.name().equals(levelName)).findFirst();
    }

    /**
     * Position of the level in the hierarchy, or -1.
     */
    public int levelIndex(String levelName) {
        for (int i = 0; i < levels.size(); i++) {
            if (levels.get(i).name().equals(levelName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The level a drill on {@code levelName} expands into; empty for the finest level
     * or an unknown one.
     */
    public Optional<Level> nextLevel(String levelName) {
        int idx = levelIndex(levelName);
        if (idx < 0 || idx + 1 >= levels.size()) {
            return Optional.empty();
        }
        return Optional.of(levels.get(idx + 1));
    }
}
