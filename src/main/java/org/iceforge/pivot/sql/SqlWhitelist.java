package org.iceforge.pivot.sql;

import org.iceforge.pivot.model.Cube;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tables and columns a generated statement may reference, stored under the names the
 * warehouse resolves them to. A metadata name that is a plain word is emitted unquoted and
 * therefore folds to lower case; any other name is emitted quoted and keeps its exact spelling.
 * Lookups take names already resolved the same way (unquoted parts folded, quoted parts kept).
 * A table may be referenced by its bare name or qualified with its schema.
 */
public final class SqlWhitelist {

    private final Map<String, Set<String>> columnsByTable;

    private SqlWhitelist(Map<String, Set<String>> columnsByTable) {
        this.columnsByTable = Collections.unmodifiableMap(columnsByTable);
    }

    public static SqlWhitelist forCubes(Collection<Cube> cubes, String defaultSchema) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (Cube cube : cubes) {
            for (String table : cube.tables()) {
                Set<String> cols = new LinkedHashSet<>();
                for (String c : cube.columnsOf(table)) {
                    cols.add(resolve(c));
                }
                for (String name : namesFor(table, defaultSchema)) {
                    map.computeIfAbsent(name, k -> new LinkedHashSet<>()).addAll(cols);
                }
            }
        }
        return new SqlWhitelist(map);
    }

    /**
     * Columns of a whitelisted table, empty when the table is not whitelisted.
     */
    public Optional<Set<String>> columnsOf(String resolvedTable) {
        return Optional.ofNullable(columnsByTable.get(resolvedTable));
    }

    /**
     * Name a metadata identifier has in the warehouse once rendered by {@link SqlIdentifiers}.
     */
    static String resolve(String metadataName) {
        String name = metadataName.trim();
        return SqlIdentifiers.isPlain(name) ? name.toLowerCase(Locale.ROOT) : name;
    }

    private static Set<String> namesFor(String table, String defaultSchema) {
        Set<String> names = new LinkedHashSet<>();
        int dot = table.lastIndexOf('.');
        if (dot >= 0) {
            String base = resolve(table.substring(dot + 1));
            names.add(resolve(table.substring(0, dot)) + "." + base);
            names.add(base);
        } else {
            String base = resolve(table);
            names.add(base);
            if (defaultSchema != null && !defaultSchema.isBlank()) {
                names.add(resolve(defaultSchema) + "." + base);
            }
        }
        return names;
    }
}
